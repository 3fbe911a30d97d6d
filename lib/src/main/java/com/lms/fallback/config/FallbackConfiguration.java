package com.lms.fallback.config;

import java.time.Duration;

/**
 * Configuration for the fallback storage coordinator.
 * Holds the bounded timeouts applied to primary and cache calls, the TTL of
 * mirrored cache entries, and the sizes of the separate primary and cache worker pools.
 */
public class FallbackConfiguration {
    
    private final Duration primaryTimeout;
    private final Duration cacheTimeout;
    private final Duration cacheTtl;
    private final int workerThreads;
    private final int cacheWorkerThreads;
    private final CircuitBreakerConfig circuitBreakerConfig;
    
    private FallbackConfiguration(Builder builder) {
        this.primaryTimeout = builder.primaryTimeout;
        this.cacheTimeout = builder.cacheTimeout;
        this.cacheTtl = builder.cacheTtl;
        this.workerThreads = builder.workerThreads;
        this.cacheWorkerThreads = builder.cacheWorkerThreads;
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
    }
    
    public Duration getPrimaryTimeout() {
        return primaryTimeout;
    }
    
    public Duration getCacheTimeout() {
        return cacheTimeout;
    }
    
    public Duration getCacheTtl() {
        return cacheTtl;
    }
    
    public int getWorkerThreads() {
        return workerThreads;
    }
    
    public int getCacheWorkerThreads() {
        return cacheWorkerThreads;
    }
    
    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }
    
    public static FallbackConfiguration defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "FallbackConfiguration{" +
                "primaryTimeout=" + primaryTimeout +
                ", cacheTimeout=" + cacheTimeout +
                ", cacheTtl=" + cacheTtl +
                ", workerThreads=" + workerThreads +
                ", cacheWorkerThreads=" + cacheWorkerThreads +
                ", circuitBreakerConfig=" + circuitBreakerConfig +
                '}';
    }
    
    public static class Builder {
        private Duration primaryTimeout = Duration.ofMillis(100);
        private Duration cacheTimeout = Duration.ofMillis(500);
        private Duration cacheTtl = Duration.ofHours(24);
        private int workerThreads = 8;
        private int cacheWorkerThreads = 4;
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaultConfig();
        
        /**
         * Deadline for a single primary store read or write.
         */
        public Builder primaryTimeout(Duration timeout) {
            this.primaryTimeout = timeout;
            return this;
        }
        
        /**
         * Deadline for a single cache store get or put.
         */
        public Builder cacheTimeout(Duration timeout) {
            this.cacheTimeout = timeout;
            return this;
        }
        
        /**
         * Time-to-live of mirrored cache entries. Whole seconds only.
         */
        public Builder cacheTtl(Duration ttl) {
            this.cacheTtl = ttl;
            return this;
        }
        
        /**
         * Size of the pool running primary store calls.
         */
        public Builder workerThreads(int threads) {
            this.workerThreads = threads;
            return this;
        }
        
        /**
         * Size of the pool running cache store calls and background refreshes.
         */
        public Builder cacheWorkerThreads(int threads) {
            this.cacheWorkerThreads = threads;
            return this;
        }
        
        public Builder circuitBreakerConfig(CircuitBreakerConfig config) {
            this.circuitBreakerConfig = config;
            return this;
        }
        
        public FallbackConfiguration build() {
            requirePositive(primaryTimeout, "primaryTimeout");
            requirePositive(cacheTimeout, "cacheTimeout");
            requirePositive(cacheTtl, "cacheTtl");
            if (cacheTtl.getSeconds() < 1) {
                throw new IllegalArgumentException("cacheTtl must be at least one second");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1");
            }
            if (cacheWorkerThreads < 1) {
                throw new IllegalArgumentException("cacheWorkerThreads must be at least 1");
            }
            if (circuitBreakerConfig == null) {
                throw new IllegalArgumentException("circuitBreakerConfig must not be null");
            }
            return new FallbackConfiguration(this);
        }
        
        private static void requirePositive(Duration duration, String name) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
