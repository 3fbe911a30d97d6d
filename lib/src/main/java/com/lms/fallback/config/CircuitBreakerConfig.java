package com.lms.fallback.config;

import java.time.Duration;

/**
 * Circuit breaker configuration for primary store fault tolerance.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int halfOpenProbeCount;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.resetTimeout = builder.resetTimeout;
        this.halfOpenProbeCount = builder.halfOpenProbeCount;
    }
    
    /**
     * Consecutive failures in the closed state that trip the circuit open.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * Time an open circuit waits after the last failure before admitting a probe.
     */
    public Duration getResetTimeout() {
        return resetTimeout;
    }
    
    /**
     * Consecutive successful probes required in the half-open state to close the circuit.
     */
    public int getHalfOpenProbeCount() {
        return halfOpenProbeCount;
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
                "failureThreshold=" + failureThreshold +
                ", resetTimeout=" + resetTimeout +
                ", halfOpenProbeCount=" + halfOpenProbeCount +
                '}';
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private int halfOpenProbeCount = 3;
        
        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder resetTimeout(Duration timeout) {
            this.resetTimeout = timeout;
            return this;
        }
        
        public Builder halfOpenProbeCount(int probes) {
            this.halfOpenProbeCount = probes;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be at least 1");
            }
            if (resetTimeout == null || resetTimeout.isNegative() || resetTimeout.isZero()) {
                throw new IllegalArgumentException("resetTimeout must be positive");
            }
            if (halfOpenProbeCount < 1) {
                throw new IllegalArgumentException("halfOpenProbeCount must be at least 1");
            }
            return new CircuitBreakerConfig(this);
        }
    }
}
