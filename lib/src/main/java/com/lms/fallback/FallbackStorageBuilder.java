package com.lms.fallback;

import com.lms.fallback.codec.EntityCodec;
import com.lms.fallback.codec.JacksonEntityCodec;
import com.lms.fallback.config.FallbackConfiguration;
import com.lms.fallback.impl.FallbackStorageCoordinator;
import com.lms.fallback.model.EntityDescriptor;
import com.lms.fallback.model.LearnerProfile;
import com.lms.fallback.observability.CircuitEventPublisher;
import com.lms.fallback.observability.MetricsCollector;
import com.lms.fallback.resilience.BoundedCallExecutor;
import com.lms.fallback.resilience.CircuitBreaker;
import com.lms.fallback.store.CacheStore;
import com.lms.fallback.store.PrimaryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;

/**
 * Builder for creating FallbackStorage instances.
 * Wires the circuit breaker, bounded executor, metrics and event publisher
 * around the given primary and cache stores.
 *
 * @param <T> the entity record type
 */
public class FallbackStorageBuilder<T> {
    
    private final EntityDescriptor<T> descriptor;
    private PrimaryStore<T> primaryStore;
    private CacheStore cacheStore;
    private EntityCodec<T> codec;
    private FallbackConfiguration configuration = FallbackConfiguration.defaultConfig();
    private MeterRegistry meterRegistry;
    private Clock clock = Clock.systemUTC();
    
    private FallbackStorageBuilder(EntityDescriptor<T> descriptor) {
        this.descriptor = descriptor;
    }
    
    /**
     * Start building storage for the given entity type.
     */
    public static <T> FallbackStorageBuilder<T> forEntity(EntityDescriptor<T> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor must not be null");
        }
        return new FallbackStorageBuilder<>(descriptor);
    }
    
    /**
     * Start building storage for learner profiles.
     */
    public static FallbackStorageBuilder<LearnerProfile> forLearnerProfiles() {
        return forEntity(LearnerProfile.DESCRIPTOR);
    }
    
    public FallbackStorageBuilder<T> primaryStore(PrimaryStore<T> primaryStore) {
        this.primaryStore = primaryStore;
        return this;
    }
    
    public FallbackStorageBuilder<T> cacheStore(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
        return this;
    }
    
    /**
     * Overrides the default Jackson JSON codec.
     */
    public FallbackStorageBuilder<T> codec(EntityCodec<T> codec) {
        this.codec = codec;
        return this;
    }
    
    public FallbackStorageBuilder<T> configuration(FallbackConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }
    
    public FallbackStorageBuilder<T> meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    /**
     * Clock driving the circuit breaker's reset timeout.
     */
    public FallbackStorageBuilder<T> clock(Clock clock) {
        this.clock = clock;
        return this;
    }
    
    /**
     * @throws IllegalStateException if a store, the configuration or the clock is missing
     */
    public FallbackStorage<T> build() {
        if (primaryStore == null) {
            throw new IllegalStateException("primaryStore is required");
        }
        if (cacheStore == null) {
            throw new IllegalStateException("cacheStore is required");
        }
        if (configuration == null) {
            throw new IllegalStateException("configuration is required");
        }
        if (clock == null) {
            throw new IllegalStateException("clock is required");
        }
        
        String breakerName = descriptor.getEntityType() + "-primary";
        CircuitBreaker circuitBreaker = new CircuitBreaker(breakerName, configuration.getCircuitBreakerConfig(), clock);
        CircuitEventPublisher eventPublisher = new CircuitEventPublisher(breakerName);
        circuitBreaker.addListener(eventPublisher);
        
        MetricsCollector metricsCollector = new MetricsCollector(descriptor.getEntityType(), circuitBreaker,
                meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
        
        EntityCodec<T> entityCodec = codec != null ? codec : new JacksonEntityCodec<>(descriptor.getEntityClass());
        
        return new FallbackStorageCoordinator<>(descriptor, primaryStore, cacheStore, entityCodec, configuration,
                circuitBreaker, new BoundedCallExecutor(configuration), metricsCollector, eventPublisher);
    }
}
