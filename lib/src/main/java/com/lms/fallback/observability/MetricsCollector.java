package com.lms.fallback.observability;

import com.lms.fallback.model.CircuitBreakerState;
import com.lms.fallback.model.StorageMetrics;
import com.lms.fallback.resilience.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects fallback storage metrics for one entity type.
 * Counters backing {@link StorageMetrics} snapshots are plain atomics and can be
 * reset; the Micrometer meters mirroring them are cumulative for the process.
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;
    private final String entityType;
    
    private final AtomicLong fallbackActivations = new AtomicLong();
    private final AtomicLong primaryFailures = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    
    private final Counter fallbackActivationCounter;
    private final Counter primaryFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Timer primarySuccessLatency;
    private final Timer primaryFailureLatency;
    
    public MetricsCollector(String entityType, CircuitBreaker circuitBreaker) {
        this(entityType, circuitBreaker, new SimpleMeterRegistry());
    }
    
    public MetricsCollector(String entityType, CircuitBreaker circuitBreaker, MeterRegistry meterRegistry) {
        this.entityType = entityType;
        this.circuitBreaker = circuitBreaker;
        this.meterRegistry = meterRegistry;
        
        this.fallbackActivationCounter = Counter.builder("storage.fallback.activations")
            .tag("entity", entityType)
            .description("Operations served from the cache because the primary store was skipped or failed")
            .register(meterRegistry);
            
        this.primaryFailureCounter = Counter.builder("storage.primary.failures")
            .tag("entity", entityType)
            .description("Primary store calls that failed or timed out")
            .register(meterRegistry);
            
        this.cacheHitCounter = Counter.builder("storage.cache.hits")
            .tag("entity", entityType)
            .description("Fallback reads answered by the cache")
            .register(meterRegistry);
            
        this.cacheMissCounter = Counter.builder("storage.cache.misses")
            .tag("entity", entityType)
            .description("Fallback reads the cache could not answer")
            .register(meterRegistry);
            
        this.primarySuccessLatency = Timer.builder("storage.primary.latency")
            .tag("entity", entityType)
            .tag("outcome", "success")
            .description("Primary store call latency")
            .register(meterRegistry);
            
        this.primaryFailureLatency = Timer.builder("storage.primary.latency")
            .tag("entity", entityType)
            .tag("outcome", "failure")
            .description("Primary store call latency")
            .register(meterRegistry);
            
        Gauge.builder("storage.circuit.state", circuitBreaker, MetricsCollector::stateValue)
            .tag("entity", entityType)
            .tag("breaker", circuitBreaker.getName())
            .description("Circuit state: 0 closed, 1 half-open, 2 open")
            .register(meterRegistry);
        
        logger.info("Metrics collector initialized for entity type {}", entityType);
    }
    
    public void recordFallbackActivation() {
        fallbackActivations.incrementAndGet();
        fallbackActivationCounter.increment();
    }
    
    public void recordPrimaryCall(Duration latency, boolean success) {
        if (success) {
            primarySuccessLatency.record(latency);
        } else {
            primaryFailures.incrementAndGet();
            primaryFailureCounter.increment();
            primaryFailureLatency.record(latency);
        }
    }
    
    public void recordCacheRead(boolean hit) {
        if (hit) {
            cacheHits.incrementAndGet();
            cacheHitCounter.increment();
        } else {
            cacheMisses.incrementAndGet();
            cacheMissCounter.increment();
        }
    }
    
    public void recordCacheError(String operation) {
        Counter.builder("storage.cache.errors")
            .tag("entity", entityType)
            .tag("operation", operation)
            .description("Cache store operations that failed")
            .register(meterRegistry)
            .increment();
    }
    
    public StorageMetrics snapshot() {
        return new StorageMetrics(
            fallbackActivations.get(),
            primaryFailures.get(),
            cacheHits.get(),
            cacheMisses.get(),
            circuitBreaker.getLastFailureTime(),
            circuitBreaker.getState());
    }
    
    /**
     * Zeroes the snapshot counters. Micrometer meters keep their totals.
     */
    public void reset() {
        fallbackActivations.set(0);
        primaryFailures.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        logger.info("Storage metrics reset for entity type {}", entityType);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    private static double stateValue(CircuitBreaker breaker) {
        CircuitBreakerState state = breaker.getState();
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
