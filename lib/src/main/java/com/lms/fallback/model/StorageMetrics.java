package com.lms.fallback.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time snapshot of the fallback layer's counters and circuit status.
 */
public final class StorageMetrics {
    
    private final long fallbackActivations;
    private final long primaryFailures;
    private final long cacheHits;
    private final long cacheMisses;
    private final Instant lastFailure;
    private final CircuitBreakerState circuitState;
    
    public StorageMetrics(long fallbackActivations, long primaryFailures, long cacheHits, long cacheMisses,
                          Instant lastFailure, CircuitBreakerState circuitState) {
        this.fallbackActivations = fallbackActivations;
        this.primaryFailures = primaryFailures;
        this.cacheHits = cacheHits;
        this.cacheMisses = cacheMisses;
        this.lastFailure = lastFailure;
        this.circuitState = Objects.requireNonNull(circuitState, "circuitState must not be null");
    }
    
    /**
     * Operations served from the cache because the primary store was skipped or failed.
     */
    public long getFallbackActivations() {
        return fallbackActivations;
    }
    
    public long getPrimaryFailures() {
        return primaryFailures;
    }
    
    public long getCacheHits() {
        return cacheHits;
    }
    
    public long getCacheMisses() {
        return cacheMisses;
    }
    
    /**
     * Instant of the most recent primary store failure, empty if none has been seen.
     */
    public Optional<Instant> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }
    
    public CircuitBreakerState getCircuitState() {
        return circuitState;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StorageMetrics that = (StorageMetrics) o;
        return fallbackActivations == that.fallbackActivations &&
                primaryFailures == that.primaryFailures &&
                cacheHits == that.cacheHits &&
                cacheMisses == that.cacheMisses &&
                Objects.equals(lastFailure, that.lastFailure) &&
                circuitState == that.circuitState;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(fallbackActivations, primaryFailures, cacheHits, cacheMisses, lastFailure, circuitState);
    }
    
    @Override
    public String toString() {
        return String.format("StorageMetrics{fallbackActivations=%d, primaryFailures=%d, cacheHits=%d, " +
                        "cacheMisses=%d, lastFailure=%s, circuitState=%s}",
                fallbackActivations, primaryFailures, cacheHits, cacheMisses, lastFailure, circuitState);
    }
}
