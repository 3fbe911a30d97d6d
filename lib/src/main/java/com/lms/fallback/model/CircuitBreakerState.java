package com.lms.fallback.model;

/**
 * Circuit breaker state for the primary store.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - primary store calls are attempted.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - primary store calls are skipped and served from the cache.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - a limited number of probe calls test recovery.
     */
    HALF_OPEN
}
