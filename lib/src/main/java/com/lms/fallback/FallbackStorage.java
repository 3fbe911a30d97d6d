package com.lms.fallback;

import com.lms.fallback.model.StorageMetrics;
import com.lms.fallback.observability.CircuitEventPublisher.CircuitTransitionEvent;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entity storage that stays available while the primary store is failing.
 * Reads fall back to the most recently cached value and writes are always
 * mirrored to the cache, so a primary outage neither blocks reads nor loses
 * writes within the cache TTL.
 *
 * <p>Storage failures are never thrown from {@link #getEntity} or
 * {@link #saveEntity}; degradation is visible only through {@link #getMetrics()}
 * and the logs.</p>
 *
 * @param <T> the entity record type
 */
public interface FallbackStorage<T> extends AutoCloseable {
    
    /**
     * Reads an entity, from the primary store when the circuit allows it and from
     * the cache otherwise.
     * 
     * @param tenant the owning tenant
     * @param subject the subject within the tenant
     * @return the entity, or empty when neither store has it
     * @throws IllegalArgumentException if tenant or subject is blank
     */
    Optional<T> getEntity(String tenant, String subject);
    
    /**
     * Writes an entity to the cache and, when the circuit allows it, to the primary store.
     * Returns normally even when the primary write fails.
     * 
     * @param entity the whole record to store
     * @throws NullPointerException if entity is null
     * @throws IllegalArgumentException if the entity's tenant or subject is blank
     */
    void saveEntity(T entity);
    
    StorageMetrics getMetrics();
    
    /**
     * Forces the circuit closed and zeroes its counters.
     */
    void resetCircuit();
    
    /**
     * Zeroes the metrics counters.
     */
    void resetMetrics();
    
    Flux<CircuitTransitionEvent> getCircuitEvents();
    
    Disposable subscribeToCircuitEvents(Consumer<CircuitTransitionEvent> listener);
    
    @Override
    void close();
}
