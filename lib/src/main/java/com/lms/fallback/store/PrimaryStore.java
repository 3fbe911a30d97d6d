package com.lms.fallback.store;

import java.util.Optional;

/**
 * Authoritative, durable backing store for entity records.
 * Implementations may block on I/O and signal transport or server errors by
 * throwing; the coordinator bounds and absorbs both.
 *
 * @param <T> the entity record type
 */
public interface PrimaryStore<T> {
    
    /**
     * Reads the record for the given key.
     * 
     * @return the record, or empty when the store has no such record
     * @throws PrimaryStoreException on transport or server errors
     */
    Optional<T> read(String tenant, String subject);
    
    /**
     * Inserts or replaces the whole record.
     * 
     * @throws PrimaryStoreException on transport or server errors
     */
    void write(T entity);
}
