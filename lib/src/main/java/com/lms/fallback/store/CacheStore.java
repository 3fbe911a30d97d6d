package com.lms.fallback.store;

import java.util.Optional;

/**
 * Best-effort, TTL-bounded key/value mirror used for fallback reads and writes.
 */
public interface CacheStore {
    
    /**
     * Returns the stored value, or empty when the key is absent or expired.
     */
    Optional<byte[]> get(String key);
    
    /**
     * Stores the value, replacing any previous one, to expire after {@code ttlSeconds}.
     */
    void put(String key, byte[] value, long ttlSeconds);
}
