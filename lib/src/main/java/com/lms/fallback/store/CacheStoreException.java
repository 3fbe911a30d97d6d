package com.lms.fallback.store;

/**
 * Failure of the secondary cache store.
 */
public class CacheStoreException extends RuntimeException {
    
    public CacheStoreException(String message) {
        super(message);
    }
    
    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
