package com.lms.fallback.store;

/**
 * Transport, timeout or server-side failure of the primary store.
 */
public class PrimaryStoreException extends RuntimeException {
    
    public PrimaryStoreException(String message) {
        super(message);
    }
    
    public PrimaryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
