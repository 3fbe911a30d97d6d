package com.lms.fallback.codec;

/**
 * An entity record could not be encoded, or cached bytes could not be decoded.
 */
public class EntityCodecException extends RuntimeException {
    
    public EntityCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
