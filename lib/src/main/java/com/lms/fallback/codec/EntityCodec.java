package com.lms.fallback.codec;

/**
 * Converts entity records to and from the bytes mirrored in the cache store.
 *
 * @param <T> the entity record type
 */
public interface EntityCodec<T> {
    
    byte[] encode(T entity);
    
    T decode(byte[] bytes);
}
