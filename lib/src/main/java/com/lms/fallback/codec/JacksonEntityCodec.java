package com.lms.fallback.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON entity codec on a Jackson {@link ObjectMapper}.
 * Unknown properties are ignored so older and newer record versions can share cache entries.
 */
public class JacksonEntityCodec<T> implements EntityCodec<T> {
    
    private final ObjectMapper objectMapper;
    private final Class<T> entityClass;
    
    public JacksonEntityCodec(Class<T> entityClass) {
        this(defaultObjectMapper(), entityClass);
    }
    
    public JacksonEntityCodec(ObjectMapper objectMapper, Class<T> entityClass) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass must not be null");
    }
    
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    @Override
    public byte[] encode(T entity) {
        try {
            return objectMapper.writeValueAsBytes(entity);
        } catch (JsonProcessingException e) {
            throw new EntityCodecException("Failed to encode " + entityClass.getSimpleName(), e);
        }
    }
    
    @Override
    public T decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, entityClass);
        } catch (IOException e) {
            throw new EntityCodecException("Failed to decode " + entityClass.getSimpleName(), e);
        }
    }
}
