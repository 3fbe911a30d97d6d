package com.lms.fallback.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Describes an entity type stored through the fallback layer: the type name used
 * in cache keys, its Java class, and how to read its composite key from a record.
 *
 * @param <T> the entity record type
 */
public final class EntityDescriptor<T> {
    
    private final String entityType;
    private final Class<T> entityClass;
    private final Function<T, String> tenantExtractor;
    private final Function<T, String> subjectExtractor;
    
    private EntityDescriptor(String entityType, Class<T> entityClass,
                             Function<T, String> tenantExtractor, Function<T, String> subjectExtractor) {
        this.entityType = entityType;
        this.entityClass = entityClass;
        this.tenantExtractor = tenantExtractor;
        this.subjectExtractor = subjectExtractor;
    }
    
    public static <T> EntityDescriptor<T> of(String entityType, Class<T> entityClass,
                                             Function<T, String> tenantExtractor,
                                             Function<T, String> subjectExtractor) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType must not be blank");
        }
        return new EntityDescriptor<>(entityType,
                Objects.requireNonNull(entityClass, "entityClass must not be null"),
                Objects.requireNonNull(tenantExtractor, "tenantExtractor must not be null"),
                Objects.requireNonNull(subjectExtractor, "subjectExtractor must not be null"));
    }
    
    public String getEntityType() {
        return entityType;
    }
    
    public Class<T> getEntityClass() {
        return entityClass;
    }
    
    public EntityKey keyOf(T entity) {
        return new EntityKey(tenantExtractor.apply(entity), subjectExtractor.apply(entity));
    }
    
    public String cacheKey(EntityKey key) {
        return key.toCacheKey(entityType);
    }
    
    @Override
    public String toString() {
        return "EntityDescriptor{" + entityType + ", " + entityClass.getSimpleName() + "}";
    }
}
