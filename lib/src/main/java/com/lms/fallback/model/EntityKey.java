package com.lms.fallback.model;

/**
 * Composite identity of an entity record: the owning tenant and the subject within it.
 */
public record EntityKey(String tenant, String subject) {
    
    private static final String CACHE_KEY_PREFIX = "fallback";
    
    public EntityKey {
        if (tenant == null || tenant.isBlank()) {
            throw new IllegalArgumentException("tenant must not be blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
    }
    
    /**
     * Derives the cache key {@code fallback:{entityType}:{tenant}:{subject}}.
     */
    public String toCacheKey(String entityType) {
        return CACHE_KEY_PREFIX + ":" + entityType + ":" + tenant + ":" + subject;
    }
}
