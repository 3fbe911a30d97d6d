package com.lms.fallback.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityKeyTest {

    @Test
    void testCacheKeyFormat() {
        EntityKey key = new EntityKey("tenant-123", "user-456");

        assertEquals("fallback:learner:tenant-123:user-456", key.toCacheKey("learner"));
    }

    @Test
    void testRejectsBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> new EntityKey(null, "user"));
        assertThrows(IllegalArgumentException.class, () -> new EntityKey(" ", "user"));
        assertThrows(IllegalArgumentException.class, () -> new EntityKey("tenant", ""));
    }

    @Test
    void testLearnerDescriptorDerivesKeyFromProfile() {
        LearnerProfile profile = LearnerProfile.builder()
                .id("profile-1")
                .tenantId("tenant-123")
                .ltiUserId("user-789")
                .build();

        EntityKey key = LearnerProfile.DESCRIPTOR.keyOf(profile);

        assertEquals(new EntityKey("tenant-123", "user-789"), key);
        assertEquals("fallback:learner:tenant-123:user-789", LearnerProfile.DESCRIPTOR.cacheKey(key));
        assertEquals(LearnerProfile.class, LearnerProfile.DESCRIPTOR.getEntityClass());
    }

    @Test
    void testDescriptorRejectsBlankEntityType() {
        assertThrows(IllegalArgumentException.class,
                () -> EntityDescriptor.of(" ", String.class, s -> s, s -> s));
    }
}
