package com.lms.fallback;

import com.lms.fallback.codec.EntityCodec;
import com.lms.fallback.model.CircuitBreakerState;
import com.lms.fallback.model.EntityDescriptor;
import com.lms.fallback.model.LearnerProfile;
import com.lms.fallback.store.CacheStore;
import com.lms.fallback.store.InMemoryCacheStore;
import com.lms.fallback.store.PrimaryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FallbackStorageBuilderTest {

    @Mock
    private PrimaryStore<LearnerProfile> primaryStore;

    @Mock
    private CacheStore cacheStore;

    @Test
    void testMissingPrimaryStore() {
        FallbackStorageBuilder<LearnerProfile> builder = FallbackStorageBuilder.forLearnerProfiles()
            .cacheStore(cacheStore);

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("primaryStore"));
    }

    @Test
    void testMissingCacheStore() {
        FallbackStorageBuilder<LearnerProfile> builder = FallbackStorageBuilder.forLearnerProfiles()
            .primaryStore(primaryStore);

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("cacheStore"));
    }

    @Test
    void testMissingConfiguration() {
        FallbackStorageBuilder<LearnerProfile> builder = FallbackStorageBuilder.forLearnerProfiles()
            .primaryStore(primaryStore)
            .cacheStore(cacheStore)
            .configuration(null);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testNullDescriptorRejected() {
        assertThrows(IllegalArgumentException.class, () -> FallbackStorageBuilder.forEntity(null));
    }

    @Test
    void testLearnerProfileStorageWithDefaults() {
        LearnerProfile profile = LearnerProfile.builder()
            .id("p-1")
            .tenantId("tenant-1")
            .ltiUserId("user-1")
            .name("Ada")
            .build();
        when(primaryStore.read("tenant-1", "user-1")).thenReturn(Optional.of(profile));

        try (FallbackStorage<LearnerProfile> storage = FallbackStorageBuilder.forLearnerProfiles()
                .primaryStore(primaryStore)
                .cacheStore(new InMemoryCacheStore())
                .build()) {

            assertEquals(Optional.of(profile), storage.getEntity("tenant-1", "user-1"));
            assertEquals(CircuitBreakerState.CLOSED, storage.getMetrics().getCircuitState());
            assertTrue(storage.getMetrics().getLastFailure().isEmpty());
        }
    }

    @Test
    void testCustomEntityAndCodec() {
        EntityDescriptor<String> descriptor = EntityDescriptor.of("note", String.class,
            note -> note.split("/")[0], note -> note.split("/")[1]);
        EntityCodec<String> codec = new EntityCodec<>() {
            @Override
            public byte[] encode(String entity) {
                return entity.getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public String decode(byte[] bytes) {
                return new String(bytes, StandardCharsets.UTF_8);
            }
        };
        @SuppressWarnings("unchecked")
        PrimaryStore<String> notes = mock(PrimaryStore.class);
        InMemoryCacheStore cache = new InMemoryCacheStore();

        try (FallbackStorage<String> storage = FallbackStorageBuilder.forEntity(descriptor)
                .primaryStore(notes)
                .cacheStore(cache)
                .codec(codec)
                .build()) {

            storage.saveEntity("acme/n-42");

            verify(notes).write("acme/n-42");
            assertArrayEquals("acme/n-42".getBytes(StandardCharsets.UTF_8),
                cache.get("fallback:note:acme:n-42").orElseThrow());
        }
    }
}
