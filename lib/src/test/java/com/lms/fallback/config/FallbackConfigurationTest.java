package com.lms.fallback.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FallbackConfigurationTest {

    @Test
    void testDefaultConfig() {
        FallbackConfiguration config = FallbackConfiguration.defaultConfig();

        assertEquals(Duration.ofMillis(100), config.getPrimaryTimeout());
        assertEquals(Duration.ofMillis(500), config.getCacheTimeout());
        assertEquals(86400, config.getCacheTtl().getSeconds());
        assertEquals(8, config.getWorkerThreads());
        assertEquals(4, config.getCacheWorkerThreads());
        assertNotNull(config.getCircuitBreakerConfig());
    }

    @Test
    void testBuilderOverrides() {
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.builder().failureThreshold(2).build();

        FallbackConfiguration config = FallbackConfiguration.builder()
                .primaryTimeout(Duration.ofMillis(250))
                .cacheTimeout(Duration.ofSeconds(1))
                .cacheTtl(Duration.ofHours(1))
                .workerThreads(4)
                .cacheWorkerThreads(2)
                .circuitBreakerConfig(breakerConfig)
                .build();

        assertEquals(Duration.ofMillis(250), config.getPrimaryTimeout());
        assertEquals(Duration.ofSeconds(1), config.getCacheTimeout());
        assertEquals(Duration.ofHours(1), config.getCacheTtl());
        assertEquals(4, config.getWorkerThreads());
        assertEquals(2, config.getCacheWorkerThreads());
        assertSame(breakerConfig, config.getCircuitBreakerConfig());
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().primaryTimeout(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().cacheTimeout(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().cacheTtl(Duration.ofMillis(500)).build());
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().workerThreads(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().cacheWorkerThreads(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FallbackConfiguration.builder().circuitBreakerConfig(null).build());
    }
}
