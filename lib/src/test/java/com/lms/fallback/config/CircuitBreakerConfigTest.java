package com.lms.fallback.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerConfigTest {

    @Test
    void testDefaultConfig() {
        CircuitBreakerConfig config = CircuitBreakerConfig.defaultConfig();

        assertEquals(5, config.getFailureThreshold());
        assertEquals(Duration.ofSeconds(60), config.getResetTimeout());
        assertEquals(3, config.getHalfOpenProbeCount());
    }

    @Test
    void testCustomConfig() {
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
                .failureThreshold(2)
                .resetTimeout(Duration.ofSeconds(5))
                .halfOpenProbeCount(1)
                .build();

        assertEquals(2, config.getFailureThreshold());
        assertEquals(Duration.ofSeconds(5), config.getResetTimeout());
        assertEquals(1, config.getHalfOpenProbeCount());
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerConfig.builder().failureThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerConfig.builder().resetTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerConfig.builder().resetTimeout(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakerConfig.builder().halfOpenProbeCount(0).build());
    }
}
