package com.lms.fallback.resilience;

import com.lms.fallback.MutableClock;
import com.lms.fallback.config.CircuitBreakerConfig;
import com.lms.fallback.model.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitBreaker Concurrency Tests")
class CircuitBreakerConcurrencyTest {

    private static void runConcurrently(int threads, Runnable task) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        task.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent failures are all counted and trip the circuit once")
    void concurrentFailuresTripOnce() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("concurrent", CircuitBreakerConfig.builder()
                .failureThreshold(10)
                .build());
        AtomicInteger openTransitions = new AtomicInteger();
        breaker.addListener((from, to, at) -> {
            if (to == CircuitBreakerState.OPEN) {
                openTransitions.incrementAndGet();
            }
        });

        runConcurrently(20, breaker::recordFailure);

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(20, breaker.getFailureCount());
        assertEquals(1, openTransitions.get());
    }

    @Test
    @DisplayName("Concurrent callers in half-open get exactly halfOpenProbeCount permits")
    void concurrentProbesAreLimited() throws Exception {
        MutableClock clock = MutableClock.startingAt("2025-01-21T00:00:00Z");
        CircuitBreaker breaker = new CircuitBreaker("probes", CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .resetTimeout(Duration.ofSeconds(60))
                .halfOpenProbeCount(3)
                .build(), clock);
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(61));

        AtomicInteger admitted = new AtomicInteger();
        runConcurrently(32, () -> {
            if (breaker.allowRequest()) {
                admitted.incrementAndGet();
            }
        });

        assertEquals(3, admitted.get());
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
    }
}
