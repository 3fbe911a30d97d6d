package com.lms.fallback.resilience;

import com.lms.fallback.config.FallbackConfiguration;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs store calls on worker pools under Resilience4j time limiters.
 * A call that misses its deadline is cancelled and surfaces as a
 * {@link java.util.concurrent.TimeoutException} to the caller, which never
 * waits past the deadline.
 *
 * <p>Primary and cache calls run on separate pools. Primary workers stuck in
 * calls that ignore interruption never take capacity from cache calls.</p>
 */
public class BoundedCallExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BoundedCallExecutor.class);

    public static final String PRIMARY = "primary";
    public static final String CACHE = "cache";

    private final ExecutorService primaryExecutor;
    private final ExecutorService cacheExecutor;
    private final ScheduledExecutorService deadlineScheduler;
    private final Duration cacheTimeout;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final TimeLimiter primaryLimiter;
    private final TimeLimiter cacheLimiter;

    public BoundedCallExecutor(FallbackConfiguration configuration) {
        this(configuration,
                newWorkerPool("storage-primary-", configuration.getWorkerThreads()),
                newWorkerPool("storage-cache-", configuration.getCacheWorkerThreads()));
    }

    public BoundedCallExecutor(FallbackConfiguration configuration,
                               ExecutorService primaryExecutor,
                               ExecutorService cacheExecutor) {
        this.primaryExecutor = primaryExecutor;
        this.cacheExecutor = cacheExecutor;
        this.cacheTimeout = configuration.getCacheTimeout();
        this.deadlineScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "storage-cache-deadline");
            t.setDaemon(true);
            return t;
        });
        this.timeLimiterRegistry = TimeLimiterRegistry.ofDefaults();

        setupEventHandlers();

        this.primaryLimiter = timeLimiterRegistry.timeLimiter(PRIMARY, limiterConfig(configuration.getPrimaryTimeout()));
        this.cacheLimiter = timeLimiterRegistry.timeLimiter(CACHE, limiterConfig(configuration.getCacheTimeout()));
    }

    /**
     * Executes a primary store call, waiting at most the primary timeout.
     *
     * @throws Exception the call's own exception, or a TimeoutException on deadline expiry
     */
    public <T> T callPrimary(Supplier<T> call) throws Exception {
        return execute(primaryLimiter, primaryExecutor, call);
    }

    /**
     * Executes a cache store call, waiting at most the cache timeout.
     */
    public <T> T callCache(Supplier<T> call) throws Exception {
        return execute(cacheLimiter, cacheExecutor, call);
    }

    /**
     * Submits a cache call without waiting for it. The call is cancelled once the
     * cache timeout expires. Its outcome is only logged.
     */
    public void submitCache(String description, Runnable task) {
        Future<?> future;
        try {
            future = cacheExecutor.submit(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.warn("Background cache call failed: {} ({})", description, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Background cache call rejected, executor is shut down: {}", description);
            return;
        }

        try {
            deadlineScheduler.schedule(() -> {
                if (future.cancel(true)) {
                    logger.warn("Background cache call timed out after {}: {}", cacheTimeout, description);
                }
            }, cacheTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Deadline not scheduled, executor is shut down: {}", description);
        }
    }

    public TimeLimiter getPrimaryLimiter() {
        return primaryLimiter;
    }

    public TimeLimiter getCacheLimiter() {
        return cacheLimiter;
    }

    private static <T> T execute(TimeLimiter limiter, ExecutorService executor, Supplier<T> call) throws Exception {
        // cancelling the submitted task on timeout interrupts its worker
        Callable<T> task = call::get;
        return limiter.executeFutureSupplier(() -> executor.submit(task));
    }

    private static TimeLimiterConfig limiterConfig(Duration timeout) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();
    }

    private static ExecutorService newWorkerPool(String namePrefix, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, namePrefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private void setupEventHandlers() {
        timeLimiterRegistry.getEventPublisher().onEntryAdded(event -> {
            TimeLimiter timeLimiter = event.getAddedEntry();
            String name = timeLimiter.getName();

            timeLimiter.getEventPublisher()
                    .onTimeout(e -> logger.debug("Time limiter {} deadline of {} expired",
                            name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration()))
                    .onError(e -> logger.debug("Time limiter {} call failed: {}",
                            name, e.getThrowable().toString()));
        });
    }

    @Override
    public void close() {
        deadlineScheduler.shutdownNow();
        shutdown(cacheExecutor);
        shutdown(primaryExecutor);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
