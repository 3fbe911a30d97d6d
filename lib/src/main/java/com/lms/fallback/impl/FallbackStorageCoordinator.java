package com.lms.fallback.impl;

import com.lms.fallback.FallbackStorage;
import com.lms.fallback.codec.EntityCodec;
import com.lms.fallback.config.FallbackConfiguration;
import com.lms.fallback.model.EntityDescriptor;
import com.lms.fallback.model.EntityKey;
import com.lms.fallback.model.StorageMetrics;
import com.lms.fallback.observability.CircuitEventPublisher;
import com.lms.fallback.observability.CircuitEventPublisher.CircuitTransitionEvent;
import com.lms.fallback.observability.MetricsCollector;
import com.lms.fallback.resilience.BoundedCallExecutor;
import com.lms.fallback.resilience.CircuitBreaker;
import com.lms.fallback.store.CacheStore;
import com.lms.fallback.store.PrimaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Coordinates entity reads and writes across the primary store and the cache store.
 *
 * <p>Reads go to the primary store while the circuit allows it and refresh the cache
 * with what they find; a skipped, failed or timed-out primary read is answered from
 * the cache. Writes always go to the cache first and then to the primary store when
 * the circuit allows it, so a write survives a primary outage for the cache TTL.</p>
 *
 * <p>Calls for the same key are not serialized against each other; the last cache
 * write wins.</p>
 */
public class FallbackStorageCoordinator<T> implements FallbackStorage<T> {

    private static final Logger logger = LoggerFactory.getLogger(FallbackStorageCoordinator.class);

    private final EntityDescriptor<T> descriptor;
    private final PrimaryStore<T> primaryStore;
    private final CacheStore cacheStore;
    private final EntityCodec<T> codec;
    private final CircuitBreaker circuitBreaker;
    private final BoundedCallExecutor callExecutor;
    private final MetricsCollector metricsCollector;
    private final CircuitEventPublisher eventPublisher;
    private final long cacheTtlSeconds;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FallbackStorageCoordinator(EntityDescriptor<T> descriptor,
                                      PrimaryStore<T> primaryStore,
                                      CacheStore cacheStore,
                                      EntityCodec<T> codec,
                                      FallbackConfiguration configuration,
                                      CircuitBreaker circuitBreaker,
                                      BoundedCallExecutor callExecutor,
                                      MetricsCollector metricsCollector,
                                      CircuitEventPublisher eventPublisher) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.primaryStore = Objects.requireNonNull(primaryStore, "primaryStore must not be null");
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.cacheTtlSeconds = configuration.getCacheTtl().getSeconds();

        logger.info("Fallback storage for {} initialized: {}", descriptor.getEntityType(), configuration);
    }

    @Override
    public Optional<T> getEntity(String tenant, String subject) {
        EntityKey key = new EntityKey(tenant, subject);
        String cacheKey = descriptor.cacheKey(key);

        if (!circuitBreaker.allowRequest()) {
            logger.debug("Circuit {} is {}, reading {} from cache",
                circuitBreaker.getName(), circuitBreaker.getState(), cacheKey);
            return readFromCache(cacheKey);
        }

        long start = System.nanoTime();
        Optional<T> result;
        try {
            result = callExecutor.callPrimary(() -> primaryStore.read(key.tenant(), key.subject()));
        } catch (Exception e) {
            onPrimaryFailure("read", cacheKey, start, e);
            return readFromCache(cacheKey);
        }

        // not-found is a successful primary outcome
        metricsCollector.recordPrimaryCall(elapsedSince(start), true);
        if (result == null) {
            result = Optional.empty();
        }
        circuitBreaker.recordSuccess();
        result.ifPresent(entity -> refreshCache(cacheKey, entity));

        return result;
    }

    @Override
    public void saveEntity(T entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        EntityKey key = descriptor.keyOf(entity);
        String cacheKey = descriptor.cacheKey(key);

        writeToCache(cacheKey, entity);

        if (!circuitBreaker.allowRequest()) {
            metricsCollector.recordFallbackActivation();
            logger.debug("Circuit {} is {}, {} saved to cache only",
                circuitBreaker.getName(), circuitBreaker.getState(), cacheKey);
            return;
        }

        long start = System.nanoTime();
        try {
            callExecutor.callPrimary(() -> {
                primaryStore.write(entity);
                return null;
            });
        } catch (Exception e) {
            onPrimaryFailure("write", cacheKey, start, e);
            metricsCollector.recordFallbackActivation();
            return;
        }

        metricsCollector.recordPrimaryCall(elapsedSince(start), true);
        circuitBreaker.recordSuccess();
    }

    @Override
    public StorageMetrics getMetrics() {
        return metricsCollector.snapshot();
    }

    @Override
    public void resetCircuit() {
        circuitBreaker.reset();
    }

    @Override
    public void resetMetrics() {
        metricsCollector.reset();
    }

    @Override
    public Flux<CircuitTransitionEvent> getCircuitEvents() {
        return eventPublisher.getEventStream();
    }

    @Override
    public Disposable subscribeToCircuitEvents(Consumer<CircuitTransitionEvent> listener) {
        return eventPublisher.subscribe(listener);
    }

    public EntityDescriptor<T> getDescriptor() {
        return descriptor;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            callExecutor.close();
            eventPublisher.close();
            logger.info("Fallback storage for {} closed", descriptor.getEntityType());
        }
    }

    private Optional<T> readFromCache(String cacheKey) {
        metricsCollector.recordFallbackActivation();

        Optional<byte[]> cached;
        try {
            cached = callExecutor.callCache(() -> cacheStore.get(cacheKey));
        } catch (Exception e) {
            restoreInterrupt(e);
            logger.warn("Cache read failed for {}: {}", cacheKey, describe(e));
            metricsCollector.recordCacheError("get");
            metricsCollector.recordCacheRead(false);
            return Optional.empty();
        }

        if (cached == null || cached.isEmpty()) {
            logger.debug("Cache miss for {}", cacheKey);
            metricsCollector.recordCacheRead(false);
            return Optional.empty();
        }

        T entity;
        try {
            entity = codec.decode(cached.get());
        } catch (RuntimeException e) {
            logger.warn("Discarding undecodable cache entry {}: {}", cacheKey, describe(e));
            metricsCollector.recordCacheError("decode");
            metricsCollector.recordCacheRead(false);
            return Optional.empty();
        }

        if (entity == null) {
            logger.warn("Cache entry {} decoded to nothing", cacheKey);
            metricsCollector.recordCacheError("decode");
            metricsCollector.recordCacheRead(false);
            return Optional.empty();
        }
        metricsCollector.recordCacheRead(true);
        return Optional.of(entity);
    }

    private void writeToCache(String cacheKey, T entity) {
        byte[] bytes = encodeForCache(cacheKey, entity);
        if (bytes == null) {
            return;
        }

        try {
            callExecutor.callCache(() -> {
                cacheStore.put(cacheKey, bytes, cacheTtlSeconds);
                return null;
            });
        } catch (Exception e) {
            restoreInterrupt(e);
            logger.warn("Cache write failed for {}: {}", cacheKey, describe(e));
            metricsCollector.recordCacheError("put");
        }
    }

    private void refreshCache(String cacheKey, T entity) {
        byte[] bytes = encodeForCache(cacheKey, entity);
        if (bytes != null) {
            callExecutor.submitCache("refresh " + cacheKey,
                () -> cacheStore.put(cacheKey, bytes, cacheTtlSeconds));
        }
    }

    private byte[] encodeForCache(String cacheKey, T entity) {
        try {
            byte[] bytes = codec.encode(entity);
            if (bytes == null) {
                metricsCollector.recordCacheError("encode");
                logger.warn("Skipping cache write for {}: codec produced no bytes", cacheKey);
            }
            return bytes;
        } catch (RuntimeException e) {
            logger.warn("Skipping cache write for {}: {}", cacheKey, describe(e));
            metricsCollector.recordCacheError("encode");
            return null;
        }
    }

    private void onPrimaryFailure(String operation, String cacheKey, long start, Exception e) {
        restoreInterrupt(e);
        circuitBreaker.recordFailure();
        metricsCollector.recordPrimaryCall(elapsedSince(start), false);
        logger.warn("Primary store {} failed for {}, falling back to cache (circuit {}): {}",
            operation, cacheKey, circuitBreaker.getState(), describe(e));
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Exception e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
