package com.lms.fallback.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local cache store with per-entry expiry.
 * Expired entries are dropped lazily when read or when {@link #purgeExpired()} runs.
 */
public class InMemoryCacheStore implements CacheStore {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheStore.class);
    
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    
    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }
    
    public InMemoryCacheStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }
    
    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            logger.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        
        return Optional.of(entry.value().clone());
    }
    
    @Override
    public void put(String key, byte[] value, long ttlSeconds) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (ttlSeconds < 1) {
            throw new IllegalArgumentException("ttlSeconds must be at least 1");
        }
        
        entries.put(key, new Entry(value.clone(), clock.instant().plusSeconds(ttlSeconds)));
    }
    
    /**
     * Removes all expired entries.
     * 
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            logger.debug("Purged {} expired cache entries", removed);
        }
        return removed;
    }
    
    public int size() {
        return entries.size();
    }
    
    private record Entry(byte[] value, Instant expiresAt) {
        
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
