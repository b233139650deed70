package com.txlens.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process connector on a Caffeine cache with per-entry expiration. Bytes are copied on the way in and out
 * so callers can never mutate a stored entry.
 */
public class CaffeineKeyValueConnector implements KeyValueConnector {

    private final Cache<String, Entry> cache;

    public CaffeineKeyValueConnector(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineKeyValueConnector(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value().clone());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (value == null) {
            throw new CacheException("Cache value for '" + key + "' must not be null");
        }
        long ttlNanos = ttl == null ? Long.MAX_VALUE : Math.max(1L, saturatedNanos(ttl));
        cache.put(key, new Entry(value.clone(), ttlNanos));
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static long saturatedNanos(Duration ttl) {
        try {
            return ttl.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private record Entry(byte[] value, long ttlNanos) {
    }

    /** Every write, including an overwrite, restarts the entry's own TTL; reads never extend it. */
    private static final class PerEntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
