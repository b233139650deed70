package com.txlens.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Optional;

/**
 * Namespaced, TTL-aware cache that tools use for results of expensive external calls. Keys are built with
 * {@link CacheKeys}; TTLs come from {@link CacheTtl}.
 */
public interface ToolCache {

    Optional<byte[]> get(String key);

    /**
     * @param ttl null means the cache's default TTL
     */
    void set(String key, byte[] value, Duration ttl);

    <T> Optional<T> getJson(String key, Class<T> type);

    <T> Optional<T> getJson(String key, TypeReference<T> type);

    /**
     * @param ttl null means the cache's default TTL
     * @throws CacheException when the value cannot be serialized
     */
    void setJson(String key, Object value, Duration ttl);

    boolean has(String key);

    /** Overwrites the entry with one that expires immediately. */
    void delete(String key);
}
