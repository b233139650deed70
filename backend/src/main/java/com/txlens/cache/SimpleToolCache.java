package com.txlens.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link ToolCache} over a {@link KeyValueConnector}. Every key is stored as {@code prefix:key}; JSON values
 * go through Jackson. An entry that no longer deserializes is logged and reported as a miss so the caller
 * refetches and overwrites it.
 */
@Slf4j
public class SimpleToolCache implements ToolCache {

    static final Duration IMMEDIATE_EXPIRY = Duration.ofNanos(1);

    private final KeyValueConnector connector;
    private final ObjectMapper objectMapper;
    private final String prefix;
    private final Duration defaultTtl;

    /**
     * @param prefix     namespace; blank means keys are stored as given
     * @param defaultTtl used when a write passes no TTL; null means no expiry
     */
    public SimpleToolCache(KeyValueConnector connector, ObjectMapper objectMapper, String prefix, Duration defaultTtl) {
        this.connector = connector;
        this.objectMapper = objectMapper;
        this.prefix = prefix == null ? "" : prefix.strip();
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return connector.get(fullKey(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        connector.set(fullKey(key), value, ttl != null ? ttl : defaultTtl);
    }

    @Override
    public <T> Optional<T> getJson(String key, Class<T> type) {
        return readJson(key, objectMapper.constructType(type));
    }

    @Override
    public <T> Optional<T> getJson(String key, TypeReference<T> type) {
        return readJson(key, objectMapper.getTypeFactory().constructType(type));
    }

    @Override
    public void setJson(String key, Object value, Duration ttl) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize cache value for " + fullKey(key), e);
        }
        set(key, bytes, ttl);
    }

    @Override
    public boolean has(String key) {
        return get(key).isPresent();
    }

    @Override
    public void delete(String key) {
        connector.set(fullKey(key), new byte[0], IMMEDIATE_EXPIRY);
    }

    String fullKey(String key) {
        return prefix.isEmpty() ? key : prefix + ":" + key;
    }

    private <T> Optional<T> readJson(String key, JavaType type) {
        Optional<byte[]> bytes = get(key);
        if (bytes.isEmpty() || bytes.get().length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(bytes.get(), type));
        } catch (IOException e) {
            log.warn("Discarding unreadable cache entry {}: {}", fullKey(key), e.getMessage());
            return Optional.empty();
        }
    }
}
