package com.txlens.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared mutable state of one pipeline run. Created fresh per run, passed by reference into every tool,
 * never cleared while the run is in progress. Not thread-safe: the sequential pipeline guarantees a single
 * writer at a time.
 * <p>
 * Reads through {@link BaggageKey} return {@link Optional#empty()} both when the key was never written and
 * when the stored value has an unexpected type, so a tool that merely prefers an upstream output can treat
 * both as "no data".
 */
@Slf4j
public final class Baggage {

    private final Map<String, Object> values;

    public Baggage() {
        this.values = new LinkedHashMap<>();
    }

    public Baggage(Map<String, ?> initial) {
        this.values = new LinkedHashMap<>();
        if (initial != null) {
            initial.forEach(this::put);
        }
    }

    public <T> Optional<T> get(BaggageKey<T> key) {
        Object value = values.get(key.name());
        if (value == null) {
            return Optional.empty();
        }
        if (!key.rawType().isInstance(value)) {
            log.debug("Baggage key '{}' holds {} but {} was expected; treating as absent",
                    key.name(), value.getClass().getSimpleName(), key.rawType().getSimpleName());
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return Optional.of(typed);
    }

    public <T> void put(BaggageKey<T> key, T value) {
        put(key.name(), value);
    }

    /** Untyped read for keys without a declared slot. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** Untyped write. Null values are rejected: absence is expressed by not writing the key. */
    public void put(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Baggage key must not be blank");
        }
        values.put(key, Objects.requireNonNull(value, () -> "Baggage value for '" + key + "' must not be null"));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public boolean contains(BaggageKey<?> key) {
        return get(key).isPresent();
    }

    public int size() {
        return values.size();
    }

    /** Keys in write order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /** Read-only view for final consumers (result assembly, debugging). */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
