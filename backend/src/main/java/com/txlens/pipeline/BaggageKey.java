package com.txlens.pipeline;

import java.util.Objects;

/**
 * Typed slot identifier for a {@link Baggage} entry. The name is the wire-level key other tools depend on;
 * the raw type is what a reader expects to find there. Generic element types are not checked.
 *
 * @param <T> value type stored under the key
 */
public final class BaggageKey<T> {

    private final String name;
    private final Class<?> rawType;

    private BaggageKey(String name, Class<?> rawType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Baggage key name must not be blank");
        }
        this.name = name;
        this.rawType = Objects.requireNonNull(rawType, "rawType");
    }

    public static <T> BaggageKey<T> of(String name, Class<T> type) {
        return new BaggageKey<>(name, type);
    }

    /**
     * Key for a parameterized value such as {@code List<TokenTransfer>}; only the raw type is checked on read.
     */
    public static <T> BaggageKey<T> ofGeneric(String name, Class<?> rawType) {
        return new BaggageKey<>(name, rawType);
    }

    public String name() {
        return name;
    }

    public Class<?> rawType() {
        return rawType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BaggageKey<?> other)) return false;
        return name.equals(other.name) && rawType.equals(other.rawType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rawType);
    }

    @Override
    public String toString() {
        return name + "<" + rawType.getSimpleName() + ">";
    }
}
