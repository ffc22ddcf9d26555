package com.morphirbridge.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copies of maps that keep insertion order.
 *
 * <p>IR collections are ordered on the wire; keeping that order makes written output stable
 * while {@link Map#equals(Object)} still compares them as unordered maps.
 */
public final class OrderedMaps {

    private OrderedMaps() {
        // Utility class
    }

    /**
     * @param source map to copy, {@code null} treated as empty
     * @return unmodifiable copy preserving iteration order
     * @throws NullPointerException if a key or value is {@code null}
     */
    public static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<K, V> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(
            Objects.requireNonNull(key, "map key must not be null"),
            Objects.requireNonNull(value, "map value must not be null")));
        return Collections.unmodifiableMap(copy);
    }
}
