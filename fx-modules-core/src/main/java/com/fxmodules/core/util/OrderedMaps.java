package com.fxmodules.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for immutable maps that keep insertion order.
 *
 * <p>{@link Map#copyOf(Map)} drops ordering, which matters for declaration-ordered
 * entity properties and graph configuration.
 */
public final class OrderedMaps {

    private OrderedMaps() {
    }

    /**
     * Returns an unmodifiable, insertion-ordered copy of the given map.
     *
     * @param source map to copy, may be null
     * @param <K> key type
     * @param <V> value type
     * @return unmodifiable copy, empty for null input
     */
    public static <K, V> Map<K, V> copyOf(Map<? extends K, ? extends V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Returns a copy of {@code source} with one entry added or replaced.
     *
     * @param source original map
     * @param key key to put
     * @param value value to put
     * @param <K> key type
     * @param <V> value type
     * @return unmodifiable copy with the entry
     */
    public static <K, V> Map<K, V> with(Map<K, V> source, K key, V value) {
        Map<K, V> copy = new LinkedHashMap<>(source);
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }
}
