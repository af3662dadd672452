package com.fxmodules.core.graph;

import com.fxmodules.core.util.OrderedMaps;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative node of a component graph.
 *
 * @param key node key
 * @param config configuration; values may be {@link GraphRef}s, collections or maps containing them, or plain values
 * @param handler init/halt behavior
 */
public record GraphNode(ComponentKey key, Map<String, Object> config, NodeHandler handler) {

    public GraphNode {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        config = OrderedMaps.copyOf(config);
    }

    /**
     * Keys referenced anywhere in this node's configuration, in configuration order.
     *
     * @return referenced keys, possibly with duplicates removed
     */
    public List<ComponentKey> references() {
        List<ComponentKey> references = new ArrayList<>();
        config.values().forEach(value -> collect(value, references));
        return references.stream().distinct().toList();
    }

    public GraphNode withConfig(String name, Object value) {
        return new GraphNode(key, OrderedMaps.with(config, name, value), handler);
    }

    private static void collect(Object value, List<ComponentKey> references) {
        if (value instanceof GraphRef ref) {
            references.add(ref.target());
        } else if (value instanceof Collection<?> values) {
            values.forEach(item -> collect(item, references));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(item -> collect(item, references));
        }
    }
}
