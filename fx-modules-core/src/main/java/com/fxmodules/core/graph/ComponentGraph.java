package com.fxmodules.core.graph;

import com.fxmodules.core.util.OrderedMaps;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative component graph handed to the lifecycle manager.
 *
 * <p>Nothing in the graph is instantiated; dependencies exist only as {@link GraphRef}
 * placeholders. Node order is discovery order.
 *
 * @param nodes nodes by key
 */
public record ComponentGraph(Map<ComponentKey, GraphNode> nodes) {

    public ComponentGraph {
        nodes = OrderedMaps.copyOf(nodes);
    }

    public static ComponentGraph empty() {
        return new ComponentGraph(Map.of());
    }

    public static ComponentGraph of(Collection<GraphNode> nodes) {
        Map<ComponentKey, GraphNode> byKey = new LinkedHashMap<>();
        nodes.forEach(node -> byKey.put(node.key(), node));
        return new ComponentGraph(byKey);
    }

    public Optional<GraphNode> node(ComponentKey key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public boolean contains(ComponentKey key) {
        return nodes.containsKey(key);
    }

    public Set<ComponentKey> keys() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Keys a node references, whether or not they exist in this graph.
     *
     * @param key node key
     * @return referenced keys, empty for unknown nodes
     */
    public List<ComponentKey> dependencies(ComponentKey key) {
        return node(key).map(GraphNode::references).orElse(List.of());
    }

    /**
     * Combines two graphs; nodes of {@code other} replace nodes with the same key.
     *
     * @param other graph to add
     * @return merged graph
     */
    public ComponentGraph merge(ComponentGraph other) {
        Map<ComponentKey, GraphNode> merged = new LinkedHashMap<>(nodes);
        merged.putAll(other.nodes());
        return new ComponentGraph(merged);
    }
}
