package com.fxmodules.system;

import com.fxmodules.core.graph.ComponentGraph;
import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.GraphNode;
import com.fxmodules.core.graph.GraphRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference lifecycle manager for component graphs.
 *
 * <p>Initializes nodes so that every node starts after the nodes it references, replacing
 * each {@link GraphRef} in a node's configuration with the referenced instance. Nodes
 * without an ordering constraint between them start in graph order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RunningSystem system = new SystemLifecycle().init(graph);
 * Object status = system.get(ComponentKey.parse("com.acme.web/status"));
 * system.halt();
 * }</pre>
 */
public class SystemLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SystemLifecycle.class);

    /**
     * Starts every node of the graph.
     *
     * @param graph component graph
     * @return running system
     * @throws MissingDependencyException if a node references a key absent from the graph
     * @throws CyclicDependencyException if references form a cycle
     * @throws SystemInitException if a node fails to initialize
     */
    public RunningSystem init(ComponentGraph graph) {
        List<ComponentKey> order = initOrder(graph);
        log.info("Starting system with {} components", order.size());

        Map<ComponentKey, Object> instances = new LinkedHashMap<>();
        List<GraphNode> started = new ArrayList<>();
        for (ComponentKey key : order) {
            GraphNode node = graph.nodes().get(key);
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> config = (Map<String, Object>) resolve(node.config(), instances);
                Object instance = node.handler().init(key, config);
                instances.put(key, instance);
                started.add(node);
                log.debug("Started {}", key);
            } catch (RuntimeException e) {
                log.error("Failed to start {}: {}", key, e.getMessage());
                RunningSystem partial = new RunningSystem(started, instances);
                try {
                    partial.halt();
                } catch (RuntimeException haltFailure) {
                    e.addSuppressed(haltFailure);
                }
                throw new SystemInitException(key, e);
            }
        }

        return new RunningSystem(started, instances);
    }

    /**
     * Computes the start order without initializing anything.
     *
     * @param graph component graph
     * @return keys, dependencies before dependents
     * @throws MissingDependencyException if a node references a key absent from the graph
     * @throws CyclicDependencyException if references form a cycle
     */
    public List<ComponentKey> initOrder(ComponentGraph graph) {
        Set<ComponentKey> ordered = new LinkedHashSet<>();
        Set<ComponentKey> visiting = new LinkedHashSet<>();
        for (ComponentKey key : graph.keys()) {
            visit(graph, key, visiting, ordered);
        }
        return List.copyOf(ordered);
    }

    private void visit(ComponentGraph graph, ComponentKey key, Set<ComponentKey> visiting, Set<ComponentKey> ordered) {
        if (ordered.contains(key)) {
            return;
        }
        if (visiting.contains(key)) {
            List<ComponentKey> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (ComponentKey candidate : visiting) {
                inCycle = inCycle || candidate.equals(key);
                if (inCycle) {
                    cycle.add(candidate);
                }
            }
            cycle.add(key);
            throw new CyclicDependencyException(cycle);
        }

        visiting.add(key);
        for (ComponentKey dependency : graph.dependencies(key)) {
            if (!graph.contains(dependency)) {
                throw new MissingDependencyException(key, dependency);
            }
            visit(graph, dependency, visiting, ordered);
        }
        visiting.remove(key);
        ordered.add(key);
    }

    /**
     * Replaces {@link GraphRef}s with started instances. Values holding no reference are
     * returned as-is; rebuilt collections keep their iteration order.
     */
    private static Object resolve(Object value, Map<ComponentKey, Object> instances) {
        if (value instanceof GraphRef ref) {
            return instances.get(ref.target());
        }
        if (!containsRef(value)) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(k, resolve(v, instances)));
            return resolved;
        }
        Collection<?> values = (Collection<?>) value;
        Collection<Object> resolved = value instanceof Set<?>
            ? new LinkedHashSet<>() : new ArrayList<>(values.size());
        values.forEach(item -> resolved.add(resolve(item, instances)));
        return resolved;
    }

    private static boolean containsRef(Object value) {
        if (value instanceof GraphRef) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(SystemLifecycle::containsRef);
        }
        if (value instanceof Collection<?> values) {
            return values.stream().anyMatch(SystemLifecycle::containsRef);
        }
        return false;
    }
}
