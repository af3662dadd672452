package com.fxmodules.system;

import com.fxmodules.core.error.FxException;
import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Started component graph.
 *
 * <p>Holds the instances in start order. {@link #halt()} stops them in reverse order and
 * only once.
 */
public class RunningSystem {

    private static final Logger log = LoggerFactory.getLogger(RunningSystem.class);

    private final List<GraphNode> nodes;
    private final Map<ComponentKey, Object> instances;
    private final AtomicBoolean halted = new AtomicBoolean();

    RunningSystem(List<GraphNode> nodes, Map<ComponentKey, Object> instances) {
        this.nodes = List.copyOf(nodes);
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
    }

    /**
     * Instance of a started node.
     *
     * @param key node key
     * @return instance; null if the node initialized to null
     * @throws IllegalArgumentException if no such node was started
     */
    public Object get(ComponentKey key) {
        if (!instances.containsKey(key)) {
            throw new IllegalArgumentException("No component started for key " + key);
        }
        return instances.get(key);
    }

    public <T> T get(ComponentKey key, Class<T> type) {
        return type.cast(get(key));
    }

    public Optional<Object> find(ComponentKey key) {
        return Optional.ofNullable(instances.get(key));
    }

    /**
     * Keys of started nodes, in start order.
     *
     * @return keys
     */
    public Set<ComponentKey> keys() {
        return instances.keySet();
    }

    public boolean isHalted() {
        return halted.get();
    }

    /**
     * Halts every node in reverse start order. Further calls do nothing.
     *
     * @throws FxException after all nodes were halted, if any of them failed to halt
     */
    public void halt() {
        if (!halted.compareAndSet(false, true)) {
            return;
        }

        List<GraphNode> reversed = new ArrayList<>(nodes);
        Collections.reverse(reversed);
        List<RuntimeException> failures = new ArrayList<>();
        for (GraphNode node : reversed) {
            try {
                node.handler().halt(node.key(), instances.get(node.key()));
                log.debug("Halted {}", node.key());
            } catch (RuntimeException e) {
                log.warn("Failed to halt {}: {}", node.key(), e.getMessage());
                failures.add(e);
            }
        }
        log.info("Halted {} components", reversed.size());

        if (!failures.isEmpty()) {
            FxException failure = new FxException("Failed to halt " + failures.size() + " components");
            failures.forEach(failure::addSuppressed);
            throw failure;
        }
    }
}
