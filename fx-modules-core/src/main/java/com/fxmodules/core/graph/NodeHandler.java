package com.fxmodules.core.graph;

import java.util.Map;

/**
 * Init/halt behavior of a graph node.
 *
 * <p>The lifecycle manager calls {@link #init} once every reference in the node's
 * configuration has been replaced by the referenced instance, and {@link #halt} in
 * reverse dependency order when the system stops.
 */
public interface NodeHandler {

    /**
     * Handler that initializes a node to its resolved configuration.
     */
    NodeHandler CONFIG_VALUE = (key, config) -> config;

    /**
     * Creates the node instance.
     *
     * @param key node key
     * @param config resolved configuration
     * @return node instance
     */
    Object init(ComponentKey key, Map<String, Object> config);

    /**
     * Releases the node instance. Does nothing by default.
     *
     * @param key node key
     * @param instance value returned by {@link #init}
     */
    default void halt(ComponentKey key, Object instance) {
    }
}
