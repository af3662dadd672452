package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.util.OrderedMaps;

import java.util.Map;
import java.util.Objects;

/**
 * An AUTOWIRED definition together with its resolved dependency edges.
 *
 * @param key scope-qualified component key
 * @param definition raw definition
 * @param dependencies parameter name to the component key injected there
 */
public record CollectedComponent(ComponentKey key, Definition definition, Map<String, ComponentKey> dependencies) {

    public CollectedComponent {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        dependencies = OrderedMaps.copyOf(dependencies);
    }
}
