package com.fxmodules.system;

import com.fxmodules.core.error.FxException;
import com.fxmodules.core.graph.ComponentKey;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Component graph nodes reference each other in a cycle.
 */
public class CyclicDependencyException extends FxException {

    private final List<ComponentKey> cycle;

    public CyclicDependencyException(List<ComponentKey> cycle) {
        super("Cyclic dependency: " + cycle.stream().map(ComponentKey::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Keys along the cycle; the first key is repeated at the end.
     *
     * @return cycle path
     */
    public List<ComponentKey> getCycle() {
        return cycle;
    }
}
