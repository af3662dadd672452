package com.fxmodules.core.graph;

import java.util.Objects;

/**
 * Placeholder for another node's instance inside a node configuration.
 *
 * <p>The graph builder only records the target key; the lifecycle manager replaces the
 * placeholder with the initialized instance, and is the one place a missing target is
 * reported.
 *
 * @param target key of the referenced node
 */
public record GraphRef(ComponentKey target) {

    public GraphRef {
        Objects.requireNonNull(target, "target must not be null");
    }

    public static GraphRef to(ComponentKey target) {
        return new GraphRef(target);
    }

    @Override
    public String toString() {
        return "#ref " + target;
    }
}
