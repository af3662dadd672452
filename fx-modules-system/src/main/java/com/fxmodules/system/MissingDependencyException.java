package com.fxmodules.system;

import com.fxmodules.core.error.FxException;
import com.fxmodules.core.graph.ComponentKey;

/**
 * A node references a key that is not part of the component graph.
 */
public class MissingDependencyException extends FxException {

    private final ComponentKey node;
    private final ComponentKey missing;

    public MissingDependencyException(ComponentKey node, ComponentKey missing) {
        super("Missing definition for key " + missing + " referenced by " + node);
        this.node = node;
        this.missing = missing;
    }

    public ComponentKey getNode() {
        return node;
    }

    public ComponentKey getMissing() {
        return missing;
    }
}
