package com.fxmodules.system;

import com.fxmodules.core.error.FxException;
import com.fxmodules.core.graph.ComponentKey;

/**
 * A node failed to initialize. Nodes started before it have been halted.
 */
public class SystemInitException extends FxException {

    private final ComponentKey key;

    public SystemInitException(ComponentKey key, Throwable cause) {
        super("Failed to initialize " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public ComponentKey getKey() {
        return key;
    }
}
