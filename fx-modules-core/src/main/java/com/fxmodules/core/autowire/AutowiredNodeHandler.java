package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.NodeHandler;

import java.util.Map;

/**
 * Node behavior of an autowired component: calls its factory, or hands out its value as-is.
 */
final class AutowiredNodeHandler implements NodeHandler {

    private final Object value;
    private final HaltHook haltHook;

    AutowiredNodeHandler(Object value, HaltHook haltHook) {
        this.value = value;
        this.haltHook = haltHook;
    }

    @Override
    public Object init(ComponentKey key, Map<String, Object> config) {
        if (value instanceof ComponentFactory factory) {
            return factory.create(new Dependencies(config));
        }
        return value;
    }

    @Override
    public void halt(ComponentKey key, Object instance) {
        if (haltHook != null) {
            haltHook.halt(instance);
        }
    }
}
