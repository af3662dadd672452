package com.fxmodules.core.autowire;

import com.fxmodules.core.util.OrderedMaps;

import java.util.Map;
import java.util.Set;

/**
 * Resolved dependencies handed to a {@link ComponentFactory}, keyed by parameter name.
 */
public final class Dependencies {

    private final Map<String, Object> values;

    public Dependencies(Map<String, Object> values) {
        this.values = OrderedMaps.copyOf(values);
    }

    /**
     * Returns a dependency cast to the expected type.
     *
     * @param parameter parameter name
     * @param type expected type
     * @param <T> expected type
     * @return dependency instance
     * @throws IllegalArgumentException if no dependency was injected under that name
     */
    public <T> T get(String parameter, Class<T> type) {
        if (!values.containsKey(parameter)) {
            throw new IllegalArgumentException("No dependency injected as " + parameter + ", have " + values.keySet());
        }
        return type.cast(values.get(parameter));
    }

    public Object get(String parameter) {
        return get(parameter, Object.class);
    }

    public boolean contains(String parameter) {
        return values.containsKey(parameter);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
