package com.fxmodules.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Humanized error report: an ordered map of path (field name or DSL location) to messages.
 *
 * <p>Both grammar failures and data validation failures are reported through this type.
 * Example rendering: {@code {id=[missing required key], name=[should be a string]}}.
 */
public final class Diagnostics {

    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    public Diagnostics add(String path, String message) {
        errors.computeIfAbsent(path, k -> new ArrayList<>()).add(message);
        return this;
    }

    public Diagnostics addAll(String prefix, Diagnostics nested) {
        nested.errors.forEach((path, messages) -> {
            String fullPath = prefix.isEmpty() ? path : prefix + "." + path;
            messages.forEach(message -> add(fullPath, message));
        });
        return this;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * Returns an immutable copy of the collected errors, keyed by path in insertion order.
     *
     * @return path to messages
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((path, messages) -> copy.put(path, List.copyOf(messages)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return errors.toString();
    }
}
