package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.util.OrderedMaps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ComponentCollector}: components, halt hooks and parent slot contributions.
 *
 * @param components standalone components by key, in discovery order
 * @param haltHooks halt behavior by the key of the component it halts
 * @param parentSlots child values by parent slot key, in discovery order
 */
public record CollectedComponents(
    Map<ComponentKey, CollectedComponent> components,
    Map<ComponentKey, HaltHook> haltHooks,
    Map<ComponentKey, List<Object>> parentSlots
) {
    /**
     * Compact constructor making defensive copies.
     */
    public CollectedComponents {
        components = OrderedMaps.copyOf(components);
        haltHooks = OrderedMaps.copyOf(haltHooks);
        Map<ComponentKey, List<Object>> slots = new LinkedHashMap<>();
        if (parentSlots != null) {
            parentSlots.forEach((key, values) -> slots.put(key, List.copyOf(values)));
        }
        parentSlots = OrderedMaps.copyOf(slots);
    }

    public boolean isEmpty() {
        return components.isEmpty() && haltHooks.isEmpty() && parentSlots.isEmpty();
    }

    /**
     * Mutable accumulator used while scopes are inspected.
     */
    static final class Builder {
        private final Map<ComponentKey, CollectedComponent> components = new LinkedHashMap<>();
        private final Map<ComponentKey, HaltHook> haltHooks = new LinkedHashMap<>();
        private final Map<ComponentKey, List<Object>> parentSlots = new LinkedHashMap<>();

        void component(CollectedComponent component) {
            components.put(component.key(), component);
        }

        void haltHook(ComponentKey target, HaltHook hook) {
            haltHooks.put(target, hook);
        }

        void child(ComponentKey parent, Object value) {
            parentSlots.computeIfAbsent(parent, key -> new ArrayList<>()).add(value);
        }

        CollectedComponents build() {
            return new CollectedComponents(components, haltHooks, parentSlots);
        }
    }
}
