package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects AUTOWIRED definitions from scanned scopes.
 *
 * <p>For each tagged definition:
 * <ul>
 *   <li>a definition tagged {@code haltsFor} becomes the halt hook of its target;</li>
 *   <li>a definition naming parent slots contributes its value to each slot;</li>
 *   <li>any other definition becomes a component keyed {@code scope/name}, with one
 *       dependency edge per injected parameter.</li>
 * </ul>
 * Untagged definitions are skipped without error.
 */
public class ComponentCollector {

    private static final Logger log = LoggerFactory.getLogger(ComponentCollector.class);

    /**
     * Collects definitions of all scopes, in scope order then declaration order.
     *
     * @param scopes scanned scopes
     * @return collected components, halt hooks and parent slots
     */
    public CollectedComponents collect(List<ComponentScope> scopes) {
        CollectedComponents.Builder collected = new CollectedComponents.Builder();
        for (ComponentScope scope : scopes) {
            for (Definition definition : scope.definitions()) {
                collect(scope.name(), definition, collected);
            }
        }

        CollectedComponents result = collected.build();
        log.info("Collected {} components, {} halt hooks and {} parent slots from {} scopes",
            result.components().size(), result.haltHooks().size(), result.parentSlots().size(), scopes.size());
        return result;
    }

    void collect(String scope, Definition definition, CollectedComponents.Builder collected) {
        if (!definition.isAutowired()) {
            log.trace("Skipping untagged definition {}/{}", scope, definition.name());
            return;
        }

        ComponentKey key = ComponentKey.of(scope, definition.name());
        Definition.Metadata metadata = definition.metadata();

        if (metadata.isHaltHook()) {
            if (!(definition.value() instanceof HaltHook hook)) {
                throw new IllegalArgumentException("Halt definition " + key + " must hold a HaltHook");
            }
            collected.haltHook(key.resolve(metadata.haltsFor()), hook);
            log.debug("Found halt hook {} for {}", key, metadata.haltsFor());
            return;
        }

        if (metadata.isChild()) {
            for (String parent : metadata.parents()) {
                collected.child(key.resolve(parent), definition.value());
            }
            log.debug("Found child component {} of {}", key, metadata.parents());
            return;
        }

        collected.component(new CollectedComponent(key, definition, dependencies(key, metadata.injections())));
        log.debug("Found component {} with dependencies {}", key, metadata.injections());
    }

    /**
     * Resolves injected parameters to dependency edges.
     *
     * @param key owning component
     * @param injections tagged parameters
     * @return parameter name to target key
     */
    static Map<String, ComponentKey> dependencies(ComponentKey key, List<Injection> injections) {
        Map<String, ComponentKey> dependencies = new LinkedHashMap<>();
        for (Injection injection : injections) {
            dependencies.put(injection.parameter(), key.resolve(injection.target()));
        }
        return dependencies;
    }
}
