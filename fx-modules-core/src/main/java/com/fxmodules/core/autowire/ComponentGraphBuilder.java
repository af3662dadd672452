package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentGraph;
import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.GraphNode;
import com.fxmodules.core.graph.GraphRef;
import com.fxmodules.core.graph.NodeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns collected components into a declarative {@link ComponentGraph}.
 *
 * <p>Every declared dependency becomes a {@link GraphRef} under its parameter name, whether
 * or not the target exists; unresolved targets are reported by the lifecycle manager when
 * the graph is initialized. Parent slots receive a {@value #SLOT_ENTRY} entry holding the
 * single child value, or the list of child values when several children target the slot.
 */
public class ComponentGraphBuilder {

    /** Configuration entry holding a parent slot's merged child values. */
    public static final String SLOT_ENTRY = "component";

    private static final Logger log = LoggerFactory.getLogger(ComponentGraphBuilder.class);

    public ComponentGraph build(CollectedComponents collected) {
        Map<ComponentKey, GraphNode> nodes = new LinkedHashMap<>();

        collected.components().forEach((key, component) -> {
            Map<String, Object> config = new LinkedHashMap<>();
            component.dependencies().forEach((parameter, target) -> config.put(parameter, GraphRef.to(target)));
            HaltHook haltHook = collected.haltHooks().get(key);
            nodes.put(key, new GraphNode(key, config, new AutowiredNodeHandler(component.definition().value(), haltHook)));
        });

        collected.parentSlots().forEach((parent, children) -> {
            Object merged = children.size() == 1 ? children.get(0) : List.copyOf(children);
            GraphNode existing = nodes.get(parent);
            if (existing != null) {
                nodes.put(parent, existing.withConfig(SLOT_ENTRY, merged));
            } else {
                nodes.put(parent, new GraphNode(parent, Map.of(SLOT_ENTRY, merged), NodeHandler.CONFIG_VALUE));
            }
        });

        collected.haltHooks().keySet().stream()
            .filter(target -> !collected.components().containsKey(target))
            .forEach(target -> log.warn("Halt hook targets {}, which is not an autowired component", target));

        log.info("Built component graph with {} nodes", nodes.size());
        return new ComponentGraph(nodes);
    }
}
