package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;
import com.fxmodules.core.graph.ComponentGraph;
import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.GraphNode;
import com.fxmodules.core.graph.GraphRef;
import com.fxmodules.core.graph.NodeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns entity declarations into component graph nodes.
 *
 * <p>Preparing a declaration checks its grammar, normalizes it and returns a node keyed
 * {@code fx.entity/<entity type>} whose configuration is
 * {@code {spec: <canonical spec>, <dependency type>: #ref fx.entity/<dependency type>, ...}}.
 * The lifecycle manager therefore initializes referenced entities first; initializing the
 * node registers the spec and yields the {@link Entity} handle.
 */
public final class EntityNodes {

    /** Scope of entity nodes in the component graph. */
    public static final String SCOPE = "fx.entity";

    /** Configuration entry holding the canonical spec. */
    public static final String SPEC_ENTRY = "spec";

    private static final Logger log = LoggerFactory.getLogger(EntityNodes.class);

    private EntityNodes() {
    }

    public static ComponentKey key(EntityType type) {
        return ComponentKey.of(SCOPE, type.toString());
    }

    /**
     * Prepares one entity declaration.
     *
     * @param type declared entity type
     * @param rawSpec raw spec in DSL form
     * @param registry registry the node registers into when initialized
     * @return graph node for the entity
     * @throws SpecGrammarException naming the entity if the spec violates the grammar
     */
    public static GraphNode prepare(EntityType type, Object rawSpec, EntityRegistry registry) {
        Diagnostics grammar = EntitySpecParser.explain(rawSpec);
        if (!grammar.isEmpty()) {
            throw new SpecGrammarException("Invalid spec schema for entity " + type, grammar);
        }

        PreparedSpec prepared = EntitySpecNormalizer.prepare(rawSpec);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(SPEC_ENTRY, prepared.spec());
        for (EntityType dependency : prepared.dependencies()) {
            // a self reference needs no ordering
            if (!dependency.equals(type)) {
                config.put(dependency.toString(), GraphRef.to(key(dependency)));
            }
        }

        log.debug("Prepared entity {} depending on {}", type, prepared.dependencies());
        return new GraphNode(key(type), config, new EntityNodeHandler(type, registry));
    }

    /**
     * Prepares a set of declarations keyed by qualified entity type.
     *
     * @param declarations raw specs by {@code namespace/name}
     * @param registry registry the nodes register into
     * @return graph of entity nodes, in declaration order
     */
    public static ComponentGraph prepareAll(Map<String, ?> declarations, EntityRegistry registry) {
        List<GraphNode> nodes = new ArrayList<>();
        declarations.forEach((type, rawSpec) -> nodes.add(prepare(EntityType.parse(type), rawSpec, registry)));
        return ComponentGraph.of(nodes);
    }

    /**
     * Registers the prepared spec and returns the entity handle.
     */
    static final class EntityNodeHandler implements NodeHandler {

        private final EntityType type;
        private final EntityRegistry registry;

        EntityNodeHandler(EntityType type, EntityRegistry registry) {
            this.type = type;
            this.registry = registry;
        }

        @Override
        public Object init(ComponentKey key, Map<String, Object> config) {
            return registry.register(type, (EntitySpec) config.get(SPEC_ENTRY));
        }
    }
}
