package com.fxmodules.system;

import com.fxmodules.core.error.FxException;
import com.fxmodules.core.graph.ComponentGraph;
import com.fxmodules.core.graph.ComponentKey;
import com.fxmodules.core.graph.GraphNode;
import com.fxmodules.core.graph.GraphRef;
import com.fxmodules.core.graph.NodeHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SystemLifecycle} and {@link RunningSystem} on hand-built graphs.
 */
class SystemLifecycleTest {

    private static final ComponentKey DB = ComponentKey.of("app", "db");
    private static final ComponentKey CACHE = ComponentKey.of("app", "cache");
    private static final ComponentKey API = ComponentKey.of("app", "api");

    private final List<String> events = new ArrayList<>();
    private final SystemLifecycle lifecycle = new SystemLifecycle();

    @Test
    void init_dependencyDeclaredLater_startsFirst() {
        ComponentGraph graph = graph(
            node(API, Map.of("db", GraphRef.to(DB))),
            node(DB, Map.of()));

        RunningSystem system = lifecycle.init(graph);

        assertThat(events).containsExactly("init app/db", "init app/api");
        assertThat(system.keys()).containsExactly(DB, API);
    }

    @Test
    void initOrder_independentNodes_keepGraphOrder() {
        ComponentGraph graph = graph(node(CACHE, Map.of()), node(DB, Map.of()), node(API, Map.of()));

        assertThat(lifecycle.initOrder(graph)).containsExactly(CACHE, DB, API);
    }

    @Test
    void init_refsInsideCollections_resolvedToInstances() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("backends", List.of(GraphRef.to(DB), GraphRef.to(CACHE)));
        config.put("named", Map.of("primary", GraphRef.to(DB)));
        config.put("timeout", 30);
        ComponentGraph graph = graph(node(DB, Map.of()), node(CACHE, Map.of()),
            new GraphNode(API, config, NodeHandler.CONFIG_VALUE));

        RunningSystem system = lifecycle.init(graph);

        @SuppressWarnings("unchecked")
        Map<String, Object> api = (Map<String, Object>) system.get(API);
        assertThat(api.get("backends")).isEqualTo(List.of("instance of app/db", "instance of app/cache"));
        assertThat(api.get("named")).isEqualTo(Map.of("primary", "instance of app/db"));
        assertThat(api.get("timeout")).isEqualTo(30);
    }

    @Test
    void init_refsInsideSet_keepOrderAndRefFreeValuesKeepIdentity() {
        Set<Object> pool = new LinkedHashSet<>(List.of(GraphRef.to(CACHE), GraphRef.to(DB)));
        List<String> plain = List.of("test-1", "test-2");
        Map<String, Object> slot = Map.of("component", plain);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("pool", pool);
        config.put("plain", plain);
        config.put("slot", slot);
        ComponentGraph graph = graph(node(DB, Map.of()), node(CACHE, Map.of()),
            new GraphNode(API, config, NodeHandler.CONFIG_VALUE));

        @SuppressWarnings("unchecked")
        Map<String, Object> api = (Map<String, Object>) lifecycle.init(graph).get(API);

        assertThat((Set<Object>) api.get("pool")).containsExactly("instance of app/cache", "instance of app/db");
        assertThat(api.get("plain")).isSameAs(plain);
        assertThat(api.get("slot")).isSameAs(slot);
    }

    @Test
    void init_missingDependency_failsBeforeAnyInit() {
        ComponentGraph graph = graph(node(DB, Map.of()), node(API, Map.of("cache", GraphRef.to(CACHE))));

        assertThatThrownBy(() -> lifecycle.init(graph))
            .isInstanceOf(MissingDependencyException.class)
            .hasMessageContaining("app/cache")
            .satisfies(e -> {
                MissingDependencyException missing = (MissingDependencyException) e;
                assertThat(missing.getNode()).isEqualTo(API);
                assertThat(missing.getMissing()).isEqualTo(CACHE);
            });
        assertThat(events).isEmpty();
    }

    @Test
    void init_cycle_reportsCyclePath() {
        ComponentGraph graph = graph(
            node(DB, Map.of("api", GraphRef.to(API))),
            node(API, Map.of("db", GraphRef.to(DB))));

        assertThatThrownBy(() -> lifecycle.init(graph))
            .isInstanceOf(CyclicDependencyException.class)
            .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle()).containsExactly(DB, API, DB));
    }

    @Test
    void init_nodeFails_haltsStartedNodesInReverse() {
        NodeHandler exploding = (key, config) -> {
            throw new IllegalStateException("port in use");
        };
        ComponentGraph graph = graph(
            node(DB, Map.of()),
            node(CACHE, Map.of("db", GraphRef.to(DB))),
            new GraphNode(API, Map.of("cache", GraphRef.to(CACHE)), exploding));

        assertThatThrownBy(() -> lifecycle.init(graph))
            .isInstanceOf(SystemInitException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("port in use")
            .satisfies(e -> assertThat(((SystemInitException) e).getKey()).isEqualTo(API));
        assertThat(events).containsExactly("init app/db", "init app/cache", "halt app/cache", "halt app/db");
    }

    @Test
    void halt_reverseOrderOnlyOnce() {
        RunningSystem system = lifecycle.init(graph(
            node(DB, Map.of()),
            node(API, Map.of("db", GraphRef.to(DB)))));
        events.clear();

        system.halt();
        system.halt();

        assertThat(events).containsExactly("halt app/api", "halt app/db");
        assertThat(system.isHalted()).isTrue();
    }

    @Test
    void halt_failingNode_othersStillHalted() {
        NodeHandler failingHalt = new NodeHandler() {
            @Override
            public Object init(ComponentKey key, Map<String, Object> config) {
                return "api";
            }

            @Override
            public void halt(ComponentKey key, Object instance) {
                throw new IllegalStateException("stuck");
            }
        };
        RunningSystem system = lifecycle.init(graph(
            node(DB, Map.of()),
            new GraphNode(API, Map.of("db", GraphRef.to(DB)), failingHalt)));

        assertThatThrownBy(system::halt)
            .isInstanceOf(FxException.class)
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(events).endsWith("halt app/db");
    }

    @Test
    void get_unknownKey_throws() {
        RunningSystem system = lifecycle.init(graph(node(DB, Map.of())));

        assertThatThrownBy(() -> system.get(API)).isInstanceOf(IllegalArgumentException.class);
        assertThat(system.find(API)).isEmpty();
        assertThat(system.get(DB, String.class)).isEqualTo("instance of app/db");
    }

    private GraphNode node(ComponentKey key, Map<String, Object> config) {
        return new GraphNode(key, config, new RecordingHandler());
    }

    private static ComponentGraph graph(GraphNode... nodes) {
        return ComponentGraph.of(List.of(nodes));
    }

    /**
     * Records init and halt calls in {@link #events}.
     */
    private final class RecordingHandler implements NodeHandler {

        @Override
        public Object init(ComponentKey key, Map<String, Object> config) {
            events.add("init " + key);
            return "instance of " + key;
        }

        @Override
        public void halt(ComponentKey key, Object instance) {
            events.add("halt " + key);
        }
    }
}
