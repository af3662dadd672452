package com.fxmodules.system;

import com.fxmodules.core.autowire.Autowire;
import com.fxmodules.core.config.ConfigLoader;
import com.fxmodules.core.config.FxConfig;
import com.fxmodules.core.entity.Entity;
import com.fxmodules.core.entity.EntityNodes;
import com.fxmodules.core.entity.EntityRegistry;
import com.fxmodules.core.entity.EntityType;
import com.fxmodules.core.graph.ComponentGraph;
import com.fxmodules.core.graph.ComponentKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Bootstrap of an FX application.
 *
 * <p>Builds one component graph from the autowired scopes and the entities declared in
 * configuration, then starts it with {@link SystemLifecycle}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (FxSystem system = FxSystem.start(Path.of("fx.yaml"))) {
 *     Entity client = system.entity("shop.client/client");
 *     client.validate(Map.of("id", UUID.randomUUID()));
 * }
 * }</pre>
 */
public final class FxSystem implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FxSystem.class);

    private final EntityRegistry registry;
    private final RunningSystem running;

    private FxSystem(EntityRegistry registry, RunningSystem running) {
        this.registry = registry;
        this.running = running;
    }

    /**
     * Declarative graph for a configuration: autowired components plus entity nodes.
     *
     * @param config system configuration
     * @param registry registry entity nodes register into
     * @return component graph
     */
    public static ComponentGraph graph(FxConfig config, EntityRegistry registry) {
        ComponentGraph components = new Autowire(config.scanContext()).configure();
        ComponentGraph entities = EntityNodes.prepareAll(config.entities(), registry);
        return components.merge(entities);
    }

    public static FxSystem start(FxConfig config) {
        return start(config, new EntityRegistry());
    }

    /**
     * Starts a system whose entities register into the given registry.
     *
     * @param config system configuration
     * @param registry entity registry
     * @return started system
     */
    public static FxSystem start(FxConfig config, EntityRegistry registry) {
        log.info("Starting {}", config.project().name());
        ComponentGraph graph = graph(config, registry);
        RunningSystem running = new SystemLifecycle().init(graph);
        log.info("Started {} with {} components and {} entities",
            config.project().name(), running.keys().size(), config.entities().size());
        return new FxSystem(registry, running);
    }

    public static FxSystem start(Path configPath) {
        return start(ConfigLoader.load(configPath));
    }

    /**
     * Starts a system configured by {@value ConfigLoader#DEFAULT_RESOURCE} on the class path.
     *
     * @return started system
     */
    public static FxSystem start() {
        return start(ConfigLoader.loadResource(ConfigLoader.DEFAULT_RESOURCE));
    }

    /**
     * Handle of an entity declared in configuration.
     *
     * @param type qualified entity type, e.g. {@code shop.client/client}
     * @return entity handle
     * @throws IllegalArgumentException if the entity was not declared
     */
    public Entity entity(String type) {
        return running.get(EntityNodes.key(EntityType.parse(type)), Entity.class);
    }

    /**
     * Instance of a started component.
     *
     * @param key {@code scope/name}
     * @return component instance
     * @throws IllegalArgumentException if no such component was started
     */
    public Object component(String key) {
        return running.get(ComponentKey.parse(key));
    }

    public EntityRegistry registry() {
        return registry;
    }

    public RunningSystem running() {
        return running;
    }

    public void halt() {
        running.halt();
    }

    @Override
    public void close() {
        halt();
    }
}
