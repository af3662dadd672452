package com.fxmodules.core.autowire;

import com.fxmodules.core.graph.ComponentGraph;

import java.util.List;

/**
 * Entry point of autowiring: scan scopes, collect tagged definitions, build the graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Autowire autowire = new Autowire(ScanContext.defaults());
 * ComponentGraph graph = autowire.configure("com.acme");
 * }</pre>
 */
public class Autowire {

    private final ScopeScanner scanner;
    private final ComponentCollector collector;
    private final ComponentGraphBuilder builder;

    public Autowire(ScanContext context) {
        this(new ScopeScanner(context), new ComponentCollector(), new ComponentGraphBuilder());
    }

    public Autowire(ScopeScanner scanner, ComponentCollector collector, ComponentGraphBuilder builder) {
        this.scanner = scanner;
        this.collector = collector;
        this.builder = builder;
    }

    public List<ComponentScope> findProjectScopes() {
        return scanner.scan();
    }

    /**
     * Lists project scopes under a root.
     *
     * @param root {@link String} or {@link ScopeName}; null yields nothing
     * @return project scopes
     */
    public List<ComponentScope> findProjectScopes(Object root) {
        return scanner.scan(root);
    }

    /**
     * Builds the component graph of the configured default root.
     *
     * @return component graph
     */
    public ComponentGraph configure() {
        return builder.build(collector.collect(scanner.scan()));
    }

    /**
     * Builds the component graph of the scopes under a root.
     *
     * @param root {@link String} or {@link ScopeName}
     * @return component graph
     */
    public ComponentGraph configure(Object root) {
        return builder.build(collector.collect(scanner.scan(root)));
    }
}
