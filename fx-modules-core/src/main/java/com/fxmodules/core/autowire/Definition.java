package com.fxmodules.core.autowire;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named value exported by a {@link ComponentScope}, with its wiring metadata.
 *
 * <p>The value is a {@link ComponentFactory} (called with its injected dependencies), a
 * {@link HaltHook} (for definitions tagged {@link Metadata#haltsFor()}), or any other
 * object, which becomes the component instance as-is.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Definition.autowired("status")
 *     .inject("db-connection")
 *     .factory(deps -> new StatusHandler(deps.get("db-connection", DbConnection.class)));
 *
 * Definition.plain("retry-count", 3);   // exported, but never wired
 * }</pre>
 *
 * @param name definition name, unique within its scope
 * @param value exported value
 * @param metadata wiring metadata
 */
public record Definition(String name, Object value, Metadata metadata) {

    public Definition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Wiring metadata of a definition.
     *
     * @param autowired AUTOWIRED marker; untagged definitions are ignored by the collector
     * @param injections parameters tagged as auto-injectable references
     * @param parents parent slots this definition's value is merged into
     * @param haltsFor name or key of the component this definition halts, or null
     */
    public record Metadata(boolean autowired, List<Injection> injections, List<String> parents, String haltsFor) {

        public static final Metadata NONE = new Metadata(false, List.of(), List.of(), null);

        public Metadata {
            injections = injections == null ? List.of() : List.copyOf(injections);
            parents = parents == null ? List.of() : List.copyOf(parents);
        }

        public boolean isHaltHook() {
            return haltsFor != null;
        }

        public boolean isChild() {
            return !parents.isEmpty();
        }
    }

    /**
     * Creates an untagged definition.
     *
     * @param name definition name
     * @param value exported value
     * @return definition without the AUTOWIRED marker
     */
    public static Definition plain(String name, Object value) {
        return new Definition(name, value, Metadata.NONE);
    }

    /**
     * Starts an AUTOWIRED definition.
     *
     * @param name definition name
     * @return builder
     */
    public static Builder autowired(String name) {
        return new Builder(name);
    }

    public boolean isAutowired() {
        return metadata.autowired();
    }

    /**
     * Builder for AUTOWIRED definitions; terminal methods return the definition.
     */
    public static final class Builder {

        private final String name;
        private final List<Injection> injections = new ArrayList<>();
        private final List<String> parents = new ArrayList<>();
        private String haltsFor;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /**
         * Injects the component named like the parameter.
         *
         * @param parameter parameter and component name
         * @return this builder
         */
        public Builder inject(String parameter) {
            return inject(parameter, parameter);
        }

        /**
         * Injects {@code target} under {@code parameter}.
         *
         * @param parameter parameter name
         * @param target component name in this scope, or {@code scope/name}
         * @return this builder
         */
        public Builder inject(String parameter, String target) {
            injections.add(new Injection(parameter, target));
            return this;
        }

        /**
         * Merges this definition's value into a parent slot instead of registering it on its own.
         *
         * @param parent parent slot name or key
         * @return this builder
         */
        public Builder parent(String parent) {
            parents.add(Objects.requireNonNull(parent, "parent must not be null"));
            return this;
        }

        public Definition factory(ComponentFactory factory) {
            return value(factory);
        }

        /**
         * Tags the definition as the halt behavior of another component.
         *
         * @param target component name or key to halt
         * @param hook halt behavior
         * @return definition
         */
        public Definition haltsFor(String target, HaltHook hook) {
            this.haltsFor = Objects.requireNonNull(target, "target must not be null");
            return value(hook);
        }

        public Definition value(Object value) {
            return new Definition(name, value, new Metadata(true, injections, parents, haltsFor));
        }
    }
}
