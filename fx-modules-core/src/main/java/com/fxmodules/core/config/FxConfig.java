package com.fxmodules.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fxmodules.core.autowire.ScanContext;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of an FX system.
 *
 * <p>Loaded from {@code fx.yaml}. Names the project scope, tunes autowiring and may
 * declare entities in the entity DSL.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "shop"
 *   scope: "com.acme.shop"
 *
 * autowire:
 *   strict: true
 *   exclude:
 *     - com.acme.shop.legacy
 *
 * entities:
 *   shop.client/client:
 *     - spec
 *     - table: client
 *     - [id, {"primary-key?": true}, "uuid?"]
 *     - [name, [string, {max: 250}]]
 * }</pre>
 *
 * @param project project metadata
 * @param autowire autowiring settings
 * @param entities raw entity specs by qualified entity type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FxConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("autowire") AutowireConfig autowire,
    @JsonProperty("entities") Map<String, List<Object>> entities
) {
    /**
     * Compact constructor filling in absent sections.
     */
    public FxConfig {
        if (project == null) {
            project = new ProjectInfo("project", null);
        }
        if (autowire == null) {
            autowire = AutowireConfig.defaults();
        }
        if (entities == null) {
            entities = Map.of();
        }
    }

    /**
     * Creates a configuration scanning every project scope in strict mode, without entities.
     *
     * @return default configuration
     */
    public static FxConfig defaults() {
        return new FxConfig(new ProjectInfo("project", null), AutowireConfig.defaults(), Map.of());
    }

    /**
     * Scan settings derived from this configuration. The autowire root wins over the project scope.
     *
     * @return scan context
     */
    public ScanContext scanContext() {
        String root = autowire.root() != null ? autowire.root() : project.scope();
        return new ScanContext(root, autowire.isStrict(), autowire.exclude(), null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param scope project scope, scanned when no autowire root is given
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("scope") String scope
    ) {}

    /**
     * Autowiring settings.
     *
     * @param root scope to scan; falls back to the project scope
     * @param strict reject unsupported scan roots instead of ignoring them (default true)
     * @param exclude scope prefixes never scanned
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AutowireConfig(
        @JsonProperty("root") String root,
        @JsonProperty("strict") Boolean strict,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public AutowireConfig {
            if (exclude == null) {
                exclude = List.of();
            }
        }

        public static AutowireConfig defaults() {
            return new AutowireConfig(null, true, List.of());
        }

        public boolean isStrict() {
            return strict == null || strict;
        }
    }
}
