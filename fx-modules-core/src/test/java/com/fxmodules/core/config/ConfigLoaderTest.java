package com.fxmodules.core.config;

import com.fxmodules.core.autowire.ScanContext;
import com.fxmodules.core.entity.EntitySpecParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("fx.yaml");
        Files.writeString(configFile, """
            project:
              name: "shop"
              scope: "com.acme.shop"

            autowire:
              strict: false
              exclude:
                - com.acme.shop.legacy

            entities:
              shop.client/client:
                - spec
                - table: client
                - [id, {"primary-key?": true}, "uuid?"]
                - [name, [string, {max: 250}]]
            """);

        FxConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("shop");
        assertThat(config.project().scope()).isEqualTo("com.acme.shop");
        assertThat(config.autowire().isStrict()).isFalse();
        assertThat(config.autowire().exclude()).containsExactly("com.acme.shop.legacy");
        assertThat(config.entities()).containsOnlyKeys("shop.client/client");
        assertThat(EntitySpecParser.isValid(config.entities().get("shop.client/client"))).isTrue();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("fx.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
            """);

        FxConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.project().scope()).isNull();
        assertThat(config.autowire().isStrict()).isTrue();
        assertThat(config.autowire().exclude()).isEmpty();
        assertThat(config.entities()).isEmpty();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        FxConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(FxConfig.defaults());
    }

    @Test
    void load_invalidYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("fx.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(configFile.toString())
            .satisfies(e -> assertThat(((ConfigurationException) e).getSource()).isEqualTo(configFile.toString()));
    }

    @Test
    void parse_entityNotASequence_throwsConfigurationException() {
        assertThatThrownBy(() -> ConfigLoader.parse("""
            project:
              name: "shop"
            entities:
              shop.user/user: not-a-list
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void parse_flowStyleFieldsWithQuotedFlags_keepsFlags() {
        FxConfig config = ConfigLoader.parse("""
            entities:
              shop.user/user:
                - spec
                - [id, {"primary-key?": true, "identity?": true}, "uuid?"]
                - [client, {"many-to-one?": true}, shop.client/client]
            """);

        List<Object> raw = config.entities().get("shop.user/user");

        assertThat(raw).hasSize(3);
        assertThat(raw.get(1)).isEqualTo(List.of("id", Map.of("primary-key?", true, "identity?", true), "uuid?"));
        assertThat(EntitySpecParser.isValid(raw)).isTrue();
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("fx.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(FxConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        assertThat(ConfigLoader.load(directory).project().name()).isEqualTo("project");
    }

    @Test
    void loadResource_classPathFile_returnsConfig() {
        FxConfig config = ConfigLoader.loadResource("fx-test.yaml");

        assertThat(config.project().name()).isEqualTo("core-test");
        assertThat(config.autowire().root()).isEqualTo("com.fxmodules.core.autowire.stub");
    }

    @Test
    void loadResource_missing_returnsDefaults() {
        assertThat(ConfigLoader.loadResource("missing.yaml")).isEqualTo(FxConfig.defaults());
    }

    @Test
    void scanContext_autowireRootWinsOverProjectScope() {
        FxConfig config = ConfigLoader.parse("""
            project:
              scope: com.acme
            autowire:
              root: com.acme.web
            """);

        ScanContext context = config.scanContext();

        assertThat(context.defaultRoot()).isEqualTo("com.acme.web");
        assertThat(context.strict()).isTrue();
    }

    @Test
    void scanContext_noAutowireRoot_usesProjectScope() {
        FxConfig config = ConfigLoader.parse("""
            project:
              scope: com.acme
            """);

        assertThat(config.scanContext().defaultRoot()).isEqualTo("com.acme");
    }
}
