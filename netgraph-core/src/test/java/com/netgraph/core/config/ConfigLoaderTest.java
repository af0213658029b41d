package com.netgraph.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("netgraph.yaml");
        Files.writeString(configFile, """
            input:
              netlist: "designs/top.v"

            output:
              directory: "./build/netlist"
              verilogFile: "rebuilt.v"
              jsonFile: "objects.json"

            parser:
              validateInstances: false
              reuseJson: false

            generators:
              enabled:
                - verilog
                - summary
              headerComment: true
            """);

        NetgraphConfig config = ConfigLoader.load(configFile);

        assertThat(config.input().netlist()).isEqualTo("designs/top.v");
        assertThat(config.output().directory()).isEqualTo("./build/netlist");
        assertThat(config.output().jsonPath()).isEqualTo(Path.of("./build/netlist", "objects.json"));
        assertThat(config.output().verilogPath()).isEqualTo(Path.of("./build/netlist", "rebuilt.v"));
        assertThat(config.parser().validateInstances()).isFalse();
        assertThat(config.parser().reuseJson()).isFalse();
        assertThat(config.generators().enabled()).containsExactly("verilog", "summary");
        assertThat(config.generators().headerComment()).isTrue();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("netgraph.yaml");
        Files.writeString(configFile, """
            output:
              directory: "out"
            """);

        NetgraphConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().directory()).isEqualTo("out");
        assertThat(config.output().verilogFile()).isEqualTo("output_netlist_file.v");
        assertThat(config.output().jsonFile()).isEqualTo("parsed_objects.json");
        assertThat(config.input().netlist()).isEqualTo("netlist.v");
        assertThat(config.parser().validateInstances()).isTrue();
        assertThat(config.parser().reuseJson()).isTrue();
        assertThat(config.generators().enabled()).containsExactly("verilog");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("netgraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "legacy"
            parser:
              reuseJson: false
              strict: true
            """);

        NetgraphConfig config = ConfigLoader.load(configFile);

        assertThat(config.parser().reuseJson()).isFalse();
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        NetgraphConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(NetgraphConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("netgraph.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(NetgraphConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("netgraph.yaml");
        Files.writeString(configFile, """
            output:
              directory: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(NetgraphConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(NetgraphConfig.defaults());
    }

    @Test
    void withParser_keepsOtherSections() {
        NetgraphConfig config = NetgraphConfig.defaults().withOutputDirectory("out").withParser(false, true);

        assertThat(config.output().directory()).isEqualTo("out");
        assertThat(config.parser().validateInstances()).isFalse();
        assertThat(config.parser().reuseJson()).isTrue();
    }
}
