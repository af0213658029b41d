package com.netgraph.core.renderer.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withHeaders_printsNameSizeAndContent() {
        GeneratedArtifact artifact = new GeneratedArtifact("netlist_summary", "# Netlist Summary", "md");

        renderer.render(List.of(artifact), new RenderContext(".", Map.of("console.colors", "false")));

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(output)
            .contains("Artifact 1/1: netlist_summary.md")
            .contains("Size: 17 bytes")
            .contains("# Netlist Summary")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withoutHeaders_printsContentOnly() {
        GeneratedArtifact artifact = new GeneratedArtifact("graph", "{}", "json");

        renderer.render(List.of(artifact), new RenderContext(".",
            Map.of("console.colors", "false", "console.showHeaders", "false")));

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(output).startsWith("{}").doesNotContain("Artifact 1/1");
    }

    @Test
    void render_colorsEnabledByDefault() {
        renderer.render(List.of(new GeneratedArtifact("graph", "{}", "json")), new RenderContext(".", Map.of()));

        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("\u001B[36m");
    }

    @Test
    void render_multipleArtifacts_numbersEach() {
        renderer.render(List.of(
                new GeneratedArtifact("a", "A", "v"),
                new GeneratedArtifact("b", "B", "md")),
            new RenderContext(".", Map.of("console.colors", "false")));

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("Artifact 1/2: a.v").contains("Artifact 2/2: b.md");
    }
}
