package com.netgraph.core.renderer.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private FileSystemRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesEachArtifactUnderItsFileName() throws IOException {
        List<GeneratedArtifact> artifacts = List.of(
            new GeneratedArtifact("output_netlist_file", "module m ();\nendmodule\n", "v"),
            new GeneratedArtifact("netlist_summary", "# Netlist Summary", "md"));

        renderer.render(artifacts, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("output_netlist_file.v"))).isEqualTo("module m ();\nendmodule\n");
        assertThat(Files.readString(tempDir.resolve("netlist_summary.md"))).isEqualTo("# Netlist Summary");
    }

    @Test
    void render_createsMissingOutputDirectory() {
        Path target = tempDir.resolve("a/b/c");

        renderer.render(List.of(new GeneratedArtifact("graph", "{}", "json")),
            new RenderContext(target.toString(), Map.of()));

        assertThat(target.resolve("graph.json")).exists();
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("graph.json"), "old");

        renderer.render(List.of(new GeneratedArtifact("graph", "new", "json")),
            new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("graph.json"))).isEqualTo("new");
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        assertThatThrownBy(() -> renderer.render(List.of(new GeneratedArtifact("graph", "{}", "json")),
            new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output directory");
    }
}
