package com.netgraph.core.renderer.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.renderer.OutputRenderer;
import com.netgraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Renderer that writes artifacts to the filesystem.
 *
 * <p>Each artifact is written to {@code outputDirectory/name.extension}. Missing
 * directories are created and existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     List.of(new GeneratedArtifact("output_netlist_file", source, "v")),
 *     new RenderContext("./out", Map.of()));
 * // Creates: ./out/output_netlist_file.v
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(List<GeneratedArtifact> artifacts, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Rendering {} artifacts to filesystem at: {}", artifacts.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedArtifact artifact : artifacts) {
            writeFile(outputDir, artifact);
        }
    }

    private void writeFile(Path outputDir, GeneratedArtifact artifact) {
        Path targetPath = outputDir.resolve(artifact.fileName());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, artifact.content());
            logger.info("Wrote file: {} ({} bytes)", targetPath, artifact.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
