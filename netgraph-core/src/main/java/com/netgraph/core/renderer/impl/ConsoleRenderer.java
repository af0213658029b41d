package com.netgraph.core.renderer.impl;

import com.netgraph.core.generator.GeneratedArtifact;
import com.netgraph.core.renderer.OutputRenderer;
import com.netgraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Renderer that prints artifacts to a console stream with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showHeaders} - Print a header per artifact (default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<GeneratedArtifact> artifacts, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        logger.debug("Rendering {} artifacts to console (colors: {})", artifacts.size(), useColors);

        String header = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String meta = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        for (int i = 0; i < artifacts.size(); i++) {
            GeneratedArtifact artifact = artifacts.get(i);
            if (showHeaders) {
                out.println(header + "Artifact " + (i + 1) + "/" + artifacts.size() + ": " + artifact.fileName() + reset);
                out.println(meta + "Size: " + artifact.content().length() + " bytes" + reset);
                out.println();
            }
            out.println(artifact.content());
            out.println(meta + SEPARATOR + reset);
        }
    }
}
