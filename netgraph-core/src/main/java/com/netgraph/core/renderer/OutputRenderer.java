package com.netgraph.core.renderer;

import com.netgraph.core.generator.GeneratedArtifact;

import java.util.List;

/**
 * Interface for output renderers that deliver generated artifacts to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected
 * by {@link #getId()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.netgraph.core.renderer.OutputRenderer}
 *
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Delivers the artifacts.
     *
     * <p>Implementations validate required settings and throw
     * {@link IllegalStateException} if configuration is invalid or the destination
     * cannot be written.
     *
     * @param artifacts generated artifacts, in order
     * @param context rendering context with destination and settings
     * @throws IllegalStateException if the artifacts cannot be delivered
     */
    void render(List<GeneratedArtifact> artifacts, RenderContext context);
}
