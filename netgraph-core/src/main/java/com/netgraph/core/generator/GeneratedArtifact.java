package com.netgraph.core.generator;

import java.util.Objects;

/**
 * Represents a generated artifact.
 *
 * @param name artifact base name, without extension
 * @param content artifact text
 * @param fileExtension file extension for this content
 */
public record GeneratedArtifact(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedArtifact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name this artifact is written under.
     *
     * @return {@code name.extension}
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
