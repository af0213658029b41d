package com.netgraph.core.model;

import java.util.Objects;

/**
 * A port as recorded by the template pass.
 *
 * @param name port name
 * @param width width text as written (e.g. {@code 3:0}), null when absent
 */
public record TemplatePort(String name, String width) {
    /**
     * Compact constructor with validation.
     */
    public TemplatePort {
        Objects.requireNonNull(name, "name must not be null");
    }
}
