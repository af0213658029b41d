package com.netgraph.core.model;

import java.util.Objects;

/**
 * A recoverable finding. Diagnostics are collected, never thrown.
 *
 * @param kind what went wrong
 * @param module module the finding belongs to
 * @param message human-readable description naming the offending identifier
 * @param line 1-based source line, or 0 when not tied to a source line
 */
public record Diagnostic(
    DiagnosticKind kind,
    String module,
    String message,
    int line
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (line < 0) {
            line = 0;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (module != null) {
            sb.append(" [").append(module).append(']');
        }
        if (line > 0) {
            sb.append(" line ").append(line);
        }
        return sb.append(": ").append(message).toString();
    }
}
