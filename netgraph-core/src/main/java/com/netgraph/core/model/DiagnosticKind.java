package com.netgraph.core.model;

/**
 * Recoverable conditions recorded while parsing, loading or validating.
 */
public enum DiagnosticKind {
    /** A pin expression could not be mapped to any net; the pin stays unconnected */
    UNRESOLVED_REFERENCE,

    /** An instance uses a pin name its module template does not declare */
    TEMPLATE_MISMATCH
}
