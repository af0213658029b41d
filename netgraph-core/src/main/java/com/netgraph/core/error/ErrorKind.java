package com.netgraph.core.error;

/**
 * Fatal conditions. Any of these aborts the current operation with no partial result.
 */
public enum ErrorKind {
    /** Input path missing or unreadable, or an output file could not be written */
    IO_ERROR,

    /** Number of {@code module} openings differs from the number of {@code endmodule} closings */
    STRUCTURAL_MISMATCH,

    /** An instance or pin line could not be tokenized */
    MALFORMED_INSTANCE_LINE,

    /** A port or wire declaration carries a bit range that does not fit an {@code int} */
    MALFORMED_DECLARATION,

    /** A JSON exchange document does not have the module-array shape */
    MALFORMED_DOCUMENT
}
