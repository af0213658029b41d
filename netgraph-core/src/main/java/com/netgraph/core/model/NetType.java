package com.netgraph.core.model;

/**
 * Provenance of a {@link Net}: how the net came to exist.
 */
public enum NetType {
    /** Declared by an explicit {@code wire} statement */
    WIRE("wire"),

    /** Single-bit alias synthesized for a bit-indexed reference into a declared wire */
    WIRE_SINGLE("wire-single"),

    /** Bit-indexed reference rebuilt from the JSON exchange format */
    WIRE_SUB("wire-sub"),

    /** Synthesized because a pin connects directly to a port name */
    PORT_DERIVED("port-derived"),

    /** Literal value such as {@code 4'b0101} */
    CONSTANT("constant");

    private final String tag;

    NetType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the provenance tag written to the JSON exchange format.
     *
     * @return provenance tag
     */
    public String tag() {
        return tag;
    }
}
