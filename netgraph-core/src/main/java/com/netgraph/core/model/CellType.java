package com.netgraph.core.model;

/**
 * Classification of an instance by what it references.
 */
public enum CellType {
    /** The referenced name is a module defined in the same source */
    HIERARCHICAL("hierarchical"),

    /** Primitive or library cell, opaque to the parser */
    LEAF_LEVEL("leaf-level");

    private final String tag;

    CellType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the tag written to the JSON exchange format.
     *
     * @return cell type tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a cell type by its tag.
     *
     * @param tag cell type tag
     * @return matching cell type
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static CellType fromTag(String tag) {
        for (CellType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cell type: " + tag);
    }
}
