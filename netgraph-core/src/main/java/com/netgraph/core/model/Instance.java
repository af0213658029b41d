package com.netgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An instantiation of a module or library cell inside a module.
 *
 * @param name instance name, unique within its module
 * @param refName referenced module or cell name as written
 * @param cellType hierarchical or leaf-level
 * @param pins pin connections in source order
 */
public record Instance(
    String name,
    String refName,
    CellType cellType,
    List<Pin> pins
) {
    /**
     * Compact constructor with validation.
     */
    public Instance {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(refName, "refName must not be null");
        Objects.requireNonNull(cellType, "cellType must not be null");
        pins = pins == null ? List.of() : List.copyOf(pins);
    }
}
