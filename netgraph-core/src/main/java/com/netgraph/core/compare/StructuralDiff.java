package com.netgraph.core.compare;

import java.util.List;

/**
 * Differences found between two module lists.
 *
 * @param differences one human-readable line per difference, in discovery order
 */
public record StructuralDiff(List<String> differences) {

    /**
     * Compact constructor with validation.
     */
    public StructuralDiff {
        differences = differences == null ? List.of() : List.copyOf(differences);
    }

    /**
     * Returns whether the two sides have the same ports, wires and pin topology.
     *
     * @return true when no difference was found
     */
    public boolean isEquivalent() {
        return differences.isEmpty();
    }
}
