package com.netgraph.core.model;

import java.util.Objects;

/**
 * A net: a named connection between ports and instance pins.
 *
 * @param name net name, including any bit index (e.g. {@code a[2]}) or literal text
 * @param type provenance of the net
 * @param width optional bit range, null when unknown
 */
public record Net(
    String name,
    NetType type,
    BitRange width
) {
    /**
     * Compact constructor with validation.
     */
    public Net {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Returns whether this net came from an explicit {@code wire} declaration.
     *
     * @return true for {@link NetType#WIRE}
     */
    public boolean isDeclared() {
        return type == NetType.WIRE;
    }
}
