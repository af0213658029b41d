package com.netgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A module port.
 *
 * @param name port name
 * @param direction port direction
 * @param width optional bit range, null for scalar ports
 * @param derivedNets handles of nets linked to this port during net resolution
 */
public record Port(
    String name,
    Direction direction,
    BitRange width,
    List<NetRef> derivedNets
) {
    /**
     * Compact constructor with validation.
     */
    public Port {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        derivedNets = derivedNets == null ? List.of() : List.copyOf(derivedNets);
    }
}
