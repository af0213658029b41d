package com.netgraph.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A formal connection point on an instance.
 *
 * @param name pin name as written in {@code .name(expr)}
 * @param direction pin direction, null when unknown
 * @param instanceName name of the owning instance
 * @param net handle of the connected net, null when the pin is unresolved
 */
public record Pin(
    String name,
    Direction direction,
    String instanceName,
    NetRef net
) {
    /**
     * Compact constructor with validation.
     */
    public Pin {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(instanceName, "instanceName must not be null");
    }

    /**
     * Returns the connected net handle, if any.
     *
     * @return net handle, empty when unresolved
     */
    public Optional<NetRef> connection() {
        return Optional.ofNullable(net);
    }

    /**
     * Returns the pin direction, if known.
     *
     * @return direction, empty when unknown
     */
    public Optional<Direction> knownDirection() {
        return Optional.ofNullable(direction);
    }
}
