package com.netgraph.core.model;

/**
 * Handle to a {@link Net} in the arena of its owning {@link Module}.
 *
 * <p>Ports and pins never hold a net directly; they hold a handle. Two pins share a
 * net exactly when their handles are equal.
 *
 * @param index position of the net in {@link Module#arena()}
 */
public record NetRef(int index) {
    /**
     * Compact constructor with validation.
     */
    public NetRef {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }
}
