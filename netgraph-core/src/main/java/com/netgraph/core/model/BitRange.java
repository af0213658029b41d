package com.netgraph.core.model;

import java.util.List;

/**
 * Bit-width range {@code [msb:lsb]} of a port or net.
 *
 * @param msb most significant bit index
 * @param lsb least significant bit index
 */
public record BitRange(int msb, int lsb) {

    /**
     * Range recorded on every synthesized single-bit net ({@code wire-single},
     * {@code port-derived}).
     */
    public static final BitRange SINGLE = new BitRange(1, 0);

    /**
     * Builds a range from its two-element JSON form.
     *
     * @param bounds {@code [msb, lsb]}, may be null
     * @return range or null
     * @throws IllegalArgumentException if there are not exactly two non-null bounds
     */
    public static BitRange fromList(List<Integer> bounds) {
        if (bounds == null) {
            return null;
        }
        if (bounds.size() != 2) {
            throw new IllegalArgumentException("Width must have exactly two bounds: " + bounds);
        }
        if (bounds.contains(null)) {
            throw new IllegalArgumentException("Width bounds must not be null: " + bounds);
        }
        return new BitRange(bounds.get(0), bounds.get(1));
    }

    /**
     * Returns the two-element JSON form.
     *
     * @return {@code [msb, lsb]}
     */
    public List<Integer> toList() {
        return List.of(msb, lsb);
    }

    /**
     * Returns the source form, e.g. {@code [3:0]}.
     *
     * @return bracketed range
     */
    public String toVerilog() {
        return "[" + msb + ":" + lsb + "]";
    }
}
