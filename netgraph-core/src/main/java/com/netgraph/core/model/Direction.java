package com.netgraph.core.model;

/**
 * Direction of a module port.
 *
 * <p>Only the two directions recognized by the netlist subset exist; {@code inout}
 * ports are not modeled.
 */
public enum Direction {
    /** Port driven from outside the module */
    INPUT("input"),

    /** Port driven by the module */
    OUTPUT("output");

    private final String keyword;

    Direction(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the source keyword for this direction ({@code input} / {@code output}).
     *
     * @return source keyword, also used as the key in the JSON exchange format
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a direction by its source keyword.
     *
     * @param keyword {@code input} or {@code output}
     * @return matching direction
     * @throws IllegalArgumentException if the keyword is not a known direction
     */
    public static Direction fromKeyword(String keyword) {
        for (Direction direction : values()) {
            if (direction.keyword.equals(keyword)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown port direction: " + keyword);
    }
}
