package com.netgraph.core.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the structural netlist subset.
 *
 * <p>Both passes use the same module, port and endmodule patterns so that they agree
 * on structure. Patterns are line-oriented: a construct never spans lines, except an
 * instance's connection list, which continues until {@link #INSTANCE_CLOSE}.
 */
public final class NetlistPatterns {

    private static final String IDENT = "[A-Za-z_]\\w*";
    private static final String NOT_DIRECTION = "(?!(?:input|output|inout)\\b)";
    private static final String RANGE = "\\[\\s*\\d+\\s*:\\s*\\d+\\s*]";

    /** {@code module name (} or {@code module name;} at line start; group 1 = name */
    public static final Pattern MODULE_OPEN =
        Pattern.compile("^\\s*module\\s+(" + IDENT + ")\\s*[(;]");

    /** {@code endmodule} as a whole word */
    public static final Pattern END_MODULE =
        Pattern.compile("\\bendmodule\\b");

    /**
     * One port clause: group 1 = direction, groups 2/3 = msb/lsb, group 4 = names.
     * The clause ends at {@code ;}, {@code ,}, {@code )} or end of line so that both
     * body declarations and one-per-line header ports are recognized. A following
     * direction keyword starts a new clause.
     */
    public static final Pattern PORT_DECL =
        Pattern.compile("\\b(input|output)\\b\\s*(?:\\[\\s*(\\d+)\\s*:\\s*(\\d+)\\s*])?\\s*("
            + IDENT + "(?:\\s*,\\s*" + NOT_DIRECTION + IDENT + ")*)\\s*(?=[;,)]|$)");

    /**
     * One wire clause: groups 1/2 = default msb/lsb, group 3 = comma-separated items,
     * each optionally prefixed by its own range.
     */
    public static final Pattern NET_DECL =
        Pattern.compile("\\bwire\\b\\s*(?:\\[\\s*(\\d+)\\s*:\\s*(\\d+)\\s*])?\\s*((?:" + RANGE + "\\s*)?"
            + IDENT + "(?:\\s*,\\s*(?:" + RANGE + "\\s*)?" + IDENT + ")*)\\s*;");

    /** One item of a wire clause: groups 1/2 = inline msb/lsb, group 3 = name */
    public static final Pattern NET_ITEM =
        Pattern.compile("^(?:\\[\\s*(\\d+)\\s*:\\s*(\\d+)\\s*]\\s*)?(" + IDENT + ")$");

    /** {@code ref name (} at line start; group 1 = ref name, group 2 = instance name */
    public static final Pattern INSTANCE_OPEN =
        Pattern.compile("^\\s*(" + IDENT + ")\\s+(" + IDENT + ")\\s*\\(");

    /** Complete pin connection token; group 1 = pin name, group 2 = expression */
    public static final Pattern PIN =
        Pattern.compile("\\.(" + IDENT + ")\\s*\\(([^)]*)\\)");

    /** Start of a pin connection token, complete or not */
    public static final Pattern PIN_START =
        Pattern.compile("\\.(" + IDENT + ")\\s*\\(");

    /** Statement terminator closing an instance's connection list */
    public static final Pattern INSTANCE_CLOSE =
        Pattern.compile("\\)\\s*;");

    /** Whole-expression bit select {@code base[n]}; group 1 = base, group 2 = index */
    public static final Pattern BIT_SELECT =
        Pattern.compile("^(" + IDENT + ")\\s*\\[\\s*(\\d+)\\s*]$");

    /** Bit select at the start of an expression; group 1 = base */
    public static final Pattern BIT_SELECT_PREFIX =
        Pattern.compile("^(" + IDENT + ")\\s*\\[\\s*\\d+\\s*]");

    /** First identifiers that never open an instance */
    public static final Set<String> NON_INSTANCE_KEYWORDS = Set.of("input", "output", "inout", "module");

    private NetlistPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits a comma-separated identifier list, trimming each entry.
     *
     * @param names e.g. {@code "a, b ,c"}
     * @return non-empty trimmed entries in order
     */
    public static List<String> splitNames(String names) {
        return Arrays.stream(names.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }

    /**
     * Returns whether an expression is a literal constant (contains a base-specifier quote).
     *
     * @param expression connection expression
     * @return true for literals such as {@code 4'b0101}
     */
    public static boolean isConstant(String expression) {
        return expression.indexOf('\'') >= 0;
    }
}
