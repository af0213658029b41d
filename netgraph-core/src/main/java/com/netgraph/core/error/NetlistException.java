package com.netgraph.core.error;

import java.util.Objects;

/**
 * Fatal failure of a parse, load or write operation.
 *
 * <p>Carries the {@link ErrorKind} and, where one applies, the 1-based source line.
 */
public class NetlistException extends Exception {

    private final ErrorKind kind;
    private final int line;

    public NetlistException(ErrorKind kind, String message) {
        this(kind, message, 0, null);
    }

    public NetlistException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, cause);
    }

    public NetlistException(ErrorKind kind, String message, int line) {
        this(kind, message, line, null);
    }

    public NetlistException(ErrorKind kind, String message, int line, Throwable cause) {
        super(format(kind, message, line), cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = Math.max(line, 0);
    }

    /**
     * Creates the module/endmodule count mismatch error.
     *
     * @param modules number of module openings
     * @param endmodules number of endmodule closings
     * @return the exception
     */
    public static NetlistException structuralMismatch(int modules, int endmodules) {
        return new NetlistException(ErrorKind.STRUCTURAL_MISMATCH,
            "Mismatch in the number of 'module' (" + modules + ") and 'endmodule' ("
                + endmodules + ") declarations");
    }

    /**
     * Creates a malformed instance line error.
     *
     * @param line 1-based line number
     * @param text offending line text
     * @param detail what could not be tokenized
     * @return the exception
     */
    public static NetlistException malformedInstanceLine(int line, String text, String detail) {
        return new NetlistException(ErrorKind.MALFORMED_INSTANCE_LINE,
            detail + " in line '" + text.trim() + "'", line);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the 1-based source line, or 0 when the error is not tied to a line.
     *
     * @return line number
     */
    public int getLine() {
        return line;
    }

    private static String format(ErrorKind kind, String message, int line) {
        return line > 0 ? kind + " at line " + line + ": " + message : kind + ": " + message;
    }
}
