package com.rstfmt.core.parser;

/**
 * Thrown when source text cannot be turned into a document tree.
 *
 * <p>Recoverable problems (unknown roles, unterminated inline markup, ...) do not throw;
 * they are recorded as {@code system_message} nodes instead.
 */
public class RstParseException extends RuntimeException {

    private final int line;

    /**
     * Creates a new parse exception.
     *
     * @param message description of the problem
     * @param line 1-based source line, or 0 if unknown
     */
    public RstParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /**
     * Returns the 1-based source line the problem was detected on.
     *
     * @return line number, or 0 if unknown
     */
    public int getLine() {
        return line;
    }
}
