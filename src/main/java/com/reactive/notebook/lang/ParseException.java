package com.reactive.notebook.lang;

/**
 * Raised when cell source cannot be tokenized or parsed.
 * Carries the 1-based line of the offending token.
 */
public class ParseException extends RuntimeException {
    private final int line;

    public ParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int line() {
        return line;
    }

    /** Renders the fault the way a cell result reports it. */
    public String render() {
        return "SyntaxError: " + getMessage() + " (line " + line + ")";
    }
}
