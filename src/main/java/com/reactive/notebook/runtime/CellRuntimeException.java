package com.reactive.notebook.runtime;

/**
 * A fault raised by cell code at run time, carrying a script-level error type
 * such as {@code NameError} or {@code ZeroDivisionError}.
 *
 * <p>
 * The line is attached by the interpreter on the way out when the raising site
 * did not know it.
 */
public class CellRuntimeException extends RuntimeException {
    private final String type;
    private int line;

    public CellRuntimeException(String type, String message) {
        this(type, message, 0);
    }

    public CellRuntimeException(String type, String message, int line) {
        super(message);
        this.type = type;
        this.line = line;
    }

    public String type() {
        return type;
    }

    public int line() {
        return line;
    }

    CellRuntimeException atLine(int line) {
        if (this.line <= 0)
            this.line = line;
        return this;
    }

    /** {@code Type: message (line n)}, the form reported to clients. */
    public String render() {
        String base = type + ": " + getMessage();
        return line > 0 ? base + " (line " + line + ")" : base;
    }

    static CellRuntimeException typeError(String message) {
        return new CellRuntimeException("TypeError", message);
    }

    static CellRuntimeException valueError(String message) {
        return new CellRuntimeException("ValueError", message);
    }
}
