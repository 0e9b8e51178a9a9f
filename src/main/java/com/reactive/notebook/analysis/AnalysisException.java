package com.reactive.notebook.analysis;

/**
 * A cell's source could not be analysed (it does not parse). The cell
 * contributes no symbols until it is fixed.
 */
public class AnalysisException extends RuntimeException {
    private final String cellId;
    private final int line;

    public AnalysisException(String cellId, String message, int line, Throwable cause) {
        super(message, cause);
        this.cellId = cellId;
        this.line = line;
    }

    public String cellId() {
        return cellId;
    }

    public int line() {
        return line;
    }

    /** {@code SyntaxError: message (line n)}. */
    public String render() {
        return "SyntaxError: " + getMessage() + " (line " + line + ")";
    }
}
