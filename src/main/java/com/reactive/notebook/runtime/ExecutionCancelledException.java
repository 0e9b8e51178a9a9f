package com.reactive.notebook.runtime;

/**
 * Unwinds a running cell after its {@link CancellationToken} fired.
 */
public class ExecutionCancelledException extends RuntimeException {

    public enum Reason {
        TIMEOUT, INTERRUPT
    }

    private final Reason reason;

    public ExecutionCancelledException(Reason reason) {
        super("Execution cancelled: " + reason, null, false, false);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
