package com.reactive.notebook.api;

import java.time.Duration;

/**
 * Result of running one cell.
 *
 * @param status     outcome
 * @param output     captured stdout plus the rendering of a trailing expression
 * @param richOutput structured output, or {@code null}
 * @param error      {@code Type: message} text, or {@code null} on success
 */
public record ExecutionResult(ExecutionStatus status, String output, RichOutput richOutput, String error) {

    public static ExecutionResult success(String output, RichOutput richOutput) {
        return new ExecutionResult(ExecutionStatus.SUCCESS, output, richOutput, null);
    }

    public static ExecutionResult error(String output, String error) {
        return new ExecutionResult(ExecutionStatus.ERROR, output, null, error);
    }

    public static ExecutionResult timeout(String output, Duration timeout) {
        long millis = timeout.toMillis();
        String seconds = millis % 1000 == 0 ? String.valueOf(millis / 1000) : String.valueOf(millis / 1000.0);
        return new ExecutionResult(ExecutionStatus.TIMEOUT, output, null,
                "TimeoutError: Cell execution timed out after " + seconds + " seconds");
    }

    public static ExecutionResult interrupted(String output) {
        return new ExecutionResult(ExecutionStatus.INTERRUPTED, output, null,
                "InterruptedError: Execution interrupted by user");
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
