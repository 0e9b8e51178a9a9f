package com.reactive.notebook.api;

import java.util.List;

/**
 * Observer of engine lifecycle events.
 *
 * <p>
 * Callbacks run on the thread that drives the engine (the execution thread for
 * plan events, the caller's thread for structural ones). Implementations must
 * not block; failures are logged by the engine and never abort a plan.
 */
public interface NotebookListener {

    /** An ordered execution plan is about to run. */
    default void onPlanQueued(List<String> cellIds) {
    }

    default void onExecutionStarted(String cellId) {
    }

    default void onExecutionResult(String cellId, ExecutionResult result) {
    }

    /**
     * A duplicate definition or cycle blocked execution. Reported once per
     * validation.
     */
    default void onStructuralError(StructuralException error) {
    }

    /**
     * A cell failed static analysis and was not run.
     */
    default void onAnalysisError(String cellId, String message) {
    }

    default void onCellAdded(String cellId, int position) {
    }

    default void onCellDeleted(String cellId) {
    }

    /**
     * The current plan was abandoned by {@code interrupt()}.
     *
     * @param cellId the cell that was running, or {@code null}
     */
    default void onExecutionInterrupted(String cellId, String message) {
    }
}
