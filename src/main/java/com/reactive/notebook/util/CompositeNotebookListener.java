package com.reactive.notebook.util;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.StructuralException;

import lombok.extern.log4j.Log4j2;

/**
 * Fans engine events out to several {@link NotebookListener}s. A listener
 * that throws is logged and skipped; the others still see the event.
 */
@Log4j2
public class CompositeNotebookListener implements NotebookListener {
    private volatile NotebookListener[] listeners = new NotebookListener[0];
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);

    public synchronized void addForComposite(NotebookListener listener) {
        NotebookListener[] old = listeners;
        NotebookListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized void removeFromComposite(NotebookListener listener) {
        listeners = Arrays.stream(listeners).filter(l -> l != listener).toArray(NotebookListener[]::new);
    }

    public int size() {
        return listeners.length;
    }

    private void each(String event, Consumer<NotebookListener> call) {
        for (NotebookListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                errors.log("Listener " + l.getClass().getSimpleName() + " failed on " + event, e);
            }
        }
    }

    @Override
    public void onPlanQueued(List<String> cellIds) {
        each("plan_queued", l -> l.onPlanQueued(cellIds));
    }

    @Override
    public void onExecutionStarted(String cellId) {
        each("execution_started", l -> l.onExecutionStarted(cellId));
    }

    @Override
    public void onExecutionResult(String cellId, ExecutionResult result) {
        each("execution_result", l -> l.onExecutionResult(cellId, result));
    }

    @Override
    public void onStructuralError(StructuralException error) {
        each("structural_error", l -> l.onStructuralError(error));
    }

    @Override
    public void onAnalysisError(String cellId, String message) {
        each("analysis_error", l -> l.onAnalysisError(cellId, message));
    }

    @Override
    public void onCellAdded(String cellId, int position) {
        each("cell_added", l -> l.onCellAdded(cellId, position));
    }

    @Override
    public void onCellDeleted(String cellId) {
        each("cell_deleted", l -> l.onCellDeleted(cellId));
    }

    @Override
    public void onExecutionInterrupted(String cellId, String message) {
        each("execution_interrupted", l -> l.onExecutionInterrupted(cellId, message));
    }
}
