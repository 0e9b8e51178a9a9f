package com.reactive.notebook.util;

import java.util.List;

import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.StructuralException;

import lombok.extern.log4j.Log4j2;

/**
 * Writes engine events to the log. Per-cell traffic goes to DEBUG, faults to
 * INFO and WARN.
 */
@Log4j2
public class LoggingNotebookListener implements NotebookListener {
    private long started;

    @Override
    public void onPlanQueued(List<String> cellIds) {
        log.debug("Plan queued: {}", cellIds);
    }

    @Override
    public void onExecutionStarted(String cellId) {
        started = System.nanoTime();
        log.debug("Cell {} started", cellId);
    }

    @Override
    public void onExecutionResult(String cellId, ExecutionResult result) {
        long micros = (System.nanoTime() - started) / 1_000;
        if (result.isSuccess())
            log.debug("Cell {} succeeded in {} us", cellId, micros);
        else
            log.info("Cell {} finished with {} in {} us: {}", cellId, result.status(), micros, result.error());
    }

    @Override
    public void onStructuralError(StructuralException error) {
        log.warn("Execution blocked ({}): {}", error.kind(), error.getMessage());
    }

    @Override
    public void onAnalysisError(String cellId, String message) {
        log.info("Cell {} does not parse: {}", cellId, message);
    }

    @Override
    public void onCellAdded(String cellId, int position) {
        log.debug("Cell {} added at {}", cellId, position);
    }

    @Override
    public void onCellDeleted(String cellId) {
        log.debug("Cell {} deleted", cellId);
    }

    @Override
    public void onExecutionInterrupted(String cellId, String message) {
        log.info("Execution interrupted at cell {}: {}", cellId, message);
    }
}
