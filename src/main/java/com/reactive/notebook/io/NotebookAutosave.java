package com.reactive.notebook.io;

import java.io.IOException;

import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.StructuralException;
import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

/**
 * Saves the notebook after every event that changes a cell: results, added
 * and deleted cells, and edits rejected by analysis or validation.
 */
@Log4j2
public class NotebookAutosave implements NotebookListener {
    private final NotebookStore store;
    private final String name;
    private final ReactiveEngine engine;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 5000);

    public NotebookAutosave(NotebookStore store, String name, ReactiveEngine engine) {
        this.store = store;
        this.name = name;
        this.engine = engine;
    }

    // Saves arrive from the transport and execution threads; the snapshot and
    // the file move must not interleave or an older state could land last.
    public synchronized void save() {
        try {
            store.save(name, engine);
        } catch (IOException e) {
            errors.log("Failed to save notebook " + name, e);
        }
    }

    @Override
    public void onExecutionResult(String cellId, ExecutionResult result) {
        save();
    }

    @Override
    public void onStructuralError(StructuralException error) {
        save();
    }

    @Override
    public void onAnalysisError(String cellId, String message) {
        save();
    }

    @Override
    public void onCellAdded(String cellId, int position) {
        save();
    }

    @Override
    public void onCellDeleted(String cellId) {
        save();
    }
}
