package com.reactive.notebook.web;

import java.util.List;
import java.util.function.Consumer;

import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.StructuralException;
import com.reactive.notebook.engine.Cell;
import com.reactive.notebook.engine.ReactiveEngine;

/**
 * Translates engine events into protocol messages and hands them to a
 * broadcaster, usually {@link NotebookServer#broadcast(String)}.
 */
public class WebsocketNotebookListener implements NotebookListener {
    private final ReactiveEngine engine;
    private final MessageCodec codec;
    private final Consumer<String> broadcast;

    public WebsocketNotebookListener(ReactiveEngine engine, MessageCodec codec, Consumer<String> broadcast) {
        this.engine = engine;
        this.codec = codec;
        this.broadcast = broadcast;
    }

    @Override
    public void onPlanQueued(List<String> cellIds) {
        broadcast.accept(codec.planQueued(cellIds));
    }

    @Override
    public void onExecutionStarted(String cellId) {
        broadcast.accept(codec.executionStarted(cellId));
    }

    @Override
    public void onExecutionResult(String cellId, ExecutionResult result) {
        broadcast.accept(codec.executionResult(cellId, result));
    }

    @Override
    public void onStructuralError(StructuralException error) {
        broadcast.accept(codec.structuralError(error));
    }

    // The failing cell also gets an execution_result; this carries the cell id for the banner.
    @Override
    public void onAnalysisError(String cellId, String message) {
        broadcast.accept(codec.error(cellId, message));
    }

    @Override
    public void onCellAdded(String cellId, int position) {
        Cell cell = engine.cell(cellId);
        if (cell != null)
            broadcast.accept(codec.cellAdded(cell, position));
    }

    @Override
    public void onCellDeleted(String cellId) {
        broadcast.accept(codec.cellDeleted(cellId));
    }

    @Override
    public void onExecutionInterrupted(String cellId, String message) {
        broadcast.accept(codec.executionInterrupted(cellId, message));
    }
}
