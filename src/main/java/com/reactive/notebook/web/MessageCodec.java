package com.reactive.notebook.web;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactive.notebook.api.CircularDependencyException;
import com.reactive.notebook.api.DuplicateSymbolException;
import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.StructuralException;
import com.reactive.notebook.engine.Cell;
import com.reactive.notebook.io.NotebookDocument;

/**
 * JSON wire format of the notebook protocol. Every message is an object with
 * a {@code type} field; keys are snake_case.
 */
public final class MessageCodec {
    private final ObjectMapper mapper;

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws JsonProcessingException if the text is not a JSON object of the
     *                                 expected shape
     */
    public InboundMessage decode(String text) throws JsonProcessingException {
        InboundMessage message = mapper.readValue(text, InboundMessage.class);
        if (message == null)
            throw new IllegalArgumentException("Empty message");
        return message;
    }

    public String notebookState(String name, List<Cell> cells) {
        Map<String, Object> m = message("notebook_state");
        m.put("notebook_name", name);
        m.put("cells", cells.stream().map(NotebookDocument.CellDef::of).toList());
        return write(m);
    }

    public String planQueued(List<String> cellIds) {
        Map<String, Object> m = message("plan_queued");
        m.put("cell_ids", cellIds);
        return write(m);
    }

    public String executionStarted(String cellId) {
        Map<String, Object> m = message("execution_started");
        m.put("cell_id", cellId);
        return write(m);
    }

    public String executionResult(String cellId, ExecutionResult result) {
        Map<String, Object> m = message("execution_result");
        m.put("cell_id", cellId);
        m.put("status", result.status());
        m.put("output", result.output());
        if (result.richOutput() != null)
            m.put("rich_output", result.richOutput());
        m.put("error", result.error() == null ? "" : result.error());
        return write(m);
    }

    public String structuralError(StructuralException error) {
        Map<String, Object> m = message("structural_error");
        m.put("kind", error.kind());
        m.put("message", error.getMessage());
        if (error instanceof DuplicateSymbolException dup)
            m.put("duplicates", dup.duplicates());
        else if (error instanceof CircularDependencyException cycle)
            m.put("cycle", cycle.cycle());
        return write(m);
    }

    public String error(String cellId, String message) {
        Map<String, Object> m = message("error");
        if (cellId != null)
            m.put("cell_id", cellId);
        m.put("message", message);
        return write(m);
    }

    public String cellAdded(Cell cell, int position) {
        Map<String, Object> m = message("cell_added");
        m.put("cell", NotebookDocument.CellDef.of(cell));
        m.put("position", position);
        return write(m);
    }

    public String cellDeleted(String cellId) {
        Map<String, Object> m = message("cell_deleted");
        m.put("cell_id", cellId);
        return write(m);
    }

    public String executionInterrupted(String cellId, String message) {
        Map<String, Object> m = message("execution_interrupted");
        m.put("cell_id", cellId);
        m.put("message", message);
        return write(m);
    }

    private static Map<String, Object> message(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }

    private String write(Map<String, Object> message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.get("type") + " message", e);
        }
    }
}
