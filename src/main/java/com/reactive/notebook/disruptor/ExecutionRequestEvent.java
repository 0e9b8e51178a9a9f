package com.reactive.notebook.disruptor;

/**
 * Ring buffer slot asking the execution thread to drain the engine's queued
 * work. The graph has already been updated by the producer; the event only
 * carries what triggered it, for tracing.
 *
 * <p>
 * Instances are pre-allocated by the ring buffer and reused.
 */
public final class ExecutionRequestEvent {

    /** What the producer did before publishing. */
    public enum Kind {
        EDIT, EXECUTE, EXECUTE_ALL
    }

    private Kind kind;
    private String cellId;
    private long requestId;

    /**
     * @param kind      trigger
     * @param cellId    cell concerned, {@code null} for {@link Kind#EXECUTE_ALL}
     * @param requestId producer-side correlation id
     */
    public void set(Kind kind, String cellId, long requestId) {
        this.kind = kind;
        this.cellId = cellId;
        this.requestId = requestId;
    }

    public Kind kind() {
        return kind;
    }

    public String cellId() {
        return cellId;
    }

    public long requestId() {
        return requestId;
    }

    public void clear() {
        kind = null;
        cellId = null;
        requestId = 0;
    }
}
