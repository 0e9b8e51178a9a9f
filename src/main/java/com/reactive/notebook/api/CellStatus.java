package com.reactive.notebook.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a cell: {@code idle -> running -> success | error}.
 */
public enum CellStatus {
    IDLE, RUNNING, SUCCESS, ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static CellStatus of(ExecutionStatus status) {
        return status == ExecutionStatus.SUCCESS ? SUCCESS : ERROR;
    }
}
