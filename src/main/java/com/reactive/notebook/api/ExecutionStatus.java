package com.reactive.notebook.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one kernel run.
 */
public enum ExecutionStatus {
    SUCCESS, ERROR, TIMEOUT, INTERRUPTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
