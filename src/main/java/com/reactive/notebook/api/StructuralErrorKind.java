package com.reactive.notebook.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StructuralErrorKind {
    DUPLICATE_SYMBOL, CIRCULAR_DEPENDENCY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
