package com.reactive.notebook.api;

/**
 * A fault in the shape of the dependency graph, detected before anything
 * runs. While one is present no cell executes.
 */
public abstract class StructuralException extends RuntimeException {

    protected StructuralException(String message) {
        super(message);
    }

    public abstract StructuralErrorKind kind();
}
