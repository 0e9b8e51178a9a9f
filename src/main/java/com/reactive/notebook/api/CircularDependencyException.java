package com.reactive.notebook.api;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The cells read each other's symbols in a loop. The cycle is closed: its
 * first cell id is repeated at the end.
 */
public class CircularDependencyException extends StructuralException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle, Map<String, String> labels) {
        super("Circular dependency detected: "
                + cycle.stream().map(id -> labels.getOrDefault(id, id)).collect(Collectors.joining(" → ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }

    @Override
    public StructuralErrorKind kind() {
        return StructuralErrorKind.CIRCULAR_DEPENDENCY;
    }
}
