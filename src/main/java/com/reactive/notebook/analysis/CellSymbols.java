package com.reactive.notebook.analysis;

import java.util.Set;

/**
 * What one cell publishes to and reads from the shared namespace.
 */
public record CellSymbols(Set<String> defines, Set<String> uses) {

    public static final CellSymbols EMPTY = new CellSymbols(Set.of(), Set.of());

    public CellSymbols {
        defines = Set.copyOf(defines);
        uses = Set.copyOf(uses);
    }
}
