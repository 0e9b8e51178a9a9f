package com.reactive.notebook.api;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One or more symbols are defined by more than one cell.
 */
public class DuplicateSymbolException extends StructuralException {
    private final Map<String, List<String>> duplicates;

    /**
     * @param duplicates symbol to defining cell ids, both in display order
     * @param labels     display label per cell id ({@code cell 1}, ...)
     */
    public DuplicateSymbolException(Map<String, List<String>> duplicates, Map<String, String> labels) {
        super(format(duplicates, labels));
        this.duplicates = Map.copyOf(duplicates);
    }

    private static String format(Map<String, List<String>> duplicates, Map<String, String> labels) {
        StringBuilder sb = new StringBuilder("Each variable must be defined in exactly one cell.");
        duplicates.forEach((symbol, cells) -> sb.append("\nVariable '").append(symbol)
                .append("' is defined in multiple cells: ")
                .append(cells.stream().map(id -> labels.getOrDefault(id, id)).collect(Collectors.joining(", "))));
        return sb.toString();
    }

    public Map<String, List<String>> duplicates() {
        return duplicates;
    }

    @Override
    public StructuralErrorKind kind() {
        return StructuralErrorKind.DUPLICATE_SYMBOL;
    }
}
