package com.reactive.notebook.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.reactive.notebook.engine.Cell;
import com.reactive.notebook.engine.DependencyGraph;
import com.reactive.notebook.engine.ReactiveEngine;

/**
 * Diagnostic views of a notebook's dependency graph.
 *
 * <p>
 * Intended for debugging and for the transport's diagnostics; every call
 * walks the whole graph.
 */
public final class NotebookExplain {
    private final ReactiveEngine engine;

    public NotebookExplain(ReactiveEngine engine) {
        this.engine = engine;
    }

    /**
     * Dumps one cell: status, symbols, upstream and downstream cells.
     *
     * @throws IllegalArgumentException for an unknown cell
     */
    public String explainCell(String cellId) {
        Cell cell = engine.cell(cellId);
        if (cell == null)
            throw new IllegalArgumentException("Unknown cell: " + cellId);
        List<String> upstream = engine.withGraph(g -> g.dependenciesOf(cellId));
        List<String> downstream = engine.withGraph(g -> g.dependentsOf(cellId));
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(cellId).append('\n')
                .append("  Status: ").append(cell.getStatus().wireName()).append('\n')
                .append("  Defines: ").append(new TreeSet<>(cell.getSymbols().defines())).append('\n')
                .append("  Uses: ").append(new TreeSet<>(cell.getSymbols().uses())).append('\n')
                .append("  Reads from: ").append(upstream).append('\n')
                .append("  Read by: ").append(downstream).append('\n');
        if (cell.getError() != null)
            sb.append("  Error: ").append(cell.getError()).append('\n');
        return sb.toString();
    }

    /**
     * Symbol table in text form, one symbol per line.
     */
    public String dumpSymbols() {
        Map<String, DependencyGraph.SymbolEntry> table = engine.withGraph(DependencyGraph::symbolTable);
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Symbols (").append(table.size()).append("):\n");
        for (Map.Entry<String, DependencyGraph.SymbolEntry> e : table.entrySet()) {
            sb.append("  ").append(e.getKey())
                    .append(" defined by ").append(e.getValue().definers())
                    .append(", read by ").append(e.getValue().readers());
            if (e.getValue().definers().size() > 1)
                sb.append(" (DUPLICATE)");
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart: one node per cell in display order, one
     * edge per dependency labelled with the symbols it carries.
     */
    public String toMermaid() {
        List<Cell> cells = engine.cellsInOrder();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        // 1. Nodes in display order
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            sb.append("  ").append(sanitize(cell.getId())).append("[\"cell ").append(i + 1);
            Set<String> defines = new TreeSet<>(cell.getSymbols().defines());
            if (!defines.isEmpty())
                sb.append(": ").append(String.join(", ", defines));
            sb.append("\"];\n");
        }

        // 2. Edges, labelled by shared symbols
        for (Cell from : cells) {
            for (Cell to : cells) {
                if (from == to)
                    continue;
                List<String> carried = new ArrayList<>();
                for (String s : new TreeSet<>(from.getSymbols().defines())) {
                    if (to.getSymbols().uses().contains(s))
                        carried.add(s);
                }
                if (!carried.isEmpty())
                    sb.append("  ").append(sanitize(from.getId())).append(" -- \"")
                            .append(String.join(", ", carried)).append("\" --> ")
                            .append(sanitize(to.getId())).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return "c_" + name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
