package com.reactive.notebook.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

import com.reactive.notebook.analysis.CellSymbols;

import lombok.extern.log4j.Log4j2;

/**
 * Symbol-level dependency graph over cells.
 *
 * <p>
 * The only stored state is one row per cell: the symbols it defines and uses.
 * An edge "A before B" exists iff B uses a symbol A defines; edges are never
 * cached and are recomputed from the rows on every query, so an upsert or
 * removal can never leave a stale edge behind. Cells that define the same
 * symbol are kept as they are and reported by {@link #validate()}.
 *
 * <p>
 * Every traversal visits cells in display order (as given by the position
 * function), which makes duplicate reports, cycle reports and plans
 * deterministic. Not thread-safe; the engine guards it with its graph monitor.
 */
@Log4j2
public final class DependencyGraph {
    private final Map<String, CellSymbols> rows = new LinkedHashMap<>();
    private final ToIntFunction<String> position;

    /** Outcome of {@link #validate()}. */
    public record ValidationResult(Map<String, List<String>> duplicates, List<String> cycle) {

        public boolean isValid() {
            return duplicates.isEmpty() && cycle.isEmpty();
        }
    }

    /** A symbol's definers and readers, for diagnostics. */
    public record SymbolEntry(List<String> definers, List<String> readers) {
    }

    /** A graph ordered by insertion. */
    public DependencyGraph() {
        this(null);
    }

    /**
     * @param position display position of a cell id; lower runs first among
     *                 otherwise unordered cells
     */
    public DependencyGraph(ToIntFunction<String> position) {
        this.position = position;
    }

    /**
     * Inserts or replaces a cell's row.
     *
     * @return the symbols the cell defined before but no longer does
     */
    public Set<String> upsert(String cellId, CellSymbols symbols) {
        CellSymbols previous = rows.put(cellId, symbols);
        if (previous == null)
            return Set.of();
        Set<String> retired = new LinkedHashSet<>(previous.defines());
        retired.removeAll(symbols.defines());
        if (!retired.isEmpty())
            log.debug("Cell {} retired symbols {}", cellId, retired);
        return retired;
    }

    /**
     * Removes a cell's row.
     *
     * @return the symbols it used to define, empty if unknown
     */
    public Set<String> remove(String cellId) {
        CellSymbols previous = rows.remove(cellId);
        return previous == null ? Set.of() : previous.defines();
    }

    public boolean contains(String cellId) {
        return rows.containsKey(cellId);
    }

    public CellSymbols symbolsOf(String cellId) {
        CellSymbols s = rows.get(cellId);
        if (s == null)
            throw new IllegalArgumentException("Unknown cell: " + cellId);
        return s;
    }

    public int size() {
        return rows.size();
    }

    /** All cell ids in display order. */
    public List<String> cellIds() {
        List<String> ids = new ArrayList<>(rows.keySet());
        if (position != null)
            ids.sort(displayOrder());
        return ids;
    }

    Comparator<String> displayOrder() {
        if (position == null) {
            List<String> insertion = new ArrayList<>(rows.keySet());
            return Comparator.comparingInt(insertion::indexOf);
        }
        return Comparator.comparingInt(position);
    }

    /** Cells defining a symbol, in display order. */
    public List<String> definersOf(String symbol) {
        List<String> out = new ArrayList<>();
        for (String id : cellIds()) {
            if (rows.get(id).defines().contains(symbol))
                out.add(id);
        }
        return out;
    }

    /** Cells reading any of the given symbols, in display order. */
    public List<String> readersOf(Collection<String> symbols) {
        List<String> out = new ArrayList<>();
        if (symbols.isEmpty())
            return out;
        for (String id : cellIds()) {
            for (String u : rows.get(id).uses()) {
                if (symbols.contains(u)) {
                    out.add(id);
                    break;
                }
            }
        }
        return out;
    }

    /** Direct downstream cells: readers of what this cell defines, excluding itself. */
    public List<String> dependentsOf(String cellId) {
        List<String> out = new ArrayList<>(readersOf(symbolsOf(cellId).defines()));
        out.remove(cellId);
        return out;
    }

    /** Direct upstream cells: definers of what this cell uses, excluding itself. */
    public List<String> dependenciesOf(String cellId) {
        Set<String> uses = symbolsOf(cellId).uses();
        List<String> out = new ArrayList<>();
        for (String id : cellIds()) {
            if (id.equals(cellId))
                continue;
            for (String d : rows.get(id).defines()) {
                if (uses.contains(d)) {
                    out.add(id);
                    break;
                }
            }
        }
        return out;
    }

    /**
     * Every cell reachable forward from the given cell. Includes the cell itself
     * only if it lies on a cycle.
     */
    public Set<String> downstreamOf(String cellId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(dependentsOf(cellId));
        while (!work.isEmpty()) {
            String next = work.poll();
            if (seen.add(next))
                work.addAll(dependentsOf(next));
        }
        return seen;
    }

    /**
     * Checks for duplicate definitions (all of them) and for a cycle (the first
     * one found by a depth-first search in display order).
     */
    public ValidationResult validate() {
        Map<String, List<String>> duplicates = new LinkedHashMap<>();
        Map<String, List<String>> definers = new TreeMap<>();
        List<String> ids = cellIds();
        for (String id : ids) {
            for (String symbol : rows.get(id).defines())
                definers.computeIfAbsent(symbol, k -> new ArrayList<>()).add(id);
        }
        // Report duplicates in order of their first definer, then by name.
        definers.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .sorted(Comparator.comparingInt((Map.Entry<String, List<String>> e) -> ids.indexOf(e.getValue().get(0))))
                .forEach(e -> duplicates.put(e.getKey(), List.copyOf(e.getValue())));
        return new ValidationResult(duplicates, findCycle(ids));
    }

    private List<String> findCycle(List<String> ids) {
        Set<String> done = new HashSet<>();
        for (String id : ids) {
            if (done.contains(id))
                continue;
            List<String> stack = new ArrayList<>();
            List<String> cycle = dfs(id, stack, new HashSet<>(), done);
            if (cycle != null)
                return cycle;
        }
        return List.of();
    }

    private List<String> dfs(String id, List<String> stack, Set<String> onStack, Set<String> done) {
        stack.add(id);
        onStack.add(id);
        for (String next : dependentsOf(id)) {
            if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                return cycle;
            }
            if (!done.contains(next)) {
                List<String> cycle = dfs(next, stack, onStack, done);
                if (cycle != null)
                    return cycle;
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(id);
        done.add(id);
        return null;
    }

    /** Symbol to definers and readers, sorted by symbol. */
    public Map<String, SymbolEntry> symbolTable() {
        Map<String, List<String>> definers = new TreeMap<>();
        Map<String, List<String>> readers = new TreeMap<>();
        for (String id : cellIds()) {
            CellSymbols s = rows.get(id);
            for (String d : s.defines())
                definers.computeIfAbsent(d, k -> new ArrayList<>()).add(id);
            for (String u : s.uses())
                readers.computeIfAbsent(u, k -> new ArrayList<>()).add(id);
        }
        Map<String, SymbolEntry> table = new TreeMap<>();
        Set<String> symbols = new HashSet<>(definers.keySet());
        symbols.addAll(readers.keySet());
        for (String symbol : symbols)
            table.put(symbol, new SymbolEntry(definers.getOrDefault(symbol, List.of()),
                    readers.getOrDefault(symbol, List.of())));
        return table;
    }
}
