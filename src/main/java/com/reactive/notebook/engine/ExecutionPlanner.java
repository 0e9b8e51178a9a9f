package com.reactive.notebook.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import com.reactive.notebook.api.CircularDependencyException;
import com.reactive.notebook.api.DuplicateSymbolException;

/**
 * Turns a change into an ordered execution plan.
 *
 * <p>
 * The graph is validated first; any duplicate definition or cycle fails the
 * whole plan and nothing runs. Otherwise the affected set (the changed cells
 * plus everything downstream of them) is sorted with Kahn's algorithm over the
 * induced subgraph, breaking ties by display position.
 */
public final class ExecutionPlanner {
    private final DependencyGraph graph;

    public ExecutionPlanner(DependencyGraph graph) {
        this.graph = graph;
    }

    public List<String> plan(String changedCellId) {
        return plan(List.of(changedCellId), Set.of());
    }

    /**
     * Plans a set of changed cells. Readers of {@code retiredSymbols} (symbols a
     * changed cell stopped defining) are re-run as well, so they report the
     * missing name instead of keeping a stale result. Such readers are deferred
     * behind the changed cells whenever the edges allow it.
     *
     * @throws DuplicateSymbolException    if a symbol has several definers
     * @throws CircularDependencyException if the graph has a cycle
     */
    public List<String> plan(Collection<String> changed, Collection<String> retiredSymbols) {
        validate();
        Set<String> roots = new LinkedHashSet<>();
        for (String id : changed) {
            if (graph.contains(id))
                roots.add(id);
        }
        Set<String> affected = new LinkedHashSet<>(roots);
        for (String id : roots)
            affected.addAll(graph.downstreamOf(id));
        Set<String> deferred = new LinkedHashSet<>();
        for (String reader : graph.readersOf(retiredSymbols)) {
            if (affected.contains(reader))
                continue;
            deferred.add(reader);
            for (String id : graph.downstreamOf(reader)) {
                if (!affected.contains(id))
                    deferred.add(id);
            }
        }
        affected.addAll(deferred);
        return order(affected, deferred);
    }

    /** Every cell in dependency order. */
    public List<String> planAll() {
        validate();
        return order(new LinkedHashSet<>(graph.cellIds()), Set.of());
    }

    /**
     * @throws DuplicateSymbolException    if a symbol has several definers
     * @throws CircularDependencyException if the graph has a cycle
     */
    public void validate() {
        DependencyGraph.ValidationResult result = graph.validate();
        if (result.isValid())
            return;
        Map<String, String> labels = labels();
        if (!result.duplicates().isEmpty())
            throw new DuplicateSymbolException(result.duplicates(), labels);
        throw new CircularDependencyException(result.cycle(), labels);
    }

    /** {@code cell 1}, {@code cell 2}, ... by display position. */
    public Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        List<String> ids = graph.cellIds();
        for (int i = 0; i < ids.size(); i++)
            labels.put(ids.get(i), "cell " + (i + 1));
        return labels;
    }

    private List<String> order(Set<String> affected, Set<String> deferred) {
        Comparator<String> priority = Comparator.<String, Boolean>comparing(deferred::contains)
                .thenComparing(graph.displayOrder());

        // 1. In-degrees within the induced subgraph
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> children = new HashMap<>();
        for (String id : affected) {
            inDegree.putIfAbsent(id, 0);
            List<String> kids = new ArrayList<>();
            for (String child : graph.dependentsOf(id)) {
                if (affected.contains(child)) {
                    kids.add(child);
                    inDegree.merge(child, 1, Integer::sum);
                }
            }
            children.put(id, kids);
        }

        // 2. Ready set, non-deferred cells first, then lowest display position
        PriorityQueue<String> ready = new PriorityQueue<>(priority);
        for (String id : affected) {
            if (inDegree.get(id) == 0)
                ready.add(id);
        }

        // 3. Kahn's algorithm
        List<String> plan = new ArrayList<>(affected.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            plan.add(current);
            for (String child : children.get(current)) {
                if (inDegree.merge(child, -1, Integer::sum) == 0)
                    ready.add(child);
            }
        }
        if (plan.size() != affected.size())
            throw new IllegalStateException("Cycle detected! Ordered " + plan.size() + " of " + affected.size());
        return plan;
    }
}
