package com.reactive.notebook.engine;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.analysis.SymbolExtractor;
import com.reactive.notebook.api.CircularDependencyException;
import com.reactive.notebook.api.DuplicateSymbolException;

public class ExecutionPlannerTest {
    private DependencyGraph graph;
    private ExecutionPlanner planner;

    @Before
    public void setUp() {
        graph = new DependencyGraph();
        planner = new ExecutionPlanner(graph);
    }

    private void cell(String id, String source) {
        graph.upsert(id, SymbolExtractor.extract(id, source));
    }

    @Test
    public void testPlanIsTopologicalWithDisplayTieBreak() {
        cell("a", "x = 1");
        cell("b", "y = x + 1");
        cell("c", "z = x + 2");
        cell("d", "w = y + z");

        assertEquals(List.of("a", "b", "c", "d"), planner.plan("a"));
        assertEquals(List.of("c", "d"), planner.plan("c"));
    }

    @Test
    public void testPlanIgnoresDisplayOrderWhenEdgesDisagree() {
        cell("a", "y = x * 2");
        cell("b", "x = 5");

        assertEquals(List.of("b", "a"), planner.plan("b"));
        assertEquals(List.of("b", "a"), planner.planAll());
    }

    @Test
    public void testRetiredReadersAreDeferred() {
        cell("a", "y = x + 1");
        cell("b", "x = 1\nz = 3");
        cell("c", "w = z");
        // b stops defining x; a still reads it
        Set<String> retired = graph.upsert("b", SymbolExtractor.extract("b", "z = 4"));
        assertEquals(Set.of("x"), retired);

        assertEquals(List.of("b", "c", "a"), planner.plan(List.of("b"), retired));
    }

    @Test
    public void testUnknownChangedCellsAreSkipped() {
        cell("a", "x = 1");
        assertEquals(List.of("a"), planner.plan(List.of("gone", "a"), Set.of()));
    }

    @Test(expected = DuplicateSymbolException.class)
    public void testDuplicateFailsClosed() {
        cell("a", "x = 1");
        cell("b", "x = 2");
        planner.plan("a");
    }

    @Test
    public void testCycleFailsClosed() {
        cell("a", "x = y");
        cell("b", "y = x");
        try {
            planner.plan("a");
            fail("Expected a cycle");
        } catch (CircularDependencyException e) {
            assertEquals(List.of("a", "b", "a"), e.cycle());
            assertEquals("Circular dependency detected: cell 1 → cell 2 → cell 1", e.getMessage());
        }
    }

    @Test
    public void testLabels() {
        cell("first", "a = 1");
        cell("second", "b = 2");
        assertEquals("cell 2", planner.labels().get("second"));
    }
}
