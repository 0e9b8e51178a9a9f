package com.reactive.notebook.engine;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.analysis.CellSymbols;

public class DependencyGraphTest {
    private DependencyGraph graph;

    @Before
    public void setUp() {
        graph = new DependencyGraph();
    }

    private static CellSymbols symbols(Set<String> defines, Set<String> uses) {
        return new CellSymbols(defines, uses);
    }

    @Test
    public void testEdgesFollowSymbols() {
        graph.upsert("a", symbols(Set.of("x"), Set.of()));
        graph.upsert("b", symbols(Set.of("y"), Set.of("x")));
        graph.upsert("c", symbols(Set.of(), Set.of("x", "y")));

        assertEquals(List.of("b", "c"), graph.dependentsOf("a"));
        assertEquals(List.of("a", "b"), graph.dependenciesOf("c"));
        assertEquals(Set.of("b", "c"), graph.downstreamOf("a"));
        assertTrue(graph.downstreamOf("c").isEmpty());
    }

    @Test
    public void testUpsertReturnsRetiredSymbols() {
        assertTrue(graph.upsert("a", symbols(Set.of("x", "y"), Set.of())).isEmpty());
        assertEquals(Set.of("y"), graph.upsert("a", symbols(Set.of("x", "z"), Set.of())));
    }

    @Test
    public void testReplacingRowDropsStaleEdges() {
        graph.upsert("a", symbols(Set.of("x"), Set.of()));
        graph.upsert("b", symbols(Set.of(), Set.of("x")));
        graph.upsert("a", symbols(Set.of("w"), Set.of()));

        assertTrue(graph.dependentsOf("a").isEmpty());
        assertTrue(graph.dependenciesOf("b").isEmpty());
    }

    @Test
    public void testSelfReferenceIsNotAnEdge() {
        graph.upsert("a", symbols(Set.of("x"), Set.of("x")));
        assertTrue(graph.dependentsOf("a").isEmpty());
        assertTrue(graph.validate().isValid());
    }

    @Test
    public void testValidateReportsAllDuplicates() {
        graph.upsert("a", symbols(Set.of("x", "y"), Set.of()));
        graph.upsert("b", symbols(Set.of("y"), Set.of()));
        graph.upsert("c", symbols(Set.of("x"), Set.of()));

        DependencyGraph.ValidationResult result = graph.validate();
        assertFalse(result.isValid());
        assertEquals(Map.of("x", List.of("a", "c"), "y", List.of("a", "b")), result.duplicates());
        assertEquals(List.of("x", "y"), List.copyOf(result.duplicates().keySet()));
    }

    @Test
    public void testValidateFindsCycle() {
        graph.upsert("a", symbols(Set.of("x"), Set.of("z")));
        graph.upsert("b", symbols(Set.of("y"), Set.of("x")));
        graph.upsert("c", symbols(Set.of("z"), Set.of("y")));

        assertEquals(List.of("a", "b", "c", "a"), graph.validate().cycle());
        assertTrue(graph.downstreamOf("a").contains("a"));
    }

    @Test
    public void testDisplayOrderDrivesTraversal() {
        List<String> display = List.of("c", "b", "a");
        DependencyGraph ordered = new DependencyGraph(display::indexOf);
        ordered.upsert("a", symbols(Set.of("x"), Set.of()));
        ordered.upsert("b", symbols(Set.of(), Set.of("x")));
        ordered.upsert("c", symbols(Set.of(), Set.of("x")));

        assertEquals(List.of("c", "b", "a"), ordered.cellIds());
        assertEquals(List.of("c", "b"), ordered.dependentsOf("a"));
    }

    @Test
    public void testRemoveAndSymbolTable() {
        graph.upsert("a", symbols(Set.of("x"), Set.of()));
        graph.upsert("b", symbols(Set.of("y"), Set.of("x")));

        Map<String, DependencyGraph.SymbolEntry> table = graph.symbolTable();
        assertEquals(List.of("a"), table.get("x").definers());
        assertEquals(List.of("b"), table.get("x").readers());

        assertEquals(Set.of("x"), graph.remove("a"));
        assertFalse(graph.contains("a"));
        assertTrue(graph.remove("a").isEmpty());
        assertTrue(graph.definersOf("x").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCell() {
        graph.symbolsOf("nope");
    }
}
