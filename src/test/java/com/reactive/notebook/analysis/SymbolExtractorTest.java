package com.reactive.notebook.analysis;

import static org.junit.Assert.*;

import java.util.Set;

import org.junit.Test;

public class SymbolExtractorTest {

    private static CellSymbols extract(String source) {
        return SymbolExtractor.extract("cell", source);
    }

    @Test
    public void testAssignmentDefinesAndReads() {
        CellSymbols s = extract("y = x + 1");
        assertEquals(Set.of("y"), s.defines());
        assertEquals(Set.of("x"), s.uses());
    }

    @Test
    public void testLocalBindingHidesLaterReads() {
        CellSymbols s = extract("a = 1\nb = a * 2");
        assertEquals(Set.of("a", "b"), s.defines());
        assertTrue(s.uses().isEmpty());
    }

    @Test
    public void testReadBeforeBindingIsAUse() {
        CellSymbols s = extract("x = x + 1");
        assertEquals(Set.of("x"), s.defines());
        assertEquals(Set.of("x"), s.uses());
    }

    @Test
    public void testFunctionParametersAndLocalsStayInside() {
        CellSymbols s = extract("def f(a) {\n  b = a + offset\n  return b\n}");
        assertEquals(Set.of("f"), s.defines());
        assertEquals(Set.of("offset"), s.uses());
    }

    @Test
    public void testComprehensionTargetsAreScoped() {
        CellSymbols s = extract("squares = [i * i for i in data if i > limit]");
        assertEquals(Set.of("squares"), s.defines());
        assertEquals(Set.of("data", "limit"), s.uses());
    }

    @Test
    public void testLambdaParametersAreScoped() {
        CellSymbols s = extract("g = fn(v) -> v * k");
        assertEquals(Set.of("g"), s.defines());
        assertEquals(Set.of("k"), s.uses());
    }

    @Test
    public void testConditionalBindingsDoNotHideLaterReads() {
        CellSymbols s = extract("if flag {\n  x = 1\n}\ny = x");
        assertEquals(Set.of("x", "y"), s.defines());
        assertEquals(Set.of("flag", "x"), s.uses());
    }

    @Test
    public void testLoopTargetsAreDefinitions() {
        CellSymbols s = extract("total = 0\nfor item in items {\n  total += item\n}");
        assertEquals(Set.of("total", "item"), s.defines());
        assertEquals(Set.of("items"), s.uses());
    }

    @Test
    public void testImportsAndRecords() {
        CellSymbols s = extract("import math as m\nfrom text import upper\nrecord Point(x, y)");
        assertEquals(Set.of("m", "upper", "Point"), s.defines());
        assertTrue(s.uses().isEmpty());
    }

    @Test
    public void testPrivateNamesAreIgnored() {
        CellSymbols s = extract("_tmp = source\nresult = _tmp * 2");
        assertEquals(Set.of("result"), s.defines());
        assertEquals(Set.of("source"), s.uses());
    }

    @Test
    public void testBuiltinsAreReportedAsUses() {
        assertEquals(Set.of("print", "x"), extract("print(x)").uses());
    }

    @Test
    public void testSubscriptAssignmentReadsTarget() {
        CellSymbols s = extract("table[key] = 1");
        assertTrue(s.defines().isEmpty());
        assertEquals(Set.of("table", "key"), s.uses());
    }

    @Test
    public void testSyntaxErrorCarriesLine() {
        try {
            extract("x = 1\ny = (");
            fail("Expected an analysis failure");
        } catch (AnalysisException e) {
            assertEquals("cell", e.cellId());
            assertEquals(2, e.line());
            assertTrue(e.render().startsWith("SyntaxError: "));
        }
    }
}
