package com.reactive.notebook.runtime;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.lang.Parser;

public class InterpreterTest {
    private Map<String, Object> globals;
    private StringBuilder stdout;
    private CancellationToken token;

    @Before
    public void setUp() {
        globals = new HashMap<>();
        stdout = new StringBuilder();
        token = new CancellationToken();
    }

    private Object run(String source) {
        return new Interpreter(globals, stdout, token, 50).execute(Parser.parse(source));
    }

    private CellRuntimeException fault(String source) {
        try {
            run(source);
        } catch (CellRuntimeException e) {
            return e;
        }
        throw new AssertionError("Expected a runtime fault from: " + source);
    }

    @Test
    public void testArithmetic() {
        assertEquals(7L, run("1 + 2 * 3"));
        assertEquals(2.5, run("5 / 2"));
        assertEquals(2L, run("5 // 2"));
        assertEquals(2L, run("-7 % 3"));
        assertEquals(1024L, run("2 ** 10"));
    }

    @Test
    public void testAssignmentsLandInGlobals() {
        assertNull(run("x = 3\ny = x * 2"));
        assertEquals(3L, globals.get("x"));
        assertEquals(6L, globals.get("y"));

        run("a, b = [1, 2]");
        assertEquals(2L, globals.get("b"));
    }

    @Test
    public void testPrintCapturesStdout() {
        run("print('a', 1)\nprint([1, 'b'])");
        assertEquals("a 1\n[1, 'b']\n", stdout.toString());
    }

    @Test
    public void testFunctionsAndClosures() {
        run("def make(n) {\n  return fn(x) -> x + n\n}\nadd5 = make(5)");
        assertEquals(12L, run("add5(7)"));
        assertFalse(globals.containsKey("n"));
    }

    @Test
    public void testLoopsAndControlFlow() {
        run("total = 0\nfor i in range(10) {\n  if i % 2 == 0 {\n    continue\n  }\n  if i > 7 {\n    break\n  }\n  total += i\n}");
        assertEquals(16L, globals.get("total"));

        run("n = 0\nwhile n < 5 {\n  n += 1\n}");
        assertEquals(5L, globals.get("n"));
    }

    @Test
    public void testCollections() {
        run("xs = [3, 1, 2]\nxs.append(0)\nm = {'a': 1}\nm['b'] = 2");
        assertEquals(List.of(3L, 1L, 2L, 0L), globals.get("xs"));
        assertEquals(List.of(0L, 1L, 2L, 3L), run("sorted(xs)"));
        assertEquals(2L, run("len(m)"));
        assertEquals(List.of(1L, 9L), run("[v * v for v in [1, 3]]"));
        assertEquals("ABC", run("'abc'.upper()"));
    }

    @Test
    public void testRecords() {
        assertEquals(3L, run("record Point(x, y)\np = Point(1, 2)\np.x + p.y"));
        assertEquals("Point(x=1, y=2)", Values.repr(globals.get("p")));
    }

    @Test
    public void testModules() {
        assertEquals(4.0, run("import math\nmath.sqrt(16)"));
        assertEquals("HI", run("from text import upper as up\nup('hi')"));
    }

    @Test
    public void testNameErrorCarriesLine() {
        CellRuntimeException e = fault("x = 1\ny = missing + 1");
        assertEquals("NameError", e.type());
        assertEquals("NameError: name 'missing' is not defined (line 2)", e.render());
    }

    @Test
    public void testTypedFaults() {
        assertEquals("ZeroDivisionError", fault("1 // 0").type());
        assertEquals("TypeError", fault("1 + 'a'").type());
        assertEquals("Error: boom (line 1)", fault("error('boom')").render());
    }

    @Test
    public void testRecursionLimit() {
        CellRuntimeException e = fault("def f(n) {\n  return f(n + 1)\n}\nf(0)");
        assertEquals("RecursionError", e.type());
    }

    @Test
    public void testBuiltinsAreNotGlobals() {
        run("print('x')");
        assertFalse(globals.containsKey("print"));
        // user bindings shadow builtins
        assertEquals(1L, run("len = fn(v) -> 1\nlen([1, 2, 3])"));
    }

    @Test
    public void testCancelledTokenStopsLoop() {
        token.cancel(ExecutionCancelledException.Reason.TIMEOUT);
        try {
            run("while true {\n  pass\n}");
            fail("Expected cancellation");
        } catch (ExecutionCancelledException e) {
            assertEquals(ExecutionCancelledException.Reason.TIMEOUT, e.reason());
        }
    }
}
