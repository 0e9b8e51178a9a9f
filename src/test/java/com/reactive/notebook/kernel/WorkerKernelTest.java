package com.reactive.notebook.kernel;

import static org.junit.Assert.*;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.ExecutionStatus;
import com.reactive.notebook.runtime.Namespace;

public class WorkerKernelTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private WorkerKernel kernel;
    private Namespace namespace;

    @Before
    public void setUp() {
        kernel = new WorkerKernel(100, Duration.ofMillis(200), new RichOutputProjector(100, 1000));
        namespace = new Namespace();
    }

    @After
    public void tearDown() {
        kernel.close();
    }

    @Test
    public void testSuccessCommitsBindings() {
        ExecutionResult result = kernel.run("a", "x = 2\nprint('hello')\nx * 21", namespace, TIMEOUT);
        assertEquals(ExecutionStatus.SUCCESS, result.status());
        assertEquals("hello\n42", result.output());
        assertNull(result.error());
        assertEquals(2L, namespace.get("x"));
    }

    @Test
    public void testErrorDiscardsBindings() {
        ExecutionResult result = kernel.run("a", "x = 5\nprint('before')\ny = 1 // 0", namespace, TIMEOUT);
        assertEquals(ExecutionStatus.ERROR, result.status());
        assertEquals("ZeroDivisionError: integer division or modulo by zero (line 3)", result.error());
        assertEquals("before\n", result.output());
        assertFalse(namespace.contains("x"));
    }

    @Test
    public void testTimeoutThenRecovers() {
        kernel.run("a", "x = 1", namespace, TIMEOUT);
        ExecutionResult result = kernel.run("b", "x = 2\nwhile true {\n  x += 1\n}", namespace, Duration.ofMillis(200));

        assertEquals(ExecutionStatus.TIMEOUT, result.status());
        assertEquals("TimeoutError: Cell execution timed out after 0.2 seconds", result.error());
        assertEquals("", result.output());
        assertEquals(1L, namespace.get("x"));

        ExecutionResult next = kernel.run("c", "x + 1", namespace, TIMEOUT);
        assertEquals("2", next.output());
    }

    @Test
    public void testSleepIsCancelledByTimeout() {
        ExecutionResult result = kernel.run("a", "import time\ntime.sleep(30)", namespace, Duration.ofMillis(100));
        assertEquals(ExecutionStatus.TIMEOUT, result.status());
    }

    @Test
    public void testInterruptFromAnotherThread() throws Exception {
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ExecutionResult> running = caller.submit(
                    () -> kernel.run("spin", "while true {\n  pass\n}", namespace, TIMEOUT));
            long deadline = System.currentTimeMillis() + 5_000;
            while (kernel.currentCellId() == null && System.currentTimeMillis() < deadline)
                Thread.sleep(10);

            assertEquals("spin", kernel.interrupt());
            ExecutionResult result = running.get();
            assertEquals(ExecutionStatus.INTERRUPTED, result.status());
            assertEquals("InterruptedError: Execution interrupted by user", result.error());
            assertNull(kernel.currentCellId());
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    public void testInterruptWhenIdle() {
        assertNull(kernel.interrupt());
    }

    @Test
    public void testBlankSourceSucceeds() {
        ExecutionResult result = kernel.run("a", "   \n", namespace, TIMEOUT);
        assertTrue(result.isSuccess());
        assertEquals("", result.output());
    }

    @Test
    public void testSyntaxError() {
        ExecutionResult result = kernel.run("a", "x = )", namespace, TIMEOUT);
        assertEquals(ExecutionStatus.ERROR, result.status());
        assertTrue(result.error().startsWith("SyntaxError: "));
    }

    @Test
    public void testRetiredNamesAreRemovedOnSuccess() {
        kernel.run("a", "x = 1\ny = 2", namespace, TIMEOUT);
        ExecutionResult result = kernel.run("a", "y = 3", namespace, TIMEOUT, Set.of("x"));
        assertTrue(result.isSuccess());
        assertFalse(namespace.contains("x"));
        assertEquals(3L, namespace.get("y"));
    }

    @Test
    public void testRichOutputForTables() {
        ExecutionResult result = kernel.run("a", "import data\ndata.table({'a': [1, 2], 'b': ['x', 'y']})",
                namespace, TIMEOUT);
        assertTrue(result.isSuccess());
        assertEquals("dataframe", result.richOutput().getType());
        assertEquals("object", result.richOutput().getDtypes().get("b"));
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedKernelRejectsRuns() {
        kernel.close();
        kernel.run("a", "x = 1", namespace, TIMEOUT);
    }

    @Test
    public void testRunawayBuiltinStopsWithinGrace() throws Exception {
        ExecutionResult result = kernel.run("a", "sum(range(100000000000))", namespace, Duration.ofMillis(300));
        assertEquals(ExecutionStatus.TIMEOUT, result.status());

        long deadline = System.currentTimeMillis() + 2_000;
        while (runningWorkers() > 0 && System.currentTimeMillis() < deadline)
            Thread.sleep(20);
        assertEquals(0, runningWorkers());
    }

    @Test
    public void testRunawayMaxIsCancelled() {
        ExecutionResult result = kernel.run("a", "max(range(100000000000))", namespace, Duration.ofMillis(300));
        assertEquals(ExecutionStatus.TIMEOUT, result.status());
        assertEquals("2", kernel.run("b", "1 + 1", namespace, TIMEOUT).output());
    }

    @Test
    public void testBlankSourceStillRetiresNames() {
        kernel.run("a", "x = 1\ny = 2", namespace, TIMEOUT);
        ExecutionResult result = kernel.run("a", "  ", namespace, TIMEOUT, Set.of("x", "y"));
        assertTrue(result.isSuccess());
        assertFalse(namespace.contains("x"));
        assertFalse(namespace.contains("y"));
    }

    @Test
    public void testInterruptBeforeStartSkipsTheRun() {
        kernel.run("seed", "x = 1", namespace, TIMEOUT);
        ExecutionResult result = kernel.run("a", "x = 2\nwhile true {\n  pass\n}", namespace, TIMEOUT,
                Set.of("x"), () -> true);
        assertEquals(ExecutionStatus.INTERRUPTED, result.status());
        assertEquals(1L, namespace.get("x"));
        assertNull(kernel.currentCellId());
    }

    private static long runningWorkers() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().startsWith("cell-worker-"))
                .filter(t -> t.getState() == Thread.State.RUNNABLE)
                .count();
    }
}
