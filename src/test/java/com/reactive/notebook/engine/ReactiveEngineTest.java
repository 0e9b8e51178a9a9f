package com.reactive.notebook.engine;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.api.CellStatus;
import com.reactive.notebook.api.CircularDependencyException;
import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.ExecutionStatus;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.RichOutput;
import com.reactive.notebook.api.StructuralErrorKind;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.kernel.WorkerKernel;

public class ReactiveEngineTest {
    private EngineConfig config;
    private WorkerKernel kernel;
    private ReactiveEngine engine;
    private RecordingListener listener;

    @Before
    public void setUp() {
        config = new EngineConfig();
        config.setTimeoutMillis(500);
        config.setInterruptGraceMillis(200);
        kernel = new WorkerKernel(config);
        engine = new ReactiveEngine(config, kernel);
        listener = new RecordingListener();
        engine.addListener(listener);
    }

    @After
    public void tearDown() {
        engine.close();
    }

    @Test
    public void testEditRunsDownstreamInDependencyOrder() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "y = x + 1");
        engine.cellEdited("c", "z = y * 2");
        assertEquals(4L, engine.namespace().get("z"));

        listener.clear();
        engine.cellEdited("a", "x = 10");

        assertEquals(List.of(List.of("a", "b", "c")), listener.plans);
        assertEquals(List.of("a", "b", "c"), listener.started);
        assertEquals(22L, engine.namespace().get("z"));
    }

    @Test
    public void testUpstreamChangePropagates() {
        engine.cellEdited("a", "x = 10");
        engine.cellEdited("b", "y = x * 2\ny");
        assertEquals("20", engine.cell("b").getOutput());

        engine.cellEdited("a", "x = 5");
        assertEquals("10", engine.cell("b").getOutput());
        assertEquals(CellStatus.SUCCESS, engine.cell("b").getStatus());
    }

    @Test
    public void testIndependentCellsAreNotRerun() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "y = 2");
        listener.clear();

        engine.cellEdited("a", "x = 3");
        assertEquals(List.of("a"), listener.started);
    }

    @Test
    public void testOutputCombinesPrintAndTrailingValue() {
        engine.cellEdited("a", "print('hi')\n1 + 1");
        assertEquals("hi\n2", engine.cell("a").getOutput());
    }

    @Test
    public void testDuplicateDefinitionBlocksExecution() {
        engine.cellEdited("a", "x = 1");
        listener.clear();

        engine.cellEdited("b", "x = 2");

        assertEquals(1, listener.structural.size());
        assertEquals(StructuralErrorKind.DUPLICATE_SYMBOL, listener.structural.get(0).kind());
        assertTrue(listener.structural.get(0).getMessage().contains("Variable 'x' is defined in multiple cells: cell 1, cell 2"));
        assertTrue(listener.started.isEmpty());
        assertEquals(1L, engine.namespace().get("x"));
        assertEquals(CellStatus.ERROR, engine.cell("b").getStatus());

        // Renaming clears the fault and the cell runs again
        listener.clear();
        engine.cellEdited("b", "w = 2");
        assertTrue(listener.structural.isEmpty());
        assertEquals(2L, engine.namespace().get("w"));
        assertEquals(1L, engine.namespace().get("x"));
    }

    @Test
    public void testTwoCellCycleIsReportedAndRecovers() {
        engine.cellEdited("a", "x = y + 1");
        assertEquals(CellStatus.ERROR, engine.cell("a").getStatus());
        listener.clear();

        engine.cellEdited("b", "y = x + 1");
        assertEquals(1, listener.structural.size());
        assertEquals(StructuralErrorKind.CIRCULAR_DEPENDENCY, listener.structural.get(0).kind());
        assertTrue(listener.started.isEmpty());

        listener.clear();
        engine.cellEdited("b", "y = 1");
        assertEquals(List.of("b", "a"), listener.started);
        assertEquals(2L, engine.namespace().get("x"));
    }

    @Test
    public void testThreeCellCycle() {
        engine.cellEdited("a", "x = z");
        engine.cellEdited("b", "y = x");
        listener.clear();
        engine.cellEdited("c", "z = y");

        assertEquals(1, listener.structural.size());
        CircularDependencyException cycle = (CircularDependencyException) listener.structural.get(0);
        assertEquals(4, cycle.cycle().size());
        assertEquals(cycle.cycle().get(0), cycle.cycle().get(3));
        assertTrue(cycle.getMessage().startsWith("Circular dependency detected: cell"));

        listener.clear();
        engine.cellEdited("c", "z = 7");
        assertEquals(List.of("c", "a", "b"), listener.started);
        assertEquals(7L, engine.namespace().get("y"));
    }

    @Test
    public void testTimeoutLeavesNamespaceUntouched() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "n = 0\nwhile true {\n  n += 1\n}");

        ExecutionResult timedOut = listener.results.get("b");
        assertEquals(ExecutionStatus.TIMEOUT, timedOut.status());
        assertTrue(timedOut.error().startsWith("TimeoutError"));
        assertFalse(engine.namespace().contains("n"));
        assertEquals(CellStatus.ERROR, engine.cell("b").getStatus());

        // The kernel is usable again right away
        engine.cellEdited("c", "y = x + 1");
        assertEquals(ExecutionStatus.SUCCESS, listener.results.get("c").status());
        assertEquals(2L, engine.namespace().get("y"));
    }

    @Test
    public void testFailureStopsTheRestOfThePlan() {
        engine.cellEdited("a", "x = 2");
        engine.cellEdited("b", "y = 10 // (x - 1)");
        engine.cellEdited("c", "z = y");
        assertEquals(CellStatus.SUCCESS, engine.cell("c").getStatus());
        listener.clear();

        engine.cellEdited("a", "x = 1");
        assertEquals(List.of("a", "b"), listener.started);
        assertTrue(listener.results.get("b").error().startsWith("ZeroDivisionError"));
        assertEquals(CellStatus.IDLE, engine.cell("c").getStatus());
        assertEquals(10L, engine.namespace().get("z"));
    }

    @Test
    public void testNameErrorAfterDelete() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "y = x + 1");
        listener.clear();

        assertTrue(engine.deleteCell("a"));
        assertTrue(listener.started.isEmpty());
        assertFalse(engine.namespace().contains("x"));

        engine.executeCell("b");
        ExecutionResult result = listener.results.get("b");
        assertEquals(ExecutionStatus.ERROR, result.status());
        assertTrue(result.error().startsWith("NameError: name 'x' is not defined"));
    }

    @Test
    public void testRetiredSymbolReRunsReaders() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "y = x");
        listener.clear();

        engine.cellEdited("a", "z = 2");
        assertEquals(List.of("a", "b"), listener.started);
        assertFalse(engine.namespace().contains("x"));
        assertTrue(listener.results.get("b").error().startsWith("NameError"));
    }

    @Test
    public void testSyntaxErrorIsReportedWithoutRunning() {
        engine.cellEdited("a", "x = (");
        assertEquals(List.of("a"), listener.analysisErrors);
        assertTrue(listener.started.isEmpty());
        assertTrue(listener.results.get("a").error().startsWith("SyntaxError"));
        assertEquals(CellStatus.ERROR, engine.cell("a").getStatus());

        listener.clear();
        engine.executeCell("a");
        assertEquals(List.of("a"), listener.analysisErrors);
    }

    @Test
    public void testAddCellClampsPosition() {
        engine.cellEdited("a", "x = 1");
        assertEquals(0, engine.addCell("first", -5));
        assertEquals(2, engine.addCell("last", 99));
        List<String> ids = engine.cellsInOrder().stream().map(Cell::getId).toList();
        assertEquals(List.of("first", "a", "last"), ids);
        assertTrue(listener.events.contains("added first 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExecuteUnknownCell() {
        engine.submitExecute("missing");
    }

    @Test
    public void testExecuteAllRunsInDependencyOrder() {
        engine.addCell("b", 0);
        engine.addCell("a", 1);
        engine.submitEdit("b", "y = x * 3");
        engine.submitEdit("a", "x = 2");
        listener.clear();

        engine.executeAll();
        assertEquals(List.of("a", "b"), listener.started);
        assertEquals(6L, engine.namespace().get("y"));
    }

    @Test
    public void testResetClearsState() {
        engine.cellEdited("a", "x = 1");
        engine.reset();
        assertEquals(0, engine.namespace().size());
        Cell a = engine.cell("a");
        assertEquals(CellStatus.IDLE, a.getStatus());
        assertEquals("", a.getOutput());
        assertEquals("x = 1", a.getSource());
    }

    @Test
    public void testInterruptStopsRunningCell() throws Exception {
        config.setTimeoutMillis(10_000);
        engine.submitEdit("a", "while true {\n  pass\n}");
        engine.submitEdit("b", "y = 1");
        Thread runner = new Thread(engine::runPendingPlans);
        runner.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (kernel.currentCellId() == null && System.currentTimeMillis() < deadline)
            Thread.sleep(10);
        assertEquals("a", engine.interrupt());
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertEquals(ExecutionStatus.INTERRUPTED, listener.results.get("a").status());
        assertEquals(List.of("a"), listener.interrupted);
        assertFalse(listener.started.contains("b"));
        assertEquals(CellStatus.ERROR, engine.cell("a").getStatus());
        assertEquals(CellStatus.IDLE, engine.cell("b").getStatus());
    }

    @Test
    public void testRepeatedEditsCoalesceIntoOneRun() {
        engine.cellEdited("a", "x = 1");
        listener.clear();

        assertTrue(engine.submitEdit("a", "x = 2"));
        assertTrue(engine.submitEdit("a", "x = 3"));
        assertTrue(engine.hasPendingWork());
        engine.runPendingPlans();

        assertEquals(List.of("a"), listener.started);
        assertEquals(3L, engine.namespace().get("x"));
        assertFalse(engine.hasPendingWork());
    }

    @Test
    public void testRestoredCellsKeepOutputsWithoutRunning() {
        engine.restoreCell("a", "x = 1", "", null, null, CellStatus.SUCCESS);
        engine.restoreCell("b", "y = x + 1\ny", "2", null, null, CellStatus.RUNNING);

        assertTrue(listener.events.isEmpty());
        assertEquals(0, engine.namespace().size());
        assertEquals(CellStatus.IDLE, engine.cell("b").getStatus());
        assertEquals("2", engine.cell("b").getOutput());
        assertEquals("b", engine.cellsInOrder().get(1).getId());

        engine.executeAll();
        assertEquals(2L, engine.namespace().get("y"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestoreRejectsDuplicateId() {
        engine.restoreCell("a", "x = 1", "", null, null, CellStatus.IDLE);
        engine.restoreCell("a", "x = 2", "", null, null, CellStatus.IDLE);
    }

    @Test
    public void testBlankingTheOnlyDefinerRetiresTheSymbol() {
        engine.cellEdited("a", "x = 10");
        engine.cellEdited("b", "y = x * 2\ny");
        assertEquals("20", engine.cell("b").getOutput());
        listener.clear();

        engine.cellEdited("a", "");
        assertEquals(List.of(List.of("a", "b")), listener.plans);
        assertFalse(engine.namespace().contains("x"));
        assertEquals(CellStatus.ERROR, engine.cell("b").getStatus());
        assertTrue(engine.cell("b").getError().startsWith("NameError: name 'x' is not defined"));
    }

    @Test
    public void testFailureStillRunsIndependentQueuedEdit() {
        assertTrue(engine.submitEdit("a", "z = 1 // 0"));
        assertTrue(engine.submitEdit("b", "y = 1"));
        engine.runPendingPlans();

        assertEquals(ExecutionStatus.ERROR, listener.results.get("a").status());
        assertEquals(List.of("a", "b"), listener.started);
        assertEquals(1L, engine.namespace().get("y"));
        assertEquals(CellStatus.SUCCESS, engine.cell("b").getStatus());
        assertFalse(engine.hasPendingWork());
    }

    @Test
    public void testInterruptJustBeforeKernelStartIsHonoured() {
        config.setTimeoutMillis(10_000);
        engine.addListener(new NotebookListener() {
            @Override
            public void onExecutionStarted(String cellId) {
                if (cellId.equals("a"))
                    engine.interrupt();
            }
        });

        long started = System.currentTimeMillis();
        engine.cellEdited("a", "while true {\n  pass\n}");

        assertTrue(System.currentTimeMillis() - started < 5_000);
        assertEquals(ExecutionStatus.INTERRUPTED, listener.results.get("a").status());
        assertEquals(List.of("a"), listener.interrupted);
    }

    @Test
    public void testDuplicateBlocksUnrelatedCells() {
        engine.cellEdited("a", "x = 1");
        engine.cellEdited("b", "x = 2");
        engine.cellEdited("c", "w = 1");
        listener.clear();

        engine.cellEdited("c", "w = 5");
        engine.executeCell("c");

        assertTrue(listener.started.isEmpty());
        assertTrue(listener.plans.isEmpty());
        assertEquals(2, listener.structural.size());
        assertFalse(engine.namespace().contains("w"));
    }

    @Test
    public void testEditDuringRunningPlanIsQueued() throws Exception {
        config.setTimeoutMillis(10_000);
        engine.submitEdit("a", "import time\ntime.sleep(1)\nx = 1");
        Thread runner = new Thread(engine::runPendingPlans);
        runner.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (kernel.currentCellId() == null && System.currentTimeMillis() < deadline)
            Thread.sleep(10);
        assertEquals("a", kernel.currentCellId());

        assertTrue(engine.submitEdit("b", "y = x + 1"));
        assertEquals(List.of("b"), engine.withGraph(g -> g.definersOf("y")));
        assertFalse(listener.started.contains("b"));

        runner.join(10_000);
        assertFalse(runner.isAlive());
        assertEquals(List.of("a", "b"), listener.started);
        assertEquals(List.of(List.of("a"), List.of("b")), listener.plans);
        assertEquals(2L, engine.namespace().get("y"));
    }

    @Test
    public void testCellViewsDoNotShareRichOutput() {
        engine.cellEdited("a", "import data\ndata.column('v', [1, 2, 3])");
        RichOutput view = engine.cell("a").getRichOutput();
        assertEquals("series", view.getType());

        view.setType("changed");
        ((Map<?, ?>) view.getData()).clear();

        RichOutput again = engine.cell("a").getRichOutput();
        assertEquals("series", again.getType());
        assertEquals(3, ((Map<?, ?>) again.getData()).size());
    }
}
