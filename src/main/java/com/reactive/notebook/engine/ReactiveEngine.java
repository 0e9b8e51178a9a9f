package com.reactive.notebook.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.reactive.notebook.analysis.AnalysisException;
import com.reactive.notebook.analysis.CellSymbols;
import com.reactive.notebook.analysis.SymbolExtractor;
import com.reactive.notebook.api.CellStatus;
import com.reactive.notebook.api.ExecutionKernel;
import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.api.ExecutionStatus;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.api.RichOutput;
import com.reactive.notebook.api.StructuralException;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.runtime.Namespace;
import com.reactive.notebook.util.CompositeNotebookListener;

import lombok.extern.log4j.Log4j2;

/**
 * Coordinates cells, the dependency graph, the planner and the kernel.
 *
 * <h3>Threading</h3>
 * <p>
 * Graph mutations ({@code submit*}, {@link #addCell}, {@link #deleteCell}) are
 * synchronous and guarded by a graph monitor; they may run on any thread,
 * including while a plan is executing. Execution happens only in
 * {@link #runPendingPlans()}, which runs one plan at a time and drains the
 * work queued by the submissions. Repeated edits of a cell that has not run
 * yet coalesce: the latest source wins.
 *
 * <h3>Per-cell lifecycle</h3>
 * <ol>
 * <li>{@code idle} until planned.</li>
 * <li>{@code running} between the started and result events.</li>
 * <li>{@code success} or {@code error} from the kernel outcome. Dependents of
 * a failed cell in the same plan return to {@code idle}; the other cells of the
 * plan still run. An interrupt idles everything left in the plan.</li>
 * </ol>
 */
@Log4j2
public final class ReactiveEngine implements AutoCloseable {
    static final String INTERRUPT_MESSAGE = "Execution interrupted by user";

    private final EngineConfig config;
    private final ExecutionKernel kernel;
    private final CompositeNotebookListener listeners = new CompositeNotebookListener();

    private final Object graphLock = new Object();
    private final List<Cell> cells = new ArrayList<>();
    private final Map<String, Cell> byId = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph(this::positionOf);
    private final ExecutionPlanner planner = new ExecutionPlanner(graph);
    private final Namespace namespace = new Namespace();

    private final ReentrantLock executionLock = new ReentrantLock();
    private final Set<String> pendingCells = new LinkedHashSet<>();
    private final Set<String> pendingRetired = new LinkedHashSet<>();
    private boolean pendingAll;
    private volatile boolean abandon;

    public ReactiveEngine(EngineConfig config, ExecutionKernel kernel) {
        this.config = Objects.requireNonNull(config, "config");
        this.kernel = Objects.requireNonNull(kernel, "kernel");
    }

    public void addListener(NotebookListener listener) {
        listeners.addForComposite(listener);
    }

    public void removeListener(NotebookListener listener) {
        listeners.removeFromComposite(listener);
    }

    // ---- graph mutations -------------------------------------------------

    /**
     * Accepts new source for a cell (creating it at the end if unknown) and
     * queues it for execution when the graph is valid.
     *
     * @return whether execution was queued
     */
    public boolean submitEdit(String cellId, String source) {
        Objects.requireNonNull(cellId, "cellId");
        String code = source == null ? "" : source;
        CellSymbols symbols;
        AnalysisException analysisError = null;
        try {
            symbols = SymbolExtractor.extract(cellId, code);
        } catch (AnalysisException e) {
            symbols = CellSymbols.EMPTY;
            analysisError = e;
        }

        StructuralException structural = null;
        int createdAt = -1;
        synchronized (graphLock) {
            Cell cell = byId.get(cellId);
            if (cell == null) {
                cell = append(cellId);
                createdAt = cells.size() - 1;
            }
            cell.setSource(code);
            cell.setSymbols(symbols);
            Set<String> retired = graph.upsert(cellId, symbols);
            cell.getRetired().addAll(retired);
            if (analysisError != null) {
                pendingCells.remove(cellId);
                cell.setAnalysisError(analysisError.render());
                cell.clearResult(CellStatus.ERROR);
                cell.setError(analysisError.render());
            } else {
                cell.setAnalysisError(null);
                try {
                    planner.validate();
                    pendingCells.add(cellId);
                    pendingRetired.addAll(retired);
                } catch (StructuralException e) {
                    structural = e;
                    cell.clearResult(CellStatus.ERROR);
                    cell.setError(e.getMessage());
                }
            }
        }

        if (createdAt >= 0)
            listeners.onCellAdded(cellId, createdAt);
        if (analysisError != null) {
            log.debug("Cell {} failed analysis: {}", cellId, analysisError.getMessage());
            listeners.onAnalysisError(cellId, analysisError.render());
            listeners.onExecutionResult(cellId, ExecutionResult.error("", analysisError.render()));
            return false;
        }
        if (structural != null) {
            log.debug("Edit of cell {} left the graph invalid: {}", cellId, structural.getMessage());
            listeners.onStructuralError(structural);
            return false;
        }
        return true;
    }

    /**
     * Queues a re-run of a cell with its current source.
     *
     * @return whether execution was queued
     * @throws IllegalArgumentException for an unknown cell
     */
    public boolean submitExecute(String cellId) {
        String analysisError;
        StructuralException structural = null;
        synchronized (graphLock) {
            Cell cell = byId.get(cellId);
            if (cell == null)
                throw new IllegalArgumentException("Unknown cell: " + cellId);
            analysisError = cell.getAnalysisError();
            if (analysisError == null) {
                try {
                    planner.validate();
                    pendingCells.add(cellId);
                } catch (StructuralException e) {
                    structural = e;
                }
            }
        }
        if (analysisError != null) {
            listeners.onAnalysisError(cellId, analysisError);
            listeners.onExecutionResult(cellId, ExecutionResult.error("", analysisError));
            return false;
        }
        if (structural != null) {
            listeners.onStructuralError(structural);
            return false;
        }
        return true;
    }

    /**
     * Queues every cell, in dependency order.
     *
     * @return whether execution was queued
     */
    public boolean submitExecuteAll() {
        StructuralException structural = null;
        synchronized (graphLock) {
            try {
                planner.validate();
                pendingAll = true;
            } catch (StructuralException e) {
                structural = e;
            }
        }
        if (structural != null) {
            listeners.onStructuralError(structural);
            return false;
        }
        return true;
    }

    /** Adds an empty cell with a fresh id. */
    public String addCell(int position) {
        String id = UUID.randomUUID().toString();
        addCell(id, position);
        return id;
    }

    /**
     * Inserts an empty cell. The position is clamped to the current cell range.
     *
     * @return the position the cell landed at
     * @throws IllegalArgumentException if the id is taken
     */
    public int addCell(String cellId, int position) {
        Objects.requireNonNull(cellId, "cellId");
        int at;
        synchronized (graphLock) {
            if (byId.containsKey(cellId))
                throw new IllegalArgumentException("Duplicate cell id: " + cellId);
            at = Math.max(0, Math.min(position, cells.size()));
            Cell cell = new Cell(cellId);
            cells.add(at, cell);
            byId.put(cellId, cell);
            graph.upsert(cellId, CellSymbols.EMPTY);
        }
        listeners.onCellAdded(cellId, at);
        return at;
    }

    /**
     * Removes a cell. Its symbols are retired from the namespace at once unless
     * another cell still defines them; nothing is re-run. A duplicate or cycle
     * that remains afterwards is reported.
     *
     * @return false if the cell was unknown
     */
    public boolean deleteCell(String cellId) {
        StructuralException remaining = null;
        synchronized (graphLock) {
            Cell cell = byId.remove(cellId);
            if (cell == null)
                return false;
            cells.remove(cell);
            pendingCells.remove(cellId);
            Set<String> orphaned = new LinkedHashSet<>(graph.remove(cellId));
            orphaned.addAll(cell.getRetired());
            orphaned.removeIf(symbol -> !graph.definersOf(symbol).isEmpty());
            if (!orphaned.isEmpty()) {
                log.debug("Deleting cell {} retires {}", cellId, orphaned);
                namespace.remove(orphaned);
            }
            try {
                planner.validate();
            } catch (StructuralException e) {
                remaining = e;
            }
        }
        listeners.onCellDeleted(cellId);
        if (remaining != null)
            listeners.onStructuralError(remaining);
        return true;
    }

    /**
     * Rehydrates a persisted cell at the end of the notebook without running it.
     */
    public void restoreCell(String cellId, String source, String output, RichOutput richOutput, String error,
            CellStatus status) {
        String code = source == null ? "" : source;
        CellSymbols symbols;
        String analysisError = null;
        try {
            symbols = SymbolExtractor.extract(cellId, code);
        } catch (AnalysisException e) {
            symbols = CellSymbols.EMPTY;
            analysisError = e.render();
        }
        synchronized (graphLock) {
            if (byId.containsKey(cellId))
                throw new IllegalArgumentException("Duplicate cell id: " + cellId);
            Cell cell = append(cellId);
            cell.setSource(code);
            cell.setSymbols(symbols);
            cell.setAnalysisError(analysisError);
            // A restored cell never runs as such; only its last outcome is kept.
            cell.setStatus(status == null || status == CellStatus.RUNNING ? CellStatus.IDLE : status);
            cell.setOutput(output == null ? "" : output);
            cell.setRichOutput(richOutput);
            cell.setError(error);
            graph.upsert(cellId, symbols);
        }
    }

    private Cell append(String cellId) {
        Cell cell = new Cell(cellId);
        cells.add(cell);
        byId.put(cellId, cell);
        return cell;
    }

    private int positionOf(String cellId) {
        Cell cell = byId.get(cellId);
        return cell == null ? Integer.MAX_VALUE : cells.indexOf(cell);
    }

    // ---- execution -------------------------------------------------------

    /** Edits a cell and runs the resulting plan on the calling thread. */
    public void cellEdited(String cellId, String source) {
        submitEdit(cellId, source);
        runPendingPlans();
    }

    public void executeCell(String cellId) {
        submitExecute(cellId);
        runPendingPlans();
    }

    public void executeAll() {
        submitExecuteAll();
        runPendingPlans();
    }

    /**
     * Runs queued work until none is left. Plans run one at a time; callers on
     * other threads block until the active plan finishes.
     *
     * @return the number of cells executed
     */
    public int runPendingPlans() {
        executionLock.lock();
        try {
            int executed = 0;
            while (true) {
                List<String> plan;
                synchronized (graphLock) {
                    if (!pendingAll && pendingCells.isEmpty())
                        return executed;
                    try {
                        plan = pendingAll ? planner.planAll() : planner.plan(pendingCells, pendingRetired);
                    } catch (StructuralException e) {
                        // Already reported by the mutation that broke the graph.
                        log.debug("Dropping queued work, graph is invalid: {}", e.getMessage());
                        plan = List.of();
                    } finally {
                        pendingCells.clear();
                        pendingRetired.clear();
                        pendingAll = false;
                    }
                    abandon = false;
                }
                if (!plan.isEmpty())
                    executed += runPlan(plan);
            }
        } finally {
            executionLock.unlock();
        }
    }

    private int runPlan(List<String> plan) {
        log.debug("Executing plan {}", plan);
        listeners.onPlanQueued(plan);
        Set<String> retiring = retiringSymbols(plan);
        // Dependents of failed cells; independent cells of the plan still run.
        Set<String> blocked = new HashSet<>();
        int executed = 0;
        for (int i = 0; i < plan.size(); i++) {
            String cellId = plan.get(i);
            String source;
            synchronized (graphLock) {
                if (abandon) {
                    idleFrom(plan, i);
                    break;
                }
                Cell cell = byId.get(cellId);
                if (cell == null)
                    continue;
                if (blocked.contains(cellId)) {
                    cell.setStatus(CellStatus.IDLE);
                    continue;
                }
                source = cell.getSource();
                cell.clearResult(CellStatus.RUNNING);
            }

            listeners.onExecutionStarted(cellId);
            ExecutionResult result = kernel.run(cellId, source, namespace, config.getTimeout(), retiring,
                    () -> abandon);
            executed++;
            synchronized (graphLock) {
                Cell cell = byId.get(cellId);
                if (cell != null) {
                    cell.setStatus(CellStatus.of(result.status()));
                    cell.setOutput(result.output());
                    cell.setRichOutput(result.richOutput());
                    cell.setError(result.error());
                }
                if (result.isSuccess() && !retiring.isEmpty()) {
                    for (String id : plan) {
                        Cell c = byId.get(id);
                        if (c != null)
                            c.getRetired().removeAll(retiring);
                    }
                    retiring = Set.of();
                }
            }
            log.debug("Cell {} finished with {}", cellId, result.status());
            listeners.onExecutionResult(cellId, result);

            if (result.status() == ExecutionStatus.INTERRUPTED) {
                synchronized (graphLock) {
                    idleFrom(plan, i + 1);
                }
                listeners.onExecutionInterrupted(cellId, INTERRUPT_MESSAGE);
                break;
            }
            if (!result.isSuccess()) {
                synchronized (graphLock) {
                    blocked.addAll(graph.downstreamOf(cellId));
                }
                log.debug("Cell {} failed, skipping its dependents {}", cellId, blocked);
            }
            if (abandon && i + 1 < plan.size()) {
                synchronized (graphLock) {
                    idleFrom(plan, i + 1);
                }
                listeners.onExecutionInterrupted(null, INTERRUPT_MESSAGE);
                break;
            }
        }
        return executed;
    }

    // Symbols the plan's cells stopped defining and that no cell defines now.
    private Set<String> retiringSymbols(List<String> plan) {
        synchronized (graphLock) {
            Set<String> out = new LinkedHashSet<>();
            for (String id : plan) {
                Cell cell = byId.get(id);
                if (cell == null)
                    continue;
                cell.getRetired().removeIf(symbol -> !graph.definersOf(symbol).isEmpty());
                out.addAll(cell.getRetired());
            }
            return out;
        }
    }

    // Cells a plan never reached; their previous results no longer hold.
    private void idleFrom(List<String> plan, int from) {
        for (int j = from; j < plan.size(); j++) {
            Cell cell = byId.get(plan.get(j));
            if (cell != null)
                cell.setStatus(CellStatus.IDLE);
        }
    }

    /**
     * Cancels the running cell and abandons the rest of its plan. Work queued
     * after the plan started is kept.
     *
     * @return the id of the interrupted cell, or {@code null} if none was running
     */
    public String interrupt() {
        abandon = true;
        String cellId = kernel.interrupt();
        if (cellId != null)
            log.info("Interrupt requested for cell {}", cellId);
        return cellId;
    }

    /**
     * Stops execution, drops queued work, clears the namespace and returns
     * every cell to {@code idle} with empty output.
     */
    public void reset() {
        synchronized (graphLock) {
            pendingCells.clear();
            pendingRetired.clear();
            pendingAll = false;
        }
        interrupt();
        executionLock.lock();
        try {
            synchronized (graphLock) {
                namespace.clear();
                for (Cell cell : cells) {
                    cell.clearResult(CellStatus.IDLE);
                    cell.getRetired().clear();
                }
                log.info("Notebook reset, {} cells idle", cells.size());
            }
        } finally {
            executionLock.unlock();
        }
    }

    // ---- views -----------------------------------------------------------

    /** Copies of all cells in display order. */
    public List<Cell> cellsInOrder() {
        synchronized (graphLock) {
            List<Cell> out = new ArrayList<>(cells.size());
            for (Cell cell : cells)
                out.add(cell.copy());
            return out;
        }
    }

    /** A copy of one cell, or {@code null}. */
    public Cell cell(String cellId) {
        synchronized (graphLock) {
            Cell cell = byId.get(cellId);
            return cell == null ? null : cell.copy();
        }
    }

    public boolean hasPendingWork() {
        synchronized (graphLock) {
            return pendingAll || !pendingCells.isEmpty();
        }
    }

    /**
     * Runs an action against the dependency graph under the graph monitor.
     */
    public <T> T withGraph(Function<DependencyGraph, T> action) {
        synchronized (graphLock) {
            return action.apply(graph);
        }
    }

    public Namespace namespace() {
        return namespace;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public void close() {
        interrupt();
        kernel.close();
    }
}
