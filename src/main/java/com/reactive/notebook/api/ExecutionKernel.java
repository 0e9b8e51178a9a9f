package com.reactive.notebook.api;

import java.time.Duration;
import java.util.Set;
import java.util.function.BooleanSupplier;

import com.reactive.notebook.runtime.Namespace;

/**
 * Runs one cell's source against a shared namespace under a wall-clock
 * deadline. Runs are sequential; {@link #interrupt()} may be called from any
 * thread.
 */
public interface ExecutionKernel extends AutoCloseable {

    /**
     * Runs a cell. On success the namespace receives the run's bindings; on any
     * other outcome it is left exactly as before.
     *
     * @param retire names removed from the run's working copy before it starts;
     *               the removal is committed with the run's other changes
     */
    default ExecutionResult run(String cellId, String source, Namespace namespace, Duration timeout,
            Set<String> retire) {
        return run(cellId, source, namespace, timeout, retire, () -> false);
    }

    /**
     * Runs a cell unless {@code interrupted} already reports an interrupt when
     * the run is about to start, in which case the cell is reported as
     * interrupted without running. The check and the publication of the run
     * are atomic with respect to {@link #interrupt()}.
     */
    ExecutionResult run(String cellId, String source, Namespace namespace, Duration timeout, Set<String> retire,
            BooleanSupplier interrupted);

    default ExecutionResult run(String cellId, String source, Namespace namespace, Duration timeout) {
        return run(cellId, source, namespace, timeout, Set.of());
    }

    /**
     * Cancels the in-flight run, if any.
     *
     * @return the id of the cell that was running, or {@code null}
     */
    String interrupt();

    /** The id of the running cell, or {@code null} when idle. */
    String currentCellId();

    @Override
    void close();
}
