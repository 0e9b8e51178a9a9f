package com.reactive.notebook.kernel;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import com.reactive.notebook.api.ExecutionKernel;
import com.reactive.notebook.api.ExecutionResult;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.lang.ParseException;
import com.reactive.notebook.lang.Parser;
import com.reactive.notebook.lang.Program;
import com.reactive.notebook.runtime.CancellationToken;
import com.reactive.notebook.runtime.CellRuntimeException;
import com.reactive.notebook.runtime.ExecutionCancelledException;
import com.reactive.notebook.runtime.Interpreter;
import com.reactive.notebook.runtime.Namespace;
import com.reactive.notebook.runtime.Values;

import lombok.extern.log4j.Log4j2;

/**
 * {@link ExecutionKernel} backed by a dedicated worker thread.
 *
 * <p>
 * Each run interprets the cell against a deep copy of the namespace on the
 * worker while the calling thread waits for the deadline. The copy is
 * committed only if the run succeeds. A timeout or interrupt fires the run's
 * cancellation token and interrupts the worker thread; the worker is then
 * retired and replaced, waiting at most the configured grace period for the
 * old one to stop, so a runaway cell never blocks the next run.
 */
@Log4j2
public final class WorkerKernel implements ExecutionKernel {
    private static final long WORKER_STACK_BYTES = 64L * 1024 * 1024;

    private final int maxCallDepth;
    private final Duration grace;
    private final RichOutputProjector projector;

    private final ReentrantLock runLock = new ReentrantLock();
    // Guards publishing a run against a concurrent interrupt().
    private final Object interruptLock = new Object();
    private final AtomicInteger generation = new AtomicInteger();
    private ExecutorService worker;
    private volatile Run current;
    private volatile boolean closed;

    private record Run(String cellId, CancellationToken token, Future<Object> future) {
    }

    public WorkerKernel(EngineConfig config) {
        this(config.getMaxCallDepth(), config.getInterruptGrace(),
                new RichOutputProjector(config.getMaxRows(), config.getMaxArrayElements()));
    }

    public WorkerKernel(int maxCallDepth, Duration grace, RichOutputProjector projector) {
        this.maxCallDepth = maxCallDepth;
        this.grace = grace;
        this.projector = projector;
        this.worker = newWorker();
    }

    private ExecutorService newWorker() {
        int gen = generation.incrementAndGet();
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(null, r, "cell-worker-" + gen, WORKER_STACK_BYTES);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ExecutionResult run(String cellId, String source, Namespace namespace, Duration timeout,
            Set<String> retire, BooleanSupplier interrupted) {
        if (closed)
            throw new IllegalStateException("Kernel is closed");
        if (source == null || source.isBlank()) {
            if (!retire.isEmpty())
                retireOnly(namespace, retire);
            return ExecutionResult.success("", null);
        }

        Program program;
        try {
            program = Parser.parse(source);
        } catch (ParseException e) {
            return ExecutionResult.error("", e.render());
        }

        runLock.lock();
        try {
            return execute(cellId, program, namespace, timeout, retire, interrupted);
        } finally {
            runLock.unlock();
        }
    }

    // A blank cell has nothing to run, but the names it stopped defining still go.
    private void retireOnly(Namespace namespace, Set<String> retire) {
        runLock.lock();
        try {
            Namespace.Snapshot snapshot = namespace.snapshot();
            snapshot.values().keySet().removeAll(retire);
            namespace.commit(snapshot);
            log.debug("Retired {} for a blank cell", retire);
        } finally {
            runLock.unlock();
        }
    }

    private ExecutionResult execute(String cellId, Program program, Namespace namespace, Duration timeout,
            Set<String> retire, BooleanSupplier interrupted) {
        CancellationToken token = new CancellationToken();
        StringBuilder stdout = new StringBuilder();
        Namespace.Snapshot snapshot;
        Future<Object> future;
        synchronized (interruptLock) {
            // An interrupt that landed before this run was published applies to it.
            if (interrupted.getAsBoolean()) {
                log.debug("Cell {} interrupted before it started", cellId);
                return ExecutionResult.interrupted("");
            }
            snapshot = namespace.snapshot();
            snapshot.values().keySet().removeAll(retire);
            future = worker.submit(
                    () -> new Interpreter(snapshot.values(), stdout, token, maxCallDepth).execute(program));
            current = new Run(cellId, token, future);
        }
        log.debug("Running cell {} on worker {}", cellId, generation.get());

        boolean committed = false;
        try {
            Object value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            namespace.commit(snapshot);
            committed = true;
            return ExecutionResult.success(render(stdout, value), projector.project(value));
        } catch (TimeoutException e) {
            token.cancel(ExecutionCancelledException.Reason.TIMEOUT);
            log.warn("Cell {} timed out after {} ms", cellId, timeout.toMillis());
            recycle(future);
            return ExecutionResult.timeout("", timeout);
        } catch (CancellationException e) {
            recycle(future);
            return cancelled(token, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CellRuntimeException fault)
                return ExecutionResult.error(stdout.toString(), fault.render());
            if (cause instanceof ExecutionCancelledException)
                return cancelled(token, timeout);
            log.error("Unexpected failure running cell {}", cellId, cause);
            return ExecutionResult.error(stdout.toString(),
                    "InternalError: " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel(ExecutionCancelledException.Reason.INTERRUPT);
            recycle(future);
            return ExecutionResult.interrupted("");
        } finally {
            synchronized (interruptLock) {
                current = null;
            }
            if (!committed)
                namespace.discard(snapshot);
        }
    }

    private static ExecutionResult cancelled(CancellationToken token, Duration timeout) {
        if (token.reason() == ExecutionCancelledException.Reason.TIMEOUT)
            return ExecutionResult.timeout("", timeout);
        return ExecutionResult.interrupted("");
    }

    // Output: stdout without trailing newlines, then the trailing value's repr.
    private static String render(StringBuilder stdout, Object value) {
        String printed = stdout.toString().stripTrailing();
        if (value == null)
            return printed;
        String shown = Values.repr(value);
        return printed.isEmpty() ? shown : printed + "\n" + shown;
    }

    // Interrupts the worker, waits out the grace period and starts a fresh one.
    private void recycle(Future<Object> future) {
        future.cancel(true);
        ExecutorService old = worker;
        old.shutdownNow();
        worker = newWorker();
        try {
            if (!old.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS))
                log.warn("Retired worker did not stop within {} ms; abandoning it", grace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Kernel worker replaced, now generation {}", generation.get());
    }

    @Override
    public String interrupt() {
        Run run;
        synchronized (interruptLock) {
            run = current;
            if (run == null)
                return null;
            run.token().cancel(ExecutionCancelledException.Reason.INTERRUPT);
            run.future().cancel(true);
        }
        log.debug("Interrupt delivered to cell {}", run.cellId());
        return run.cellId();
    }

    @Override
    public String currentCellId() {
        Run run = current;
        return run == null ? null : run.cellId();
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        interrupt();
        runLock.lock();
        try {
            worker.shutdownNow();
        } finally {
            runLock.unlock();
        }
    }
}
