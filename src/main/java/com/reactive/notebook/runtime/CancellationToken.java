package com.reactive.notebook.runtime;

/**
 * Cooperative cancellation flag shared between a kernel and the worker thread
 * running a cell. The interpreter polls {@link #checkpoint()} at every loop
 * iteration, call and comprehension step.
 */
public final class CancellationToken {
    private volatile ExecutionCancelledException.Reason reason;

    public void cancel(ExecutionCancelledException.Reason reason) {
        if (this.reason == null)
            this.reason = reason;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public ExecutionCancelledException.Reason reason() {
        return reason;
    }

    /**
     * @throws ExecutionCancelledException if cancelled or the current thread was
     *                                     interrupted
     */
    public void checkpoint() {
        ExecutionCancelledException.Reason r = reason;
        if (r != null)
            throw new ExecutionCancelledException(r);
        if (Thread.currentThread().isInterrupted())
            throw new ExecutionCancelledException(ExecutionCancelledException.Reason.INTERRUPT);
    }

    /**
     * Checkpoint for helpers that loop without an interpreter at hand. Only the
     * worker thread's interrupt flag is consulted; kernels interrupt the worker
     * whenever they cancel a run.
     */
    public static void checkThread() {
        if (Thread.currentThread().isInterrupted())
            throw new ExecutionCancelledException(ExecutionCancelledException.Reason.INTERRUPT);
    }
}
