package com.reactive.notebook.disruptor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

/**
 * Asynchronous front door to a {@link ReactiveEngine}.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>A producer (any thread, typically a transport handler) applies an edit
 * or execution request to the engine's graph synchronously.</li>
 * <li>If work was queued it publishes an {@link ExecutionRequestEvent}.</li>
 * <li>The single consumer thread drains the engine's queue at the end of each
 * batch, so a burst of edits results in one merged plan.</li>
 * </ol>
 * Interrupts, structural mutations and reset bypass the ring buffer so they
 * take effect while a plan is running.
 */
@Log4j2
public final class NotebookSession implements AutoCloseable {
    private static final int DEFAULT_BUFFER_SIZE = 1024;

    private final ReactiveEngine engine;
    private final Disruptor<ExecutionRequestEvent> disruptor;
    private final RingBuffer<ExecutionRequestEvent> ringBuffer;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);

    private final AtomicLong requestIds = new AtomicLong();
    private final Object idleMonitor = new Object();
    private long published = -1;
    private long processed = -1;
    private boolean draining;

    public NotebookSession(ReactiveEngine engine) {
        this(engine, DEFAULT_BUFFER_SIZE);
    }

    public NotebookSession(ReactiveEngine engine, int bufferSize) {
        this.engine = engine;
        this.disruptor = new Disruptor<>(
                ExecutionRequestEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(this::onEvent);
        this.ringBuffer = disruptor.start();
        log.info("Notebook session started (ring buffer size {})", bufferSize);
    }

    public ReactiveEngine engine() {
        return engine;
    }

    /** Applies an edit to the graph now and schedules its plan. */
    public boolean edit(String cellId, String source) {
        boolean queued = engine.submitEdit(cellId, source);
        if (queued)
            publish(ExecutionRequestEvent.Kind.EDIT, cellId);
        return queued;
    }

    /**
     * @throws IllegalArgumentException for an unknown cell
     */
    public boolean execute(String cellId) {
        boolean queued = engine.submitExecute(cellId);
        if (queued)
            publish(ExecutionRequestEvent.Kind.EXECUTE, cellId);
        return queued;
    }

    public boolean executeAll() {
        boolean queued = engine.submitExecuteAll();
        if (queued)
            publish(ExecutionRequestEvent.Kind.EXECUTE_ALL, null);
        return queued;
    }

    public String interrupt() {
        return engine.interrupt();
    }

    public void reset() {
        engine.reset();
    }

    private void publish(ExecutionRequestEvent.Kind kind, String cellId) {
        long requestId = requestIds.incrementAndGet();
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(kind, cellId, requestId);
        } finally {
            synchronized (idleMonitor) {
                published = Math.max(published, seq);
            }
            ringBuffer.publish(seq);
        }
    }

    private void onEvent(ExecutionRequestEvent event, long sequence, boolean endOfBatch) {
        log.debug("Request {} ({} {}) at sequence {}", event.requestId(), event.kind(), event.cellId(), sequence);
        event.clear();
        if (!endOfBatch)
            return;
        synchronized (idleMonitor) {
            draining = true;
        }
        try {
            int executed = engine.runPendingPlans();
            log.debug("Drained batch ending at {}: {} cells executed", sequence, executed);
        } catch (RuntimeException e) {
            errors.log("Execution thread failed draining batch ending at " + sequence, e);
        } finally {
            synchronized (idleMonitor) {
                draining = false;
                processed = sequence;
                idleMonitor.notifyAll();
            }
        }
    }

    /**
     * Waits until every request published so far has been drained.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (draining || processed < published) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0)
                    return false;
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    @Override
    public void close() {
        engine.interrupt();
        disruptor.halt();
        log.info("Notebook session stopped");
    }
}
