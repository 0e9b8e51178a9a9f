package com.reactive.notebook.disruptor;

import static org.junit.Assert.*;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.engine.RecordingListener;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.kernel.WorkerKernel;

public class NotebookSessionTest {
    private ReactiveEngine engine;
    private NotebookSession session;
    private RecordingListener listener;

    @Before
    public void setUp() {
        EngineConfig config = new EngineConfig();
        engine = new ReactiveEngine(config, new WorkerKernel(config));
        listener = new RecordingListener();
        engine.addListener(listener);
        session = new NotebookSession(engine, 16);
    }

    @After
    public void tearDown() {
        session.close();
        engine.close();
    }

    @Test
    public void testEditsRunOnSessionThread() throws Exception {
        assertTrue(session.edit("a", "x = 2"));
        assertTrue(session.edit("b", "y = x * 10"));
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(20L, engine.namespace().get("y"));
        assertFalse(engine.hasPendingWork());
    }

    @Test
    public void testRejectedEditPublishesNothing() throws Exception {
        session.edit("a", "x = 1");
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
        listener.clear();

        assertFalse(session.edit("b", "x = 2"));
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(listener.started.isEmpty());
        assertEquals(1, listener.structural.size());
    }

    @Test
    public void testBurstOfEditsEndsWithLatestSource() throws Exception {
        session.edit("a", "x = 0");
        for (int i = 1; i <= 50; i++)
            session.edit("a", "x = " + i);
        assertTrue(session.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(50L, engine.namespace().get("x"));
    }

    @Test
    public void testExecuteAll() throws Exception {
        engine.submitEdit("a", "x = 3");
        assertTrue(session.executeAll());
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(3L, engine.namespace().get("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExecuteUnknownCell() {
        session.execute("missing");
    }

    @Test
    public void testIdleWithNoWork() throws Exception {
        assertTrue(session.awaitIdle(Duration.ofMillis(100)));
    }
}
