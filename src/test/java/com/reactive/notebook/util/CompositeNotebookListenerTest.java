package com.reactive.notebook.util;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.engine.RecordingListener;

public class CompositeNotebookListenerTest {

    @Test
    public void testFailingListenerDoesNotStopOthers() {
        CompositeNotebookListener composite = new CompositeNotebookListener();
        RecordingListener first = new RecordingListener();
        RecordingListener last = new RecordingListener();
        composite.addForComposite(first);
        composite.addForComposite(new NotebookListener() {
            @Override
            public void onExecutionStarted(String cellId) {
                throw new IllegalStateException("boom");
            }
        });
        composite.addForComposite(last);

        composite.onExecutionStarted("a");
        composite.onExecutionStarted("b");

        assertEquals(List.of("a", "b"), first.started);
        assertEquals(List.of("a", "b"), last.started);
    }

    @Test
    public void testRemove() {
        CompositeNotebookListener composite = new CompositeNotebookListener();
        RecordingListener listener = new RecordingListener();
        composite.addForComposite(listener);
        assertEquals(1, composite.size());

        composite.removeFromComposite(listener);
        composite.onCellDeleted("a");
        assertEquals(0, composite.size());
        assertTrue(listener.events.isEmpty());
    }
}
