package com.reactive.notebook.web;

import static org.junit.Assert.*;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactive.notebook.disruptor.NotebookSession;
import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.kernel.WorkerKernel;

public class CommandDispatcherTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private ReactiveEngine engine;
    private NotebookSession session;
    private CommandDispatcher dispatcher;

    @Before
    public void setUp() {
        EngineConfig config = new EngineConfig();
        engine = new ReactiveEngine(config, new WorkerKernel(config));
        session = new NotebookSession(engine, 64);
        dispatcher = new CommandDispatcher(session, new MessageCodec(mapper));
    }

    @After
    public void tearDown() {
        session.close();
        engine.close();
    }

    private JsonNode reply(String json) throws Exception {
        String reply = dispatcher.dispatch(json);
        assertNotNull("Expected a reply to " + json, reply);
        return mapper.readTree(reply);
    }

    @Test
    public void testEditRunsCell() throws Exception {
        assertNull(dispatcher.dispatch("{\"type\":\"edit_cell\",\"cell_id\":\"a\",\"code\":\"x = 20\"}"));
        assertNull(dispatcher.dispatch("{\"type\":\"cell_updated\",\"cell_id\":\"b\",\"source\":\"y = x + 1\"}"));
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(21L, engine.namespace().get("y"));

        assertNull(dispatcher.dispatch("{\"type\":\"execute_all\"}"));
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
    }

    @Test
    public void testAddAndDeleteCells() throws Exception {
        assertNull(dispatcher.dispatch("{\"type\":\"add_cell\"}"));
        assertNull(dispatcher.dispatch("{\"type\":\"add_cell\",\"position\":0}"));
        assertEquals(2, engine.cellsInOrder().size());

        String id = engine.cellsInOrder().get(0).getId();
        assertNull(dispatcher.dispatch("{\"type\":\"delete_cell\",\"cell_id\":\"" + id + "\"}"));
        assertEquals(1, engine.cellsInOrder().size());

        JsonNode missing = reply("{\"type\":\"delete_cell\",\"cell_id\":\"ghost\"}");
        assertEquals("error", missing.get("type").asText());
        assertEquals("ghost", missing.get("cell_id").asText());
        assertEquals("Unknown cell: ghost", missing.get("message").asText());
    }

    @Test
    public void testExecuteUnknownCellReplies() throws Exception {
        assertEquals("Unknown cell: nope", reply("{\"type\":\"execute_cell\",\"cell_id\":\"nope\"}").get("message").asText());
    }

    @Test
    public void testMissingCellId() throws Exception {
        assertEquals("execute_cell requires cell_id", reply("{\"type\":\"execute_cell\"}").get("message").asText());
    }

    @Test
    public void testUnknownType() throws Exception {
        assertEquals("Unknown message type: dance", reply("{\"type\":\"dance\"}").get("message").asText());
        assertEquals("Message has no type", reply("{\"cell_id\":\"a\"}").get("message").asText());
    }

    @Test
    public void testMalformedJson() throws Exception {
        assertTrue(reply("{oops").get("message").asText().startsWith("Invalid message: "));
    }

    @Test
    public void testResetClearsNamespace() throws Exception {
        dispatcher.dispatch("{\"type\":\"edit_cell\",\"cell_id\":\"a\",\"code\":\"x = 1\"}");
        assertTrue(session.awaitIdle(Duration.ofSeconds(5)));
        assertNull(dispatcher.dispatch("{\"type\":\"reset\"}"));
        assertEquals(0, engine.namespace().size());
        assertNull(dispatcher.dispatch("{\"type\":\"interrupt\"}"));
    }
}
