package com.reactive.notebook.web;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.kernel.WorkerKernel;

public class WebsocketNotebookListenerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> sent = new ArrayList<>();
    private ReactiveEngine engine;

    @Before
    public void setUp() {
        EngineConfig config = new EngineConfig();
        engine = new ReactiveEngine(config, new WorkerKernel(config));
        engine.addListener(new WebsocketNotebookListener(engine, new MessageCodec(mapper), sent::add));
    }

    @After
    public void tearDown() {
        engine.close();
    }

    private List<String> types() throws Exception {
        List<String> types = new ArrayList<>();
        for (String message : sent)
            types.add(mapper.readTree(message).get("type").asText());
        return types;
    }

    @Test
    public void testEditProducesMessageSequence() throws Exception {
        engine.cellEdited("a", "x = 1\nx");
        assertEquals(List.of("cell_added", "plan_queued", "execution_started", "execution_result"), types());
        JsonNode result = mapper.readTree(sent.get(3));
        assertEquals("1", result.get("output").asText());
    }

    @Test
    public void testSyntaxErrorProducesErrorAndResult() throws Exception {
        engine.addCell("a", 0);
        sent.clear();
        engine.cellEdited("a", "x = ");
        assertEquals(List.of("error", "execution_result"), types());
        assertEquals("a", mapper.readTree(sent.get(0)).get("cell_id").asText());
    }

    @Test
    public void testDeleteAndDuplicate() throws Exception {
        engine.cellEdited("a", "x = 1");
        sent.clear();
        engine.cellEdited("b", "x = 2");
        engine.deleteCell("b");
        assertEquals(List.of("cell_added", "structural_error", "cell_deleted"), types());
    }
}
