package com.reactive.notebook.io;

import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.ObjectMapper;

public class EngineConfigTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() throws Exception {
        EngineConfig config = EngineConfig.load(folder.getRoot().toPath().resolve("absent.json"), new ObjectMapper());
        assertEquals(Duration.ofSeconds(5), config.getTimeout());
        assertEquals(100, config.getMaxRows());
        assertEquals(1000, config.getMaxArrayElements());
        assertEquals(8000, config.getPort());
    }

    @Test
    public void testFileOverridesSubset() throws Exception {
        Path file = folder.getRoot().toPath().resolve("notebook.json");
        Files.writeString(file, "{\"timeoutMillis\": 250, \"port\": 9001, \"unknownKey\": 1}");
        EngineConfig config = EngineConfig.load(file, new ObjectMapper());

        assertEquals(Duration.ofMillis(250), config.getTimeout());
        assertEquals(9001, config.getPort());
        assertEquals("default", config.getNotebookName());
    }
}
