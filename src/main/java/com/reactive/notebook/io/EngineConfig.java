package com.reactive.notebook.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Engine and server settings. Every field has a default; a JSON file may
 * override any subset of them.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    /** Wall-clock limit for one cell run. */
    private long timeoutMillis = 5_000;
    /** How long a cancelled worker may take to stop before it is abandoned. */
    private long interruptGraceMillis = 1_000;
    /** Row cap for table and column rich output. */
    private int maxRows = 100;
    /** Element cap for array rich output. */
    private int maxArrayElements = 1_000;
    private int maxCallDepth = 200;
    private int port = 8000;
    private String notebooksDirectory = "notebooks";
    private String notebookName = "default";

    @JsonIgnore
    public Duration getTimeout() {
        return Duration.ofMillis(timeoutMillis);
    }

    @JsonIgnore
    public Duration getInterruptGrace() {
        return Duration.ofMillis(interruptGraceMillis);
    }

    /**
     * Overlays the JSON file onto the defaults. A missing file yields the
     * defaults.
     */
    public static EngineConfig load(Path file, ObjectMapper mapper) throws IOException {
        EngineConfig config = new EngineConfig();
        if (file == null || !Files.exists(file)) {
            log.info("No engine config at {}, using defaults", file);
            return config;
        }
        log.info("Loading engine config from {}", file);
        return mapper.readerForUpdating(config).readValue(file.toFile());
    }
}
