package com.reactive.notebook.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.UUID;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reactive.notebook.engine.Cell;
import com.reactive.notebook.engine.ReactiveEngine;

import lombok.extern.log4j.Log4j2;

/**
 * Saves and loads notebooks as JSON documents, one file per notebook under a
 * directory.
 */
@Log4j2
public final class NotebookStore {
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;
    private final ObjectMapper mapper;

    public NotebookStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @throws IllegalArgumentException if the name is not a plain file name
     */
    public Path path(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches() || name.startsWith("."))
            throw new IllegalArgumentException("Invalid notebook name: " + name);
        return directory.resolve(name + ".json");
    }

    /** The stored document, or an empty one if the notebook was never saved. */
    public NotebookDocument load(String name) throws IOException {
        Path file = path(name);
        if (!Files.exists(file)) {
            log.debug("Notebook {} not found at {}, starting empty", name, file);
            return new NotebookDocument();
        }
        NotebookDocument doc = mapper.readValue(file.toFile(), NotebookDocument.class);
        if (doc.getCells() == null)
            doc.setCells(new ArrayList<>());
        log.info("Loaded notebook {} ({} cells)", name, doc.getCells().size());
        return doc;
    }

    /** Writes a document through a temporary file so a crash never leaves half a notebook. */
    public void save(String name, NotebookDocument doc) throws IOException {
        Path file = path(name);
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, name, ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Saved notebook {} ({} cells) to {}", name, doc.getCells().size(), file);
    }

    /** Captures the engine's cells in display order. */
    public static NotebookDocument snapshot(ReactiveEngine engine) {
        NotebookDocument doc = new NotebookDocument();
        for (Cell cell : engine.cellsInOrder())
            doc.getCells().add(NotebookDocument.CellDef.of(cell));
        return doc;
    }

    public void save(String name, ReactiveEngine engine) throws IOException {
        save(name, snapshot(engine));
    }

    /**
     * Rehydrates a stored notebook into an engine without executing anything.
     *
     * @return the number of cells restored
     */
    public int restore(String name, ReactiveEngine engine) throws IOException {
        NotebookDocument doc = load(name);
        for (NotebookDocument.CellDef def : doc.getCells()) {
            String id = def.getId() != null ? def.getId() : UUID.randomUUID().toString();
            engine.restoreCell(id, def.getCode(), def.getOutput(), def.getRichOutput(), def.getError(),
                    def.getStatus());
        }
        return doc.getCells().size();
    }
}
