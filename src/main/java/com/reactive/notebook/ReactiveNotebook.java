package com.reactive.notebook;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactive.notebook.api.NotebookListener;
import com.reactive.notebook.disruptor.NotebookSession;
import com.reactive.notebook.engine.Cell;
import com.reactive.notebook.engine.ReactiveEngine;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.io.NotebookAutosave;
import com.reactive.notebook.io.NotebookStore;
import com.reactive.notebook.kernel.WorkerKernel;
import com.reactive.notebook.util.LoggingNotebookListener;
import com.reactive.notebook.util.NotebookExplain;

/**
 * A high-level wrapper that assembles one notebook: kernel, engine, session
 * and (optionally) persistence.
 * <p>
 * This class handles:
 * <ul>
 * <li>Creating the {@link WorkerKernel} and {@link ReactiveEngine} from an
 * {@link EngineConfig}</li>
 * <li>Running execution on a {@link NotebookSession} thread</li>
 * <li>Restoring the notebook from a {@link NotebookStore} and saving it after
 * every change</li>
 * </ul>
 */
public class ReactiveNotebook implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ReactiveNotebook.class);

    private final EngineConfig config;
    private final ReactiveEngine engine;
    private final NotebookSession session;
    private NotebookAutosave autosave;

    public ReactiveNotebook(EngineConfig config) {
        this.config = config;
        this.engine = new ReactiveEngine(config, new WorkerKernel(config));
        engine.addListener(new LoggingNotebookListener());
        this.session = new NotebookSession(engine);
    }

    /**
     * Loads the configured notebook from the store directory and saves it
     * after every change from then on.
     *
     * @return the number of cells restored
     */
    public int attachStore(ObjectMapper mapper) throws IOException {
        if (autosave != null)
            throw new IllegalStateException("Store already attached");
        NotebookStore store = new NotebookStore(Path.of(config.getNotebooksDirectory()), mapper);
        int restored = store.restore(config.getNotebookName(), engine);
        autosave = new NotebookAutosave(store, config.getNotebookName(), engine);
        engine.addListener(autosave);
        log.info("Notebook {} attached with {} cells", config.getNotebookName(), restored);
        return restored;
    }

    public void addListener(NotebookListener listener) {
        engine.addListener(listener);
    }

    public boolean edit(String cellId, String source) {
        return session.edit(cellId, source);
    }

    public boolean execute(String cellId) {
        return session.execute(cellId);
    }

    public boolean executeAll() {
        return session.executeAll();
    }

    public String addCell(int position) {
        return engine.addCell(position);
    }

    public boolean deleteCell(String cellId) {
        return engine.deleteCell(cellId);
    }

    public String interrupt() {
        return session.interrupt();
    }

    public void reset() {
        session.reset();
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return session.awaitIdle(timeout);
    }

    public List<Cell> cells() {
        return engine.cellsInOrder();
    }

    public NotebookExplain explain() {
        return new NotebookExplain(engine);
    }

    public ReactiveEngine engine() {
        return engine;
    }

    public NotebookSession session() {
        return session;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public void close() {
        session.close();
        engine.close();
        if (autosave != null)
            autosave.save();
    }
}
