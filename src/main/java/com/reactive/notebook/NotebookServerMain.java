package com.reactive.notebook;

import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactive.notebook.io.EngineConfig;
import com.reactive.notebook.web.CommandDispatcher;
import com.reactive.notebook.web.MessageCodec;
import com.reactive.notebook.web.NotebookServer;
import com.reactive.notebook.web.WebsocketNotebookListener;

/**
 * Runs a notebook behind the WebSocket server.
 *
 * <p>
 * Usage: {@code NotebookServerMain [config.json]}. Without an argument the
 * file {@code notebook.json} in the working directory is used if present.
 */
public final class NotebookServerMain {
    private static final Logger log = LogManager.getLogger(NotebookServerMain.class);

    private NotebookServerMain() {
    }

    public static void main(String[] args) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        EngineConfig config = EngineConfig.load(Path.of(args.length > 0 ? args[0] : "notebook.json"), mapper);

        ReactiveNotebook notebook = new ReactiveNotebook(config);
        notebook.attachStore(mapper);

        MessageCodec codec = new MessageCodec(mapper);
        CommandDispatcher dispatcher = new CommandDispatcher(notebook.session(), codec);
        NotebookServer server = new NotebookServer(
                () -> codec.notebookState(config.getNotebookName(), notebook.cells()),
                dispatcher::dispatch);
        notebook.addListener(new WebsocketNotebookListener(notebook.engine(), codec, server::broadcast));
        server.start(config.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.stop();
            notebook.close();
        }, "notebook-shutdown"));
        log.info("Notebook {} ready on port {}", config.getNotebookName(), server.port());
    }
}
