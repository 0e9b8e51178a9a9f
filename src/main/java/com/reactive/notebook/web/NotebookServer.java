package com.reactive.notebook.web;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.reactive.notebook.util.ErrorRateLimiter;

import io.javalin.Javalin;
import io.javalin.websocket.WsContext;

/**
 * Hosts the notebook WebSocket endpoint ({@code /ws}) and a read-only state
 * endpoint ({@code GET /api/notebook}).
 *
 * <p>
 * Each client receives the current notebook state on connect. Incoming text
 * frames go to the command handler; a non-null reply is sent back to that
 * client only. Engine events are pushed to every client through
 * {@link #broadcast(String)}.
 */
public class NotebookServer {
    private static final Logger log = LogManager.getLogger(NotebookServer.class);

    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private final Supplier<String> stateSupplier;
    private final Function<String, String> commandHandler;
    private final ErrorRateLimiter sendErrors = new ErrorRateLimiter(log, 1000);
    private Javalin app;

    /**
     * @param stateSupplier  builds the {@code notebook_state} message
     * @param commandHandler handles one inbound frame, returning an optional reply
     */
    public NotebookServer(Supplier<String> stateSupplier, Function<String, String> commandHandler) {
        this.stateSupplier = stateSupplier;
        this.commandHandler = commandHandler;
    }

    /**
     * Starts the server.
     *
     * @param port the port to listen on, {@code 0} for any free port
     */
    public void start(int port) {
        if (app != null)
            throw new IllegalStateException("Server already started");
        log.info("Starting notebook server on port {}", port);

        app = Javalin.create().start(port);

        app.get("/api/notebook", ctx -> {
            ctx.contentType("application/json");
            ctx.result(stateSupplier.get());
        });

        app.ws("/ws", ws -> {
            ws.onConnect(ctx -> {
                log.info("WebSocket client connected: {}", ctx.sessionId());
                sessions.add(ctx);
                ctx.send(stateSupplier.get());
            });
            ws.onMessage(ctx -> {
                String reply = commandHandler.apply(ctx.message());
                if (reply != null && ctx.session.isOpen())
                    ctx.send(reply);
            });
            ws.onClose(ctx -> {
                log.info("WebSocket client disconnected: {}", ctx.sessionId());
                sessions.remove(ctx);
            });
            ws.onError(ctx -> {
                log.error("WebSocket client error: {}", ctx.sessionId(), ctx.error());
                sessions.remove(ctx);
            });
        });
    }

    /** The bound port, useful after {@code start(0)}. */
    public int port() {
        if (app == null)
            throw new IllegalStateException("Server not started");
        return app.port();
    }

    public int clientCount() {
        return sessions.size();
    }

    /**
     * Sends a message to every connected client. A failing client is logged
     * and dropped; the others still receive the message.
     */
    public void broadcast(String jsonPayload) {
        if (sessions.isEmpty())
            return;
        for (WsContext ctx : sessions) {
            if (!ctx.session.isOpen()) {
                sessions.remove(ctx);
                continue;
            }
            try {
                ctx.send(jsonPayload);
            } catch (RuntimeException e) {
                sendErrors.log("Broadcast to " + ctx.sessionId() + " failed", e);
                sessions.remove(ctx);
            }
        }
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            sessions.clear();
            log.info("Notebook server stopped");
        }
    }
}
