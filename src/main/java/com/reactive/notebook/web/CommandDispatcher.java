package com.reactive.notebook.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.reactive.notebook.disruptor.NotebookSession;

import lombok.extern.log4j.Log4j2;

/**
 * Applies client commands to a {@link NotebookSession}. Results reach clients
 * through the engine's listeners; the dispatcher only answers malformed or
 * unknown commands, with an {@code error} message for the sender.
 */
@Log4j2
public final class CommandDispatcher {
    private final NotebookSession session;
    private final MessageCodec codec;

    public CommandDispatcher(NotebookSession session, MessageCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    /**
     * @return a reply for the sender only, or {@code null}
     */
    public String dispatch(String text) {
        InboundMessage message;
        try {
            message = codec.decode(text);
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed message: {}", e.getOriginalMessage());
            return codec.error(null, "Invalid message: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return codec.error(null, "Invalid message: " + e.getMessage());
        }
        String type = message.getType();
        if (type == null)
            return codec.error(null, "Message has no type");
        try {
            return switch (type) {
                case "edit_cell", "cell_updated" -> {
                    session.edit(requireCell(message), message.getCode() == null ? "" : message.getCode());
                    yield null;
                }
                case "execute_cell" -> {
                    session.execute(requireCell(message));
                    yield null;
                }
                case "execute_all" -> {
                    session.executeAll();
                    yield null;
                }
                case "add_cell" -> {
                    Integer position = message.getPosition();
                    session.engine().addCell(position == null ? Integer.MAX_VALUE : position);
                    yield null;
                }
                case "delete_cell" -> {
                    String cellId = requireCell(message);
                    yield session.engine().deleteCell(cellId) ? null : codec.error(cellId, "Unknown cell: " + cellId);
                }
                case "interrupt" -> {
                    session.interrupt();
                    yield null;
                }
                case "reset" -> {
                    session.reset();
                    yield null;
                }
                default -> codec.error(message.getCellId(), "Unknown message type: " + type);
            };
        } catch (IllegalArgumentException e) {
            log.debug("Rejected {} command: {}", type, e.getMessage());
            return codec.error(message.getCellId(), e.getMessage());
        }
    }

    private static String requireCell(InboundMessage message) {
        if (message.getCellId() == null || message.getCellId().isEmpty())
            throw new IllegalArgumentException(message.getType() + " requires cell_id");
        return message.getCellId();
    }
}
