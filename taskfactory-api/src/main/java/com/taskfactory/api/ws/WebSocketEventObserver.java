package com.taskfactory.api.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfactory.core.model.WorkspaceEvent;
import com.taskfactory.engine.broadcast.EventObserver;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes workspace events to one WebSocket connection.
 */
public class WebSocketEventObserver implements EventObserver {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketEventObserver(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void deliver(WorkspaceEvent event) throws IOException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.type().wireName());
        message.put("workspaceId", event.workspaceId());
        message.put("sequence", event.sequence());
        message.put("taskId", event.taskId());
        message.put("payload", event.payload());
        message.put("timestamp", event.timestamp());
        send(message);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    void send(Map<String, Object> message) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }
}
