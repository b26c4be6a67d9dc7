package com.taskfactory.api.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfactory.core.exception.TaskFactoryException;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.chat.ChatOutcome;
import com.taskfactory.engine.chat.ChatService;
import com.taskfactory.engine.logging.LoggingContext;
import com.taskfactory.engine.service.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observer transport. Each connection becomes an {@link WebSocketEventObserver}
 * on the broadcast hub and chooses its workspaces with subscribe messages.
 *
 * Client messages:
 * - {"type":"subscribe","workspaceId":...}
 * - {"type":"unsubscribe","workspaceId":...}
 * - {"type":"activity:send","workspaceId":...,"taskId":...,"content":...}
 * - {"type":"ping"}
 */
@Component
public class TaskFactoryWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskFactoryWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final BroadcastHub broadcastHub;
    private final WorkspaceService workspaceService;
    private final ChatService chatService;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketEventObserver> observers = new ConcurrentHashMap<>();

    public TaskFactoryWebSocketHandler(
            BroadcastHub broadcastHub,
            WorkspaceService workspaceService,
            ChatService chatService,
            ObjectMapper objectMapper) {
        this.broadcastHub = broadcastHub;
        this.workspaceService = workspaceService;
        this.chatService = chatService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // Hub deliveries and acks come from different threads.
        WebSocketSession concurrent =
            new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        WebSocketEventObserver observer = new WebSocketEventObserver(concurrent, objectMapper);
        observers.put(session.getId(), observer);
        broadcastHub.connect(observer);
        try (var ctx = LoggingContext.forObserver(session.getId())) {
            log.debug("Observer connected from {}", session.getRemoteAddress());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        observers.remove(session.getId());
        broadcastHub.disconnect(session.getId());
        try (var ctx = LoggingContext.forObserver(session.getId())) {
            log.debug("Observer disconnected: {}", status);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        WebSocketEventObserver observer = observers.get(session.getId());
        if (observer == null) {
            return;
        }
        try (var ctx = LoggingContext.forObserver(session.getId())) {
            JsonNode node;
            try {
                node = objectMapper.readTree(message.getPayload());
            } catch (JsonProcessingException e) {
                reply(observer, error("Malformed message"));
                return;
            }
            String type = node.path("type").asText("");
            String workspaceId = node.path("workspaceId").asText(null);

            try {
                switch (type) {
                    case "subscribe" -> {
                        workspaceService.getWorkspace(requireWorkspaceId(workspaceId));
                        broadcastHub.subscribe(session.getId(), workspaceId);
                        reply(observer, ack("subscribed", workspaceId));
                    }
                    case "unsubscribe" -> {
                        broadcastHub.unsubscribe(session.getId(), requireWorkspaceId(workspaceId));
                        reply(observer, ack("unsubscribed", workspaceId));
                    }
                    case "activity:send" -> sendActivity(node, requireWorkspaceId(workspaceId));
                    case "ping" -> reply(observer, Map.of("type", "pong"));
                    default -> reply(observer, error("Unknown message type: " + type));
                }
            } catch (TaskFactoryException | IllegalArgumentException e) {
                log.debug("Rejected {} message: {}", type, e.getMessage());
                reply(observer, error(e.getMessage()));
            }
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        try (var ctx = LoggingContext.forObserver(session.getId())) {
            log.warn("Transport error: {}", exception.getMessage());
        }
    }

    public int connectionCount() {
        return observers.size();
    }

    // ========== Internal Methods ==========

    private void sendActivity(JsonNode node, String workspaceId) {
        String taskId = node.path("taskId").asText(null);
        String content = node.path("content").asText("");
        if (taskId == null || content.isBlank()) {
            throw new IllegalArgumentException("activity:send needs taskId and content");
        }
        ChatOutcome outcome = chatService.send(workspaceId, taskId, content, List.of());
        log.debug("Chat message for task {} {}", taskId, outcome);
    }

    private static String requireWorkspaceId(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        return workspaceId;
    }

    private static Map<String, Object> ack(String type, String workspaceId) {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("type", type);
        ack.put("workspaceId", workspaceId);
        return ack;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", "error");
        error.put("message", message);
        return error;
    }

    private void reply(WebSocketEventObserver observer, Map<String, Object> message) throws IOException {
        observer.send(message);
    }
}
