package com.taskfactory.api.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfactory.core.model.ActivityEntry;
import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskFactoryWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

    private EngineFixture engine;
    private TaskFactoryWebSocketHandler handler;
    private WebSocketSession session;
    private Workspace workspace;

    @BeforeEach
    void setUp() throws Exception {
        engine = new EngineFixture();
        handler = new TaskFactoryWebSocketHandler(
            engine.broadcastHub, engine.workspaceCoordinator, engine.chatService, objectMapper);
        workspace = engine.workspace("demo");

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("observer-1");
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            WebSocketMessage<?> message = invocation.getArgument(0);
            sent.add(objectMapper.readTree((String) message.getPayload()));
            return null;
        }).when(session).sendMessage(any());

        handler.afterConnectionEstablished(session);
    }

    @Test
    @DisplayName("Subscribed observers receive workspace events")
    void subscribeThenReceiveEvents() throws Exception {
        handle("{\"type\":\"subscribe\",\"workspaceId\":\"" + workspace.id() + "\"}");
        Task task = engine.task(workspace, "Add login");

        assertThat(sent.get(0).path("type").asText()).isEqualTo("subscribed");
        assertThat(sent.get(0).path("workspaceId").asText()).isEqualTo(workspace.id());

        JsonNode created = sent.stream()
            .filter(node -> node.path("type").asText().equals("task:created"))
            .findFirst()
            .orElseThrow();
        assertThat(created.path("taskId").asText()).isEqualTo(task.id());
        assertThat(created.path("workspaceId").asText()).isEqualTo(workspace.id());
        assertThat(created.path("sequence").asLong()).isPositive();
    }

    @Test
    @DisplayName("Without a subscription no events are delivered")
    void noSubscriptionNoEvents() throws Exception {
        engine.task(workspace, "Add login");

        assertThat(sent).isEmpty();
        assertThat(handler.connectionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Subscribing to an unknown workspace is an error")
    void subscribeUnknownWorkspace() throws Exception {
        handle("{\"type\":\"subscribe\",\"workspaceId\":\"missing\"}");

        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).path("type").asText()).isEqualTo("error");
        assertThat(sent.get(0).path("message").asText()).contains("missing");
        assertThat(engine.broadcastHub.subscriptionsOf("observer-1")).isEmpty();
    }

    @Test
    @DisplayName("Ping is answered with pong")
    void pingPong() throws Exception {
        handle("{\"type\":\"ping\"}");

        assertThat(sent).extracting(node -> node.path("type").asText()).containsExactly("pong");
    }

    @Test
    @DisplayName("Malformed and unknown messages get an error reply")
    void badMessages() throws Exception {
        handle("not json");
        handle("{\"type\":\"launch\"}");

        assertThat(sent).extracting(node -> node.path("message").asText())
            .containsExactly("Malformed message", "Unknown message type: launch");
    }

    @Test
    @DisplayName("activity:send chats with the task's agent")
    void activitySend() throws Exception {
        Task task = engine.task(workspace, "Add login");

        handle("{\"type\":\"activity:send\",\"workspaceId\":\"" + workspace.id()
            + "\",\"taskId\":\"" + task.id() + "\",\"content\":\"Please add tests\"}");

        assertThat(engine.activityService.forTask(workspace.id(), task.id(), 50))
            .extracting(ActivityEntry::content)
            .contains("Please add tests");
        assertThat(engine.agent.latestFor(task.id()).request().purpose()).isEqualTo(SessionPurpose.CONVERSATION);
        assertThat(sent).isEmpty();
    }

    @Test
    @DisplayName("activity:send without content is rejected")
    void activitySendWithoutContent() throws Exception {
        handle("{\"type\":\"activity:send\",\"workspaceId\":\"" + workspace.id() + "\",\"taskId\":\"T\"}");

        assertThat(sent.get(0).path("type").asText()).isEqualTo("error");
    }

    @Test
    @DisplayName("Closing the connection removes the observer from the hub")
    void closeDisconnects() throws Exception {
        handle("{\"type\":\"subscribe\",\"workspaceId\":\"" + workspace.id() + "\"}");

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(handler.connectionCount()).isZero();
        assertThat(engine.broadcastHub.connectedObservers()).isZero();
        assertThat(engine.broadcastHub.subscriberCount(workspace.id())).isZero();
    }

    private void handle(String payload) throws Exception {
        handler.handleMessage(session, new TextMessage(payload));
    }
}
