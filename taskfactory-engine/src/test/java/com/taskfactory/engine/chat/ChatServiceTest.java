package com.taskfactory.engine.chat;

import com.taskfactory.agent.DeliveryMode;
import com.taskfactory.core.model.ActivityEntry;
import com.taskfactory.core.model.ActivityKind;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.session.ExecutionOutcomeListener;
import com.taskfactory.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ChatServiceTest {

    private EngineFixture engine;
    private Workspace workspace;
    private ChatService chat;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        workspace = engine.workspace("chat");
        chat = engine.chatService;
    }

    @Test
    @DisplayName("A message to a task without a session opens a conversation")
    void startsConversation() {
        Task task = engine.task(workspace, "idea");

        ChatOutcome outcome = chat.send(workspace.id(), task.id(), "what do you think?", List.of());

        assertThat(outcome).isEqualTo(ChatOutcome.STARTED);
        assertThat(engine.agent.latestFor(task.id()).request().purpose()).isEqualTo(SessionPurpose.CONVERSATION);
        assertThat(engine.activityService.forTask(workspace.id(), task.id(), 10))
            .filteredOn(e -> e.kind() == ActivityKind.CHAT_MESSAGE)
            .extracting(ActivityEntry::content)
            .containsExactly("what do you think?");
    }

    @Test
    @DisplayName("A running execution is steered")
    void steersRunningSession() {
        Task ready = engine.readyTask(workspace, "busy");
        Task executing = engine.phaseCoordinator.move(workspace.id(), ready.id(), Phase.EXECUTING, Actor.SYSTEM, null);
        engine.sessionRegistry.start(executing, workspace, ExecutionOutcomeListener.NONE);

        ChatOutcome outcome = chat.send(workspace.id(), ready.id(), "skip the docs", List.of());

        assertThat(outcome).isEqualTo(ChatOutcome.STEERED);
        assertThat(engine.agent.openCount()).isEqualTo(1);
        assertThat(engine.agent.latestFor(ready.id()).modes()).containsExactly(DeliveryMode.STEER);
    }

    @Test
    @DisplayName("An idle conversation gets a follow-up")
    void followsUpIdleSession() {
        Task task = engine.task(workspace, "talk");
        chat.send(workspace.id(), task.id(), "first", List.of());
        engine.agent.latestFor(task.id()).listener().onIdle();

        ChatOutcome outcome = chat.send(workspace.id(), task.id(), "second", List.of());

        assertThat(outcome).isEqualTo(ChatOutcome.FOLLOWED_UP);
        assertThat(engine.agent.latestFor(task.id()).modes()).containsExactly(DeliveryMode.FOLLOW_UP);
    }

    @Test
    @DisplayName("A finished conversation resumes from its transcript and records the reply")
    void resumesFinishedConversation() {
        Task task = engine.task(workspace, "talk");
        chat.send(workspace.id(), task.id(), "first", List.of());
        engine.agent.complete(task.id());

        ChatOutcome outcome = chat.send(workspace.id(), task.id(), "again", List.of());

        assertThat(outcome).isEqualTo(ChatOutcome.RESUMED);
        assertThat(engine.agent.latestFor(task.id()).request().resumeReference()).isEqualTo("transcript-1");
        assertThat(engine.activityService.forTask(workspace.id(), task.id(), 10))
            .filteredOn(e -> e.kind() == ActivityKind.CHAT_MESSAGE)
            .extracting(ActivityEntry::content)
            .containsExactly("first", "done", "again");
    }
}
