package com.taskfactory.engine.session;

import com.taskfactory.agent.AgentException;
import com.taskfactory.agent.DeliveryMode;
import com.taskfactory.agent.ExecutionResult;
import com.taskfactory.core.exception.AlreadyRunningException;
import com.taskfactory.core.exception.ExecutionFailedException;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.SessionStatus;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.test.EngineFixture;
import com.taskfactory.engine.test.FakeExecutionCollaborator.FakeHandle;
import com.taskfactory.engine.test.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class SessionRegistryTest {

    private EngineFixture engine;
    private Workspace workspace;
    private Task task;
    private SessionRegistry registry;
    private List<ExecutionResult> outcomes;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        registry = engine.sessionRegistry;
        workspace = engine.workspace("sessions");
        Task ready = engine.readyTask(workspace, "work");
        task = engine.phaseCoordinator.move(workspace.id(), ready.id(), Phase.EXECUTING, Actor.SYSTEM, null);
        outcomes = new CopyOnWriteArrayList<>();
    }

    private SessionSnapshot startExecution() {
        return registry.start(task, workspace, (snapshot, result) -> outcomes.add(result));
    }

    @Nested
    @DisplayName("Starting sessions")
    class Starting {

        @Test
        @DisplayName("A started session is running and its transcript reference is persisted")
        void startRecordsSession() {
            SessionSnapshot snapshot = startExecution();

            assertThat(snapshot.status()).isEqualTo(SessionStatus.RUNNING);
            assertThat(snapshot.sessionId()).isEqualTo("session-1");
            assertThat(snapshot.purpose()).isEqualTo(SessionPurpose.EXECUTION);
            assertThat(registry.hasLiveSession(workspace.id(), task.id())).isTrue();
            assertThat(engine.reload(task).sessionReference()).isEqualTo("transcript-1");
            assertThat(registry.activeSessions()).extracting(SessionSnapshot::taskId).containsExactly(task.id());
        }

        @Test
        @DisplayName("A second start for the same task is refused")
        void secondStartRefused() {
            startExecution();

            assertThatThrownBy(this::startAgain).isInstanceOf(AlreadyRunningException.class);
            assertThat(engine.agent.openCount()).isEqualTo(1);
        }

        private void startAgain() {
            startExecution();
        }

        @Test
        @DisplayName("A refused open leaves no entry behind")
        void failedOpenLeavesNoEntry() {
            engine.agent.failNextOpen(AgentException.rejected("quota exceeded"));

            assertThatThrownBy(SessionRegistryTest.this::startExecution)
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("quota exceeded");
            assertThat(registry.liveSessionCount()).isZero();

            startExecution();
            assertThat(registry.liveSessionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A shut down registry refuses new sessions")
        void shutdownRefuses() {
            startExecution();
            registry.shutdown();

            assertThat(engine.agent.latestFor(task.id()).isStopped()).isTrue();
            assertThatThrownBy(SessionRegistryTest.this::startExecution)
                .isInstanceOf(ExecutionFailedException.class);
        }
    }

    @Nested
    @DisplayName("Stopping sessions")
    class Stopping {

        @Test
        @DisplayName("Stop is idempotent")
        void stopIdempotent() {
            startExecution();

            assertThat(registry.stop(workspace.id(), task.id())).isTrue();
            assertThat(registry.stop(workspace.id(), task.id())).isFalse();
            assertThat(registry.status(workspace.id(), task.id())).isEmpty();
        }

        @Test
        @DisplayName("A completion from a stopped attempt is ignored")
        void staleCompletionIgnored() {
            startExecution();
            FakeHandle first = engine.agent.latestFor(task.id());
            registry.stop(workspace.id(), task.id());
            startExecution();

            first.listener().onCompleted(ExecutionResult.failed("late"));

            assertThat(outcomes).isEmpty();
            assertThat(registry.hasLiveSession(workspace.id(), task.id())).isTrue();
            assertThat(registry.snapshot(workspace.id(), task.id()).orElseThrow().sessionId()).isEqualTo("session-2");
        }

        @Test
        @DisplayName("The latest attempt is remembered after it ends, until another one opens")
        void latestAttemptOutlivesSession() {
            SessionSnapshot first = startExecution();
            engine.agent.complete(task.id());
            assertThat(registry.isLatestAttempt(first)).isTrue();

            engine.agent.failNextOpen(AgentException.rejected("runner busy"));
            assertThatThrownBy(() -> startExecution()).isInstanceOf(ExecutionFailedException.class);
            assertThat(registry.isLatestAttempt(first)).isTrue();

            SessionSnapshot second = startExecution();
            assertThat(registry.isLatestAttempt(first)).isFalse();
            assertThat(registry.isLatestAttempt(second)).isTrue();
        }

        @Test
        @DisplayName("Stopping a workspace stops only its sessions")
        void stopWorkspace() {
            Workspace other = engine.workspace("other");
            Task ready = engine.readyTask(other, "elsewhere");
            Task elsewhere = engine.phaseCoordinator.move(other.id(), ready.id(), Phase.EXECUTING, Actor.SYSTEM, null);
            startExecution();
            registry.start(elsewhere, other, ExecutionOutcomeListener.NONE);

            assertThat(registry.stopWorkspace(workspace.id())).isEqualTo(1);
            assertThat(registry.liveTaskIds(other.id())).containsExactly(elsewhere.id());
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        @DisplayName("The outcome reaches the listener once and frees the slot")
        void outcomeDelivered() {
            RecordingObserver observer = new RecordingObserver("ui");
            engine.broadcastHub.connect(observer);
            engine.broadcastHub.subscribe("ui", workspace.id());
            startExecution();

            engine.agent.fail(task.id(), "401 unauthorized");
            engine.agent.complete(task.id());

            assertThat(outcomes).hasSize(1);
            assertThat(outcomes.get(0).errorMessage()).isEqualTo("401 unauthorized");
            assertThat(registry.liveSessionCount()).isZero();
            assertThat(observer.eventsOfType(EventType.AGENT_EXECUTION_STATUS))
                .extracting(e -> e.payload().get("status"))
                .containsExactly("running", "error");
        }
    }

    @Nested
    @DisplayName("Messages")
    class Messages {

        @Test
        @DisplayName("Steering reaches a running session")
        void steerRunning() {
            startExecution();

            assertThat(registry.steer(workspace.id(), task.id(), "use postgres", List.of())).isTrue();
            assertThat(engine.agent.latestFor(task.id()).modes()).containsExactly(DeliveryMode.STEER);
        }

        @Test
        @DisplayName("Follow-up needs an idle session and resumes it")
        void followUpIdle() {
            startExecution();
            assertThat(registry.followUp(workspace.id(), task.id(), "next", List.of())).isFalse();

            engine.agent.latestFor(task.id()).listener().onIdle();
            assertThat(registry.steer(workspace.id(), task.id(), "x", List.of())).isFalse();
            assertThat(registry.followUp(workspace.id(), task.id(), "next", List.of())).isTrue();

            assertThat(registry.status(workspace.id(), task.id())).contains(SessionStatus.RUNNING);
            assertThat(engine.agent.latestFor(task.id()).delivered()).containsExactly("next");
        }

        @Test
        @DisplayName("Without a session a conversation continues the task's transcript")
        void resumeOpensConversation() {
            startExecution();
            engine.agent.complete(task.id());
            Task withReference = engine.reload(task);

            SessionSnapshot snapshot = registry.resumeOrStart(withReference, workspace, "why?", List.of(),
                ExecutionOutcomeListener.NONE);

            assertThat(snapshot.purpose()).isEqualTo(SessionPurpose.CONVERSATION);
            FakeHandle handle = engine.agent.latestFor(task.id());
            assertThat(handle.request().resumeReference()).isEqualTo("transcript-1");
            assertThat(handle.request().initialMessage()).isEqualTo("why?");
        }
    }
}
