package com.taskfactory.scheduler.health;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.QAQuestion;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.test.EngineFixture;
import com.taskfactory.engine.test.RecordingObserver;
import com.taskfactory.scheduler.QueueCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskFactoryHealthIndicatorTest {

    private EngineFixture engine;
    private QueueCoordinator queues;
    private TaskFactoryHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        queues = new QueueCoordinator(
            engine.phaseCoordinator, engine.taskRepository, engine.workspaceRepository, engine.settingsResolver,
            engine.workspaceLocks, engine.sessionRegistry, engine.activityService, engine.broadcastHub,
            engine.queueKickCoordinator, engine.metrics, engine.properties, engine.clock);
        indicator = new TaskFactoryHealthIndicator(engine.workspaceRepository, engine.taskRepository,
            engine.sessionRegistry, engine.broadcastHub, engine.qaChannel, queues);
    }

    @AfterEach
    void tearDown() {
        queues.shutdown();
    }

    @Test
    void emptyFactoryIsUp() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("workspaces", 0)
            .containsEntry("liveSessions", 0)
            .containsEntry("pendingQuestions", 0)
            .doesNotContainKey("breakerWarning");
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportsBoardAndSessions() {
        Workspace workspace = engine.workspace("health");
        engine.task(workspace, "backlog");
        engine.readyTask(workspace, "running");
        engine.broadcastHub.connect(new RecordingObserver("ui"));
        engine.qaChannel.register(workspace.id(), null, List.of(new QAQuestion("q1", "Which database?", null)));
        queues.start();
        queues.kick(workspace.id());
        assertThat(queues.flush(workspace.id(), Duration.ofSeconds(5))).isTrue();

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("workspaces", 1)
            .containsEntry("liveSessions", 1)
            .containsEntry("observers", 1)
            .containsEntry("pendingQuestions", 1);
        Map<Phase, Integer> tasks = (Map<Phase, Integer>) health.getDetails().get("tasks");
        assertThat(tasks).containsEntry(Phase.BACKLOG, 1).containsEntry(Phase.EXECUTING, 1);
        Map<String, Long> sessions = (Map<String, Long>) health.getDetails().get("sessionsByPurpose");
        assertThat(sessions).containsExactly(entry("execution", 1L));
    }

    @Test
    void openBreakerIsReportedButStaysUp() {
        engine.properties.getWorkflow().setExecutingLimit(null);
        Workspace workspace = engine.workspace("breaker");
        queues.start();
        for (int i = 0; i < 3; i++) {
            Task task = engine.readyTask(workspace, "t" + i);
            assertThat(queues.flush(workspace.id(), Duration.ofSeconds(5))).isTrue();
            engine.agent.fail(task.id(), "insufficient credit");
            assertThat(queues.flush(workspace.id(), Duration.ofSeconds(5))).isTrue();
        }

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKey("breakerWarning");
        @SuppressWarnings("unchecked")
        Map<String, ?> openBreakers = (Map<String, ?>) health.getDetails().get("openBreakers");
        assertThat(openBreakers).containsKey(workspace.id());
    }
}
