package com.taskfactory.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of work on a workspace board.
 * Primary source of truth for where the task sits in the pipeline.
 *
 * Primary Key: (workspaceId, id)
 *
 * Invariants:
 * - phase is always one of the {@link Phase} values
 * - order is unique within (workspaceId, phase) after every move or reorder
 * - version is monotonically increasing; the store bumps it on every write
 */
public record Task(
    // Identity
    String id,
    String workspaceId,

    // Content
    String title,
    String description,
    TaskPriority priority,
    List<AcceptanceCriterion> acceptanceCriteria,
    TaskPlan plan,
    PlanningStatus planningStatus,
    QualityChecks qualityChecks,

    // Board position
    Phase phase,
    long order,

    // Execution
    String sessionReference,
    boolean blocked,
    String blockedReason,
    String executionError,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt,
    Long cycleTimeSeconds,
    Long leadTimeSeconds,

    List<PhaseTransition> history,

    // Versioning (optimistic locking)
    long version
) {
    public Task {
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
        qualityChecks = qualityChecks != null ? qualityChecks : QualityChecks.empty();
        planningStatus = planningStatus != null ? planningStatus : PlanningStatus.NONE;
        priority = priority != null ? priority : TaskPriority.NORMAL;
    }

    /**
     * Create a new task at the end of the backlog.
     */
    public static Task create(
            String workspaceId,
            String id,
            String title,
            String description,
            TaskPriority priority,
            List<AcceptanceCriterion> acceptanceCriteria,
            long order) {
        Instant now = Instant.now();
        return new Task(
            id,
            workspaceId,
            title,
            description,
            priority,
            acceptanceCriteria,
            null,
            PlanningStatus.NONE,
            QualityChecks.empty(),
            Phase.BACKLOG,
            order,
            null,
            false,
            null,
            null,
            now,
            now,
            null,
            null,
            null,
            null,
            List.of(),
            0L
        );
    }

    public boolean hasPlan() {
        return plan != null;
    }

    public boolean hasExecutionError() {
        return executionError != null;
    }

    /**
     * Create a copy placed in {@code target} at {@code targetOrder}, with the
     * timing fields and history that the move implies.
     */
    public Task movedTo(Phase target, long targetOrder, Actor actor, String reason, Instant now) {
        List<PhaseTransition> newHistory = new ArrayList<>(history);
        newHistory.add(new PhaseTransition(phase, target, now, actor, reason));

        Builder builder = toBuilder()
            .phase(target)
            .order(targetOrder)
            .updatedAt(now)
            .history(newHistory);

        if (target == Phase.EXECUTING) {
            if (startedAt == null) {
                builder.startedAt(now);
            }
            builder.executionError(null);
        }
        if (target == Phase.COMPLETE) {
            Instant started = startedAt != null ? startedAt : now;
            builder.completedAt(now)
                .cycleTimeSeconds(Duration.between(started, now).toSeconds())
                .leadTimeSeconds(Duration.between(createdAt, now).toSeconds());
        }
        return builder.build();
    }

    public Task withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String id;
        private String workspaceId;
        private String title;
        private String description;
        private TaskPriority priority;
        private List<AcceptanceCriterion> acceptanceCriteria;
        private TaskPlan plan;
        private PlanningStatus planningStatus;
        private QualityChecks qualityChecks;
        private Phase phase;
        private long order;
        private String sessionReference;
        private boolean blocked;
        private String blockedReason;
        private String executionError;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private Long cycleTimeSeconds;
        private Long leadTimeSeconds;
        private List<PhaseTransition> history;
        private long version;

        public Builder(Task task) {
            this.id = task.id();
            this.workspaceId = task.workspaceId();
            this.title = task.title();
            this.description = task.description();
            this.priority = task.priority();
            this.acceptanceCriteria = task.acceptanceCriteria();
            this.plan = task.plan();
            this.planningStatus = task.planningStatus();
            this.qualityChecks = task.qualityChecks();
            this.phase = task.phase();
            this.order = task.order();
            this.sessionReference = task.sessionReference();
            this.blocked = task.blocked();
            this.blockedReason = task.blockedReason();
            this.executionError = task.executionError();
            this.createdAt = task.createdAt();
            this.updatedAt = task.updatedAt();
            this.startedAt = task.startedAt();
            this.completedAt = task.completedAt();
            this.cycleTimeSeconds = task.cycleTimeSeconds();
            this.leadTimeSeconds = task.leadTimeSeconds();
            this.history = task.history();
            this.version = task.version();
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder acceptanceCriteria(List<AcceptanceCriterion> acceptanceCriteria) {
            this.acceptanceCriteria = acceptanceCriteria;
            return this;
        }

        public Builder plan(TaskPlan plan) {
            this.plan = plan;
            return this;
        }

        public Builder planningStatus(PlanningStatus planningStatus) {
            this.planningStatus = planningStatus;
            return this;
        }

        public Builder qualityChecks(QualityChecks qualityChecks) {
            this.qualityChecks = qualityChecks;
            return this;
        }

        public Builder phase(Phase phase) {
            this.phase = phase;
            return this;
        }

        public Builder order(long order) {
            this.order = order;
            return this;
        }

        public Builder sessionReference(String sessionReference) {
            this.sessionReference = sessionReference;
            return this;
        }

        public Builder blocked(boolean blocked, String blockedReason) {
            this.blocked = blocked;
            this.blockedReason = blocked ? blockedReason : null;
            return this;
        }

        public Builder executionError(String executionError) {
            this.executionError = executionError;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder cycleTimeSeconds(Long cycleTimeSeconds) {
            this.cycleTimeSeconds = cycleTimeSeconds;
            return this;
        }

        public Builder leadTimeSeconds(Long leadTimeSeconds) {
            this.leadTimeSeconds = leadTimeSeconds;
            return this;
        }

        public Builder history(List<PhaseTransition> history) {
            this.history = history;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Task build() {
            return new Task(
                id, workspaceId, title, description, priority, acceptanceCriteria,
                plan, planningStatus, qualityChecks, phase, order, sessionReference,
                blocked, blockedReason, executionError, createdAt, updatedAt,
                startedAt, completedAt, cycleTimeSeconds, leadTimeSeconds,
                history, version
            );
        }
    }
}
