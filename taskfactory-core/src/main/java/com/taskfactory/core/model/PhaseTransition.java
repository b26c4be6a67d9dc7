package com.taskfactory.core.model;

import java.time.Instant;

/**
 * One entry of a task's phase history.
 */
public record PhaseTransition(
    Phase from,
    Phase to,
    Instant timestamp,
    Actor actor,
    String reason
) {
}
