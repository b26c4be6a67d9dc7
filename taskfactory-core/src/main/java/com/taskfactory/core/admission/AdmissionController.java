package com.taskfactory.core.admission;

import com.taskfactory.core.exception.ConfigurationValidationException;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.WorkflowSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WIP limiter. Pure function of (settings, phase populations, move) with no state.
 *
 * The check only applies when a move would grow the target phase: a task that
 * already sits in the target phase is always admitted.
 */
public final class AdmissionController {

    private AdmissionController() {
    }

    /**
     * Decide whether a task currently in {@code currentPhase} may enter {@code targetPhase}.
     *
     * @param settings resolved settings for the workspace
     * @param counts number of tasks per phase; missing phases count as zero
     * @param currentPhase phase the task is in now, or null for a new task
     * @param targetPhase phase the task would enter
     */
    public static AdmissionDecision check(
            WorkflowSettings settings,
            Map<Phase, Integer> counts,
            Phase currentPhase,
            Phase targetPhase) {
        int current = counts.getOrDefault(targetPhase, 0);
        Integer limit = settings.limitFor(targetPhase);

        if (targetPhase == currentPhase || limit == null) {
            return AdmissionDecision.allow(targetPhase, limit, current);
        }
        if (current >= limit) {
            return AdmissionDecision.deny(targetPhase, limit, current);
        }
        return AdmissionDecision.allow(targetPhase, limit, current);
    }

    /**
     * Free slots in {@code phase}, or {@link Integer#MAX_VALUE} when unlimited.
     */
    public static int remainingCapacity(WorkflowSettings settings, Map<Phase, Integer> counts, Phase phase) {
        Integer limit = settings.limitFor(phase);
        if (limit == null) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, limit - counts.getOrDefault(phase, 0));
    }

    /**
     * Validate a set of limits before it is stored.
     *
     * @throws ConfigurationValidationException if any limit is negative
     */
    public static void validateLimits(Map<Phase, Integer> limits) {
        List<String> errors = new ArrayList<>();
        limits.forEach((phase, limit) -> {
            if (limit != null && limit < 0) {
                errors.add(String.format("WIP limit for %s must be >= 0, got %d", phase, limit));
            }
        });
        if (!errors.isEmpty()) {
            throw new ConfigurationValidationException(errors);
        }
    }
}
