package com.taskfactory.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective WIP limits and automation triggers for a workspace.
 *
 * A phase missing from {@code wipLimits} is unlimited. A limit of zero means
 * the phase admits nothing.
 */
public record WorkflowSettings(
    Map<Phase, Integer> wipLimits,
    boolean promoteOnPlanReady,
    boolean autoExecute
) {
    public static final int DEFAULT_READY_LIMIT = 25;
    public static final int DEFAULT_EXECUTING_LIMIT = 1;

    public WorkflowSettings {
        EnumMap<Phase, Integer> copy = new EnumMap<>(Phase.class);
        if (wipLimits != null) {
            wipLimits.forEach((phase, limit) -> {
                if (limit != null) {
                    copy.put(phase, limit);
                }
            });
        }
        wipLimits = Collections.unmodifiableMap(copy);
    }

    /**
     * Built-in global defaults: ready 25, executing 1, everything else unlimited,
     * promotion off, auto-execute on.
     */
    public static WorkflowSettings defaults() {
        Map<Phase, Integer> limits = new EnumMap<>(Phase.class);
        limits.put(Phase.READY, DEFAULT_READY_LIMIT);
        limits.put(Phase.EXECUTING, DEFAULT_EXECUTING_LIMIT);
        return new WorkflowSettings(limits, false, true);
    }

    /**
     * Limit for {@code phase}, or null when unlimited.
     */
    public Integer limitFor(Phase phase) {
        return wipLimits.get(phase);
    }

    /**
     * Resolve effective settings: workspace value if present, else this (global) value.
     * Auto-execute falls back to the workspace's queue-processing flag before
     * the global default.
     */
    public WorkflowSettings resolve(WorkspaceConfig config) {
        if (config == null) {
            return this;
        }
        Map<Phase, Integer> limits = new EnumMap<>(Phase.class);
        limits.putAll(wipLimits);
        limits.putAll(config.wipLimits());

        boolean promote = config.promoteOnPlanReady() != null
            ? config.promoteOnPlanReady()
            : promoteOnPlanReady;

        boolean execute;
        if (config.autoExecute() != null) {
            execute = config.autoExecute();
        } else if (config.queueProcessingEnabled() != null) {
            execute = config.queueProcessingEnabled();
        } else {
            execute = autoExecute;
        }
        return new WorkflowSettings(limits, promote, execute);
    }
}
