package com.taskfactory.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-workspace overrides. Every field is optional; anything left unset
 * falls back to the global {@link WorkflowSettings}.
 */
public record WorkspaceConfig(
    Map<Phase, Integer> wipLimits,
    Boolean promoteOnPlanReady,
    Boolean autoExecute,
    Boolean queueProcessingEnabled
) {
    public WorkspaceConfig {
        wipLimits = wipLimits != null ? Map.copyOf(wipLimits) : Map.of();
    }

    public static WorkspaceConfig empty() {
        return new WorkspaceConfig(Map.of(), null, null, null);
    }

    /**
     * Create a copy with a single WIP override changed. A null limit removes
     * the override.
     */
    public WorkspaceConfig withWipLimit(Phase phase, Integer limit) {
        Map<Phase, Integer> updated = new EnumMap<>(Phase.class);
        updated.putAll(wipLimits);
        if (limit == null) {
            updated.remove(phase);
        } else {
            updated.put(phase, limit);
        }
        return new WorkspaceConfig(updated, promoteOnPlanReady, autoExecute, queueProcessingEnabled);
    }

    public WorkspaceConfig withWipLimits(Map<Phase, Integer> limits) {
        return new WorkspaceConfig(limits, promoteOnPlanReady, autoExecute, queueProcessingEnabled);
    }

    public WorkspaceConfig withPromoteOnPlanReady(Boolean value) {
        return new WorkspaceConfig(wipLimits, value, autoExecute, queueProcessingEnabled);
    }

    public WorkspaceConfig withAutoExecute(Boolean value) {
        return new WorkspaceConfig(wipLimits, promoteOnPlanReady, value, queueProcessingEnabled);
    }

    public WorkspaceConfig withQueueProcessingEnabled(Boolean value) {
        return new WorkspaceConfig(wipLimits, promoteOnPlanReady, autoExecute, value);
    }
}
