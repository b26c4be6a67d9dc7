package com.taskfactory.engine.automation;

/**
 * Effective automation toggles for a workspace.
 */
public record AutomationSettings(
    boolean promoteOnPlanReady,
    boolean autoExecute
) {
}
