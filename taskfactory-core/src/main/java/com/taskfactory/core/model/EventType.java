package com.taskfactory.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of events pushed to workspace observers.
 */
public enum EventType {
    // Task lifecycle
    TASK_CREATED("task:created"),
    TASK_UPDATED("task:updated"),
    TASK_DELETED("task:deleted"),
    TASK_MOVED("task:moved"),
    TASK_REORDERED("task:reordered"),
    TASK_SEPARATOR("task:separator"),
    TASK_PLAN_GENERATED("task:plan_generated"),

    // Activity
    ACTIVITY_ENTRY("activity:entry"),

    // Agent sessions
    AGENT_EXECUTION_STATUS("agent:execution_status"),

    // Scheduling and automation
    QUEUE_STATUS("queue:status"),
    WORKSPACE_AUTOMATION_UPDATED("workspace:automation_updated"),
    WIP_BREACH("wip:breach"),

    // Workspace lifecycle
    WORKSPACE_UPDATED("workspace:updated"),
    WORKSPACE_DELETED("workspace:deleted"),

    // Q&A
    QA_REQUEST("qa:request"),
    QA_RESOLVED("qa:resolved");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
