package com.taskfactory.core.model;

public enum ActivityKind {
    SYSTEM_EVENT,
    CHAT_MESSAGE,
    TASK_SEPARATOR
}
