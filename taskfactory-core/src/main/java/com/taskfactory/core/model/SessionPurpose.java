package com.taskfactory.core.model;

/**
 * Why a session was opened. Only execution sessions drive the task to complete.
 */
public enum SessionPurpose {
    EXECUTION,
    CONVERSATION
}
