package com.taskfactory.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures logs emitted inside queue scans, completion handling and observer
 * traffic carry the workspace and task they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(workspaceId, taskId)) {
 *     log.info("Starting agent session"); // includes workspaceId, taskId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKSPACE_ID = "workspaceId";
    public static final String TASK_ID = "taskId";
    public static final String SESSION_ID = "sessionId";
    public static final String OBSERVER_ID = "observerId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // use static factory methods
    }

    public static LoggingContext forWorkspace(String workspaceId) {
        return forSession(workspaceId, null, null);
    }

    public static LoggingContext forTask(String workspaceId, String taskId) {
        return forSession(workspaceId, taskId, null);
    }

    /**
     * Create a logging context for agent session handling.
     */
    public static LoggingContext forSession(String workspaceId, String taskId, String sessionId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(WORKSPACE_ID, workspaceId);
        putIfPresent(TASK_ID, taskId);
        putIfPresent(SESSION_ID, sessionId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a connected observer.
     */
    public static LoggingContext forObserver(String observerId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(OBSERVER_ID, observerId);
        ensureTraceId();
        return ctx;
    }

    public static String getWorkspaceId() {
        return MDC.get(WORKSPACE_ID);
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKSPACE_ID);
        MDC.remove(TASK_ID);
        MDC.remove(SESSION_ID);
        MDC.remove(OBSERVER_ID);
        // Keep TRACE_ID for request-scoped tracing
    }
}
