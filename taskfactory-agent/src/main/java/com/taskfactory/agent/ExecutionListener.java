package com.taskfactory.agent;

/**
 * Callbacks from a running session. May be invoked on any thread.
 */
public interface ExecutionListener {

    /**
     * The agent started working on a turn.
     */
    default void onRunning() {
    }

    /**
     * The agent finished a turn and waits for a follow-up.
     */
    default void onIdle() {
    }

    /**
     * The session ended. Called at most once per session.
     */
    void onCompleted(ExecutionResult result);
}
