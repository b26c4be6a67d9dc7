package com.taskfactory.engine.chat;

/**
 * How a chat message reached the agent.
 */
public enum ChatOutcome {
    /**
     * Delivered mid-turn to a running session.
     */
    STEERED,

    /**
     * Delivered to an idle session, which resumed.
     */
    FOLLOWED_UP,

    /**
     * A conversation session opened on the task's previous transcript.
     */
    RESUMED,

    /**
     * A fresh conversation session opened.
     */
    STARTED
}
