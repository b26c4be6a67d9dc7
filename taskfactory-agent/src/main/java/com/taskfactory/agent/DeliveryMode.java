package com.taskfactory.agent;

/**
 * How a message reaches a live session.
 */
public enum DeliveryMode {
    /**
     * Interrupt the current turn with new instructions, keeping its context.
     */
    STEER,

    /**
     * Start the next conversational turn of an idle session.
     */
    FOLLOW_UP
}
