package com.taskfactory.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline phases a task moves through.
 * Declaration order is pipeline order; {@link #pipelineIndex()} is used to
 * classify a move as forward or backward.
 */
public enum Phase {
    /**
     * Captured but not yet planned or prioritized.
     */
    BACKLOG("backlog"),

    /**
     * Planned and waiting for an execution slot.
     */
    READY("ready"),

    /**
     * An agent session is (or was last) working on the task.
     */
    EXECUTING("executing"),

    /**
     * Work finished.
     */
    COMPLETE("complete"),

    /**
     * Sink for tasks nobody wants to see on the board any more.
     */
    ARCHIVED("archived");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int pipelineIndex() {
        return ordinal();
    }

    /**
     * Check if moving from {@code source} into this phase goes back up the pipeline.
     */
    public boolean isBackwardFrom(Phase source) {
        return pipelineIndex() < source.pipelineIndex();
    }

    @JsonCreator
    public static Phase fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (Phase phase : values()) {
            if (phase.wireName.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
