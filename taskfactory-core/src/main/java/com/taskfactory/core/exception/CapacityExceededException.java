package com.taskfactory.core.exception;

import com.taskfactory.core.model.Phase;

/**
 * Thrown when admitting a task would push a phase past its WIP limit.
 */
public class CapacityExceededException extends TaskFactoryException {

    public static final String ERROR_CODE = "CAPACITY_EXCEEDED";

    private final Phase phase;
    private final int limit;
    private final int current;

    public CapacityExceededException(Phase phase, int limit, int current) {
        super(ERROR_CODE, String.format(
            "Phase %s is at its WIP limit (%d/%d)",
            phase, current, limit
        ));
        this.phase = phase;
        this.limit = limit;
        this.current = current;
    }

    public Phase getPhase() {
        return phase;
    }

    public int getLimit() {
        return limit;
    }

    public int getCurrent() {
        return current;
    }
}
