package com.taskfactory.core.admission;

import com.taskfactory.core.exception.CapacityExceededException;
import com.taskfactory.core.model.Phase;

/**
 * Result of an admission check. {@code limit} is null when the phase is unlimited.
 */
public record AdmissionDecision(
    boolean allowed,
    Phase phase,
    Integer limit,
    int current
) {
    public static AdmissionDecision allow(Phase phase, Integer limit, int current) {
        return new AdmissionDecision(true, phase, limit, current);
    }

    public static AdmissionDecision deny(Phase phase, int limit, int current) {
        return new AdmissionDecision(false, phase, limit, current);
    }

    /**
     * Throw {@link CapacityExceededException} if this decision is a denial.
     */
    public void orThrow() {
        if (!allowed) {
            throw new CapacityExceededException(phase, limit, current);
        }
    }
}
