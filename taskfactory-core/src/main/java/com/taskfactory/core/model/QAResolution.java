package com.taskfactory.core.model;

import java.util.List;

/**
 * Outcome handed back to the waiting agent: answers, or an abort telling it
 * to carry on without structured input.
 */
public record QAResolution(
    String requestId,
    boolean aborted,
    List<QAAnswer> answers
) {
    public QAResolution {
        answers = answers != null ? List.copyOf(answers) : List.of();
    }

    public static QAResolution answered(String requestId, List<QAAnswer> answers) {
        return new QAResolution(requestId, false, answers);
    }

    public static QAResolution aborted(String requestId) {
        return new QAResolution(requestId, true, List.of());
    }
}
