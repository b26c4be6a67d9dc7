package com.taskfactory.core.model;

import java.util.UUID;

public record AcceptanceCriterion(
    String id,
    String text,
    boolean met
) {
    public static AcceptanceCriterion of(String text) {
        return new AcceptanceCriterion(UUID.randomUUID().toString(), text, false);
    }
}
