package com.taskfactory.core.model;

public record QAAnswer(
    String questionId,
    String selectedOption
) {
}
