package com.taskfactory.core.model;

import java.util.List;

public record QAQuestion(
    String id,
    String question,
    List<String> options
) {
    public QAQuestion {
        options = options != null ? List.copyOf(options) : List.of();
    }
}
