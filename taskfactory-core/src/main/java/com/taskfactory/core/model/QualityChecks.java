package com.taskfactory.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named boolean quality gates recorded against a task (tests pass, lint clean, ...).
 */
public record QualityChecks(Map<String, Boolean> checks) {

    public QualityChecks {
        checks = checks != null ? Map.copyOf(checks) : Map.of();
    }

    public static QualityChecks empty() {
        return new QualityChecks(Map.of());
    }

    public QualityChecks with(String name, boolean passed) {
        Map<String, Boolean> updated = new LinkedHashMap<>(checks);
        updated.put(name, passed);
        return new QualityChecks(updated);
    }
}
