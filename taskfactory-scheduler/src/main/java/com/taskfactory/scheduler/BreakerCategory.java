package com.taskfactory.scheduler;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Failure classes that indicate the agent runner cannot make progress for
 * any task until someone intervenes.
 */
public enum BreakerCategory {
    AUTH(Pattern.compile("\\b40[13]\\b|auth|unauthori[sz]ed|forbidden|invalid api key|no api key|credential")),
    QUOTA(Pattern.compile("quota|billing|insufficient credit|credits|payment required")),
    RATE_LIMIT(Pattern.compile("\\b429\\b|rate.?limit|too many requests|overloaded"));

    private final Pattern pattern;

    BreakerCategory(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Classify an execution error message. Categories are checked in
     * declaration order.
     *
     * @return empty if the failure is task-specific
     */
    public static Optional<BreakerCategory> classify(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return Optional.empty();
        }
        String message = errorMessage.toLowerCase();
        for (BreakerCategory category : values()) {
            if (category.pattern.matcher(message).find()) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
