package com.taskfactory.scheduler;

import java.time.Instant;

/**
 * Point-in-time view of a workspace's execution breaker.
 */
public record BreakerStatus(
    boolean open,
    BreakerCategory category,
    int recentFailures,
    Instant openedAt,
    Instant retryAt,
    String lastError
) {
    public static BreakerStatus closed(int recentFailures) {
        return new BreakerStatus(false, null, recentFailures, null, null, null);
    }
}
