package com.taskfactory.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Per-workspace circuit breaker over execution failures.
 *
 * Only failures that classify as {@link BreakerCategory} count. Once
 * {@code threshold} of them land within {@code burstWindow}, the breaker
 * opens for {@code cooldown} and the queue stops dispatching. It closes on
 * its own when the cooldown has elapsed, or when cleared by a manual queue start.
 */
public class ExecutionBreaker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionBreaker.class);

    private final String workspaceId;
    private final boolean enabled;
    private final int threshold;
    private final Duration burstWindow;
    private final Duration cooldown;
    private final Clock clock;

    private final Deque<Instant> recentFailures = new ArrayDeque<>();
    private BreakerCategory openCategory;
    private Instant openedAt;
    private Instant retryAt;
    private String lastError;

    public ExecutionBreaker(String workspaceId, boolean enabled, int threshold,
                            Duration burstWindow, Duration cooldown, Clock clock) {
        this.workspaceId = workspaceId;
        this.enabled = enabled;
        this.threshold = threshold;
        this.burstWindow = burstWindow;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Record a failed execution.
     *
     * @return the category if this failure opened the breaker
     */
    public synchronized Optional<BreakerCategory> recordFailure(String errorMessage) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<BreakerCategory> category = BreakerCategory.classify(errorMessage);
        if (category.isEmpty() || isOpenAt(clock.instant())) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Instant windowStart = now.minus(burstWindow);
        while (!recentFailures.isEmpty() && recentFailures.peekFirst().isBefore(windowStart)) {
            recentFailures.pollFirst();
        }
        recentFailures.addLast(now);

        if (recentFailures.size() < threshold) {
            return Optional.empty();
        }

        openCategory = category.get();
        openedAt = now;
        retryAt = now.plus(cooldown);
        lastError = errorMessage;
        log.warn("Execution breaker opened for workspace {} after {} {} failures, retry at {}",
            workspaceId, recentFailures.size(), openCategory, retryAt);
        recentFailures.clear();
        return category;
    }

    /**
     * A successful execution ends the current failure burst.
     */
    public synchronized void recordSuccess() {
        recentFailures.clear();
    }

    public synchronized boolean isOpen() {
        return isOpenAt(clock.instant());
    }

    /**
     * Close the breaker and forget the failure burst.
     *
     * @return true if the breaker was open
     */
    public synchronized boolean clear() {
        boolean wasOpen = isOpenAt(clock.instant());
        recentFailures.clear();
        reset();
        if (wasOpen) {
            log.info("Execution breaker for workspace {} cleared manually", workspaceId);
        }
        return wasOpen;
    }

    public synchronized BreakerStatus status() {
        if (!isOpenAt(clock.instant())) {
            return BreakerStatus.closed(recentFailures.size());
        }
        return new BreakerStatus(true, openCategory, threshold, openedAt, retryAt, lastError);
    }

    private boolean isOpenAt(Instant now) {
        if (retryAt == null) {
            return false;
        }
        if (!now.isBefore(retryAt)) {
            log.info("Execution breaker for workspace {} closed after cooldown", workspaceId);
            reset();
            return false;
        }
        return true;
    }

    private void reset() {
        openCategory = null;
        openedAt = null;
        retryAt = null;
        lastError = null;
    }
}
