package com.taskfactory.scheduler;

import com.taskfactory.engine.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ExecutionBreakerTest {

    private TimeController clock;
    private ExecutionBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozen();
        breaker = new ExecutionBreaker("ws", true, 3, Duration.ofMinutes(2), Duration.ofMinutes(5), clock);
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        void authFailures() {
            assertThat(BreakerCategory.classify("HTTP 401 Unauthorized")).contains(BreakerCategory.AUTH);
            assertThat(BreakerCategory.classify("Invalid API key provided")).contains(BreakerCategory.AUTH);
            assertThat(BreakerCategory.classify("403 Forbidden")).contains(BreakerCategory.AUTH);
        }

        @Test
        void quotaFailures() {
            assertThat(BreakerCategory.classify("Insufficient credit balance")).contains(BreakerCategory.QUOTA);
            assertThat(BreakerCategory.classify("Monthly quota exhausted")).contains(BreakerCategory.QUOTA);
        }

        @Test
        void rateLimitFailures() {
            assertThat(BreakerCategory.classify("429 Too Many Requests")).contains(BreakerCategory.RATE_LIMIT);
            assertThat(BreakerCategory.classify("rate limit reached")).contains(BreakerCategory.RATE_LIMIT);
        }

        @Test
        @DisplayName("Task-specific failures are not classified")
        void otherFailures() {
            assertThat(BreakerCategory.classify("tests failed: 3 of 40")).isEmpty();
            assertThat(BreakerCategory.classify(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("Three classified failures inside the window open the breaker")
    void opensAtThreshold() {
        assertThat(breaker.recordFailure("429 rate limit")).isEmpty();
        clock.advanceSeconds(30);
        assertThat(breaker.recordFailure("429 rate limit")).isEmpty();
        clock.advanceSeconds(30);

        assertThat(breaker.recordFailure("429 rate limit")).contains(BreakerCategory.RATE_LIMIT);

        BreakerStatus status = breaker.status();
        assertThat(status.open()).isTrue();
        assertThat(status.category()).isEqualTo(BreakerCategory.RATE_LIMIT);
        assertThat(status.retryAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
        assertThat(status.lastError()).isEqualTo("429 rate limit");
    }

    @Test
    @DisplayName("Failures older than the burst window fall out")
    void windowSlides() {
        breaker.recordFailure("401 unauthorized");
        breaker.recordFailure("401 unauthorized");
        clock.advanceMinutes(3);

        assertThat(breaker.recordFailure("401 unauthorized")).isEmpty();
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.status().recentFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unclassified failures never count")
    void unclassifiedIgnored() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure("assertion failed");
        }
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.status().recentFailures()).isZero();
    }

    @Test
    @DisplayName("A success ends the burst")
    void successResets() {
        breaker.recordFailure("quota exceeded");
        breaker.recordFailure("quota exceeded");
        breaker.recordSuccess();

        assertThat(breaker.recordFailure("quota exceeded")).isEmpty();
    }

    @Test
    @DisplayName("The breaker closes by itself after the cooldown")
    void closesAfterCooldown() {
        trip();
        clock.advanceMinutes(4);
        assertThat(breaker.isOpen()).isTrue();

        clock.advanceMinutes(1);
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.status().open()).isFalse();
    }

    @Test
    @DisplayName("Clearing closes an open breaker and reports it")
    void clearCloses() {
        trip();

        assertThat(breaker.clear()).isTrue();
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.clear()).isFalse();
    }

    @Test
    @DisplayName("A disabled breaker never opens")
    void disabled() {
        ExecutionBreaker off = new ExecutionBreaker("ws", false, 1, Duration.ofMinutes(2), Duration.ofMinutes(5), clock);

        assertThat(off.recordFailure("401 unauthorized")).isEmpty();
        assertThat(off.isOpen()).isFalse();
    }

    private void trip() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure("401 unauthorized");
        }
        assertThat(breaker.isOpen()).isTrue();
    }
}
