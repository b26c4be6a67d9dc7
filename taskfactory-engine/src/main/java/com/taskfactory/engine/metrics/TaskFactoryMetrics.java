package com.taskfactory.engine.metrics;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.SessionPurpose;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the task factory.
 *
 * Metrics exposed:
 * - Phase transitions and WIP rejections
 * - Agent sessions by purpose and outcome
 * - Queue dispatches
 * - Q&A resolutions
 * - Live sessions and connected observers
 */
public class TaskFactoryMetrics implements MeterBinder {

    // Metric names
    public static final String TRANSITIONS = "taskfactory.transitions";
    public static final String CAPACITY_REJECTIONS = "taskfactory.capacity.rejections";
    public static final String SESSIONS_STARTED = "taskfactory.sessions.started";
    public static final String SESSIONS_ENDED = "taskfactory.sessions.ended";
    public static final String SESSIONS_LIVE = "taskfactory.sessions.live";
    public static final String QUEUE_DISPATCHES = "taskfactory.queue.dispatches";
    public static final String BREAKER_TRIPS = "taskfactory.queue.breaker.trips";
    public static final String QA_REQUESTS = "taskfactory.qa.requests";
    public static final String OBSERVERS_CONNECTED = "taskfactory.observers.connected";

    private final AtomicInteger liveSessions = new AtomicInteger();
    private final AtomicInteger connectedObservers = new AtomicInteger();

    private MeterRegistry registry;

    public TaskFactoryMetrics() {
    }

    public TaskFactoryMetrics(MeterRegistry registry) {
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(SESSIONS_LIVE, liveSessions, AtomicInteger::get)
            .description("Agent sessions currently running or idle")
            .register(registry);
        Gauge.builder(OBSERVERS_CONNECTED, connectedObservers, AtomicInteger::get)
            .description("Observers connected to the broadcast hub")
            .register(registry);
    }

    // ========== Board Metrics ==========

    public void taskMoved(Phase from, Phase to) {
        if (registry == null) {
            return;
        }
        Counter.builder(TRANSITIONS)
            .tag("from", from.wireName())
            .tag("to", to.wireName())
            .description("Phase transitions applied")
            .register(registry)
            .increment();
    }

    public void capacityRejected(Phase phase) {
        if (registry == null) {
            return;
        }
        Counter.builder(CAPACITY_REJECTIONS)
            .tag("phase", phase.wireName())
            .description("Moves refused because the target phase was at its WIP limit")
            .register(registry)
            .increment();
    }

    // ========== Session Metrics ==========

    public void sessionStarted(SessionPurpose purpose) {
        if (registry == null) {
            return;
        }
        Counter.builder(SESSIONS_STARTED)
            .tag("purpose", purpose.name().toLowerCase())
            .description("Agent sessions opened")
            .register(registry)
            .increment();
    }

    /**
     * @param outcome completed, failed or stopped
     */
    public void sessionEnded(SessionPurpose purpose, String outcome) {
        if (registry == null) {
            return;
        }
        Counter.builder(SESSIONS_ENDED)
            .tag("purpose", purpose.name().toLowerCase())
            .tag("outcome", outcome)
            .description("Agent sessions ended")
            .register(registry)
            .increment();
    }

    // ========== Queue Metrics ==========

    public void queueDispatched(boolean manual) {
        if (registry == null) {
            return;
        }
        Counter.builder(QUEUE_DISPATCHES)
            .tag("trigger", manual ? "manual" : "queue")
            .description("Tasks handed to an agent session")
            .register(registry)
            .increment();
    }

    public void breakerTripped(String category) {
        if (registry == null) {
            return;
        }
        Counter.builder(BREAKER_TRIPS)
            .tag("category", category)
            .description("Execution breaker openings")
            .register(registry)
            .increment();
    }

    // ========== Q&A Metrics ==========

    /**
     * @param outcome registered, answered, aborted or superseded
     */
    public void qaRequest(String outcome) {
        if (registry == null) {
            return;
        }
        Counter.builder(QA_REQUESTS)
            .tag("outcome", outcome)
            .description("Clarifying question requests")
            .register(registry)
            .increment();
    }

    // ========== Gauges ==========

    public void syncConnectedObservers(int count) {
        connectedObservers.set(count);
    }

    public void syncLiveSessions(int count) {
        liveSessions.set(count);
    }

    public int liveSessions() {
        return liveSessions.get();
    }
}
