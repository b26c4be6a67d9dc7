package com.taskfactory.engine.lifecycle;

import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the task factory.
 *
 * On shutdown:
 * 1. Stops the workspace queues so nothing new is dispatched
 * 2. Stops every agent session, waiting for each to confirm (bounded)
 * 3. Aborts pending Q&A so waiting agents are released
 * 4. Disconnects observers
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final QueueKickCoordinator queueKickCoordinator;
    private final SessionRegistry sessionRegistry;
    private final QAChannel qaChannel;
    private final BroadcastHub broadcastHub;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(
            QueueKickCoordinator queueKickCoordinator,
            SessionRegistry sessionRegistry,
            QAChannel qaChannel,
            BroadcastHub broadcastHub) {
        this.queueKickCoordinator = queueKickCoordinator;
        this.sessionRegistry = sessionRegistry;
        this.qaChannel = qaChannel;
        this.broadcastHub = broadcastHub;
    }

    /**
     * Runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown ({} live sessions, {} observers)",
            sessionRegistry.liveSessionCount(), broadcastHub.connectedObservers());

        queueKickCoordinator.shutdown();
        sessionRegistry.shutdown();
        qaChannel.abortAll();
        broadcastHub.disconnectAll();

        log.info("Graceful shutdown complete");
    }
}
