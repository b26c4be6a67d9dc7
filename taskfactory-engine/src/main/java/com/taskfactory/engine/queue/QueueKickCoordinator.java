package com.taskfactory.engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets engine components wake the scheduler without depending on it.
 * The scheduler registers itself at startup; until then kicks are dropped,
 * which is safe because the scheduler scans every workspace on initialize.
 */
public class QueueKickCoordinator {

    private static final Logger log = LoggerFactory.getLogger(QueueKickCoordinator.class);

    private volatile QueueKickHandler handler;

    public void registerHandler(QueueKickHandler handler) {
        this.handler = handler;
        log.info("Queue kick handler registered: {}", handler.getClass().getSimpleName());
    }

    public void requestKick(String workspaceId) {
        QueueKickHandler current = handler;
        if (current == null) {
            log.debug("No queue handler registered, dropping kick for workspace {}", workspaceId);
            return;
        }
        current.kick(workspaceId);
    }

    public void releaseWorkspace(String workspaceId) {
        QueueKickHandler current = handler;
        if (current != null) {
            current.release(workspaceId);
        }
    }

    public void shutdown() {
        QueueKickHandler current = handler;
        if (current != null) {
            current.shutdown();
        }
    }
}
