package com.taskfactory.engine.broadcast;

import com.taskfactory.core.model.WorkspaceEvent;

/**
 * A connected client that receives workspace events, e.g. a WebSocket session.
 */
public interface EventObserver {

    /**
     * Stable ID for the lifetime of the connection.
     */
    String id();

    /**
     * Deliver one event. Called under the workspace's dispatch monitor, so
     * implementations must not call back into the hub.
     *
     * @throws Exception if the transport failed; the hub logs and continues
     */
    void deliver(WorkspaceEvent event) throws Exception;

    /**
     * @return false once the transport is gone; the hub then drops the observer
     */
    default boolean isOpen() {
        return true;
    }
}
