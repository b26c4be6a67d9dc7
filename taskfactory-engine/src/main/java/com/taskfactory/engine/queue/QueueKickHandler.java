package com.taskfactory.engine.queue;

/**
 * Receives queue wake-ups from the engine. Implemented by the scheduler.
 */
public interface QueueKickHandler {

    /**
     * Ask the workspace queue to rescan. Must not block the caller.
     */
    void kick(String workspaceId);

    /**
     * Stop and forget the workspace queue.
     */
    void release(String workspaceId);

    /**
     * Stop every queue; no kicks are honored afterwards.
     */
    void shutdown();
}
