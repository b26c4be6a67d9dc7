package com.taskfactory.agent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Opaque handle to one live agent session.
 */
public interface ExecutionHandle {

    /**
     * Collaborator-side session identifier.
     */
    String sessionId();

    /**
     * Transcript reference that can later be passed back as a resume reference.
     */
    String sessionReference();

    /**
     * Deliver a message to the session.
     *
     * @param message The instructions or conversational turn
     * @param images Optional inline images
     * @param mode Steer an in-flight turn or start the next one
     * @throws AgentException if the collaborator rejected the message
     */
    void deliver(String message, List<ImageAttachment> images, DeliveryMode mode) throws AgentException;

    /**
     * Request graceful termination.
     *
     * @return Completes once the collaborator has stopped the session
     */
    CompletableFuture<Void> stop();
}
