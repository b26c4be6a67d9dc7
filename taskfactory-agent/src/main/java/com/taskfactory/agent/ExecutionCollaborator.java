package com.taskfactory.agent;

/**
 * The agent that does the actual work on a task. Treated as an opaque async worker.
 */
public interface ExecutionCollaborator {

    /**
     * Open a session.
     *
     * @param request What to work on
     * @param listener Receives status changes and the final outcome
     * @return Handle to the live session
     * @throws AgentException if the session could not be opened
     */
    ExecutionHandle open(ExecutionRequest request, ExecutionListener listener) throws AgentException;
}
