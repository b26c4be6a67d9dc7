package com.taskfactory.engine.session;

import com.taskfactory.agent.ExecutionResult;

/**
 * Receives the final outcome of a session once the registry has removed it.
 * Invoked on the collaborator's callback thread; implementations should hand
 * off rather than do heavy work inline.
 */
@FunctionalInterface
public interface ExecutionOutcomeListener {

    void onOutcome(SessionSnapshot session, ExecutionResult result);

    ExecutionOutcomeListener NONE = (session, result) -> { };
}
