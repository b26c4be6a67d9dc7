package com.taskfactory.recovery;

/**
 * What a startup recovery pass did.
 */
public record RecoveryReport(
    int planningResumed,
    int executionsRequeued,
    int queuesKicked
) {
}
