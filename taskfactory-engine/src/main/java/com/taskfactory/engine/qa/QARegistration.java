package com.taskfactory.engine.qa;

import com.taskfactory.core.model.PendingQARequest;
import com.taskfactory.core.model.QAResolution;

import java.util.concurrent.CompletableFuture;

/**
 * A stored request together with the future its asking agent waits on.
 */
public record QARegistration(
    PendingQARequest request,
    CompletableFuture<QAResolution> resolution
) {
}
