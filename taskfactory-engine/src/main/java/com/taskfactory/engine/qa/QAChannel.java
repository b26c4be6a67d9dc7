package com.taskfactory.engine.qa;

import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.PendingQARequest;
import com.taskfactory.core.model.QAAnswer;
import com.taskfactory.core.model.QAQuestion;
import com.taskfactory.core.model.QAResolution;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rendezvous between an agent asking clarifying questions and the human
 * answering them. One pending request per workspace; each request resolves
 * exactly once.
 */
public class QAChannel {

    private static final Logger log = LoggerFactory.getLogger(QAChannel.class);

    private final BroadcastHub broadcastHub;
    private final TaskFactoryMetrics metrics;
    private final Map<String, QARegistration> pendingByWorkspace = new ConcurrentHashMap<>();

    public QAChannel(BroadcastHub broadcastHub, TaskFactoryMetrics metrics) {
        this.broadcastHub = broadcastHub;
        this.metrics = metrics;
    }

    /**
     * Store a new request and notify observers. A request already pending
     * for the workspace is aborted first.
     */
    public QARegistration register(String workspaceId, String taskId, List<QAQuestion> questions) {
        PendingQARequest request = PendingQARequest.create(workspaceId, taskId, questions);
        QARegistration registration = new QARegistration(request, new CompletableFuture<>());

        QARegistration previous = pendingByWorkspace.put(workspaceId, registration);
        if (previous != null) {
            log.warn("Workspace {} already had pending Q&A request {}; aborting it",
                workspaceId, previous.request().requestId());
            previous.resolution().complete(QAResolution.aborted(previous.request().requestId()));
            metrics.qaRequest("superseded");
            broadcastResolved(previous.request(), true);
        }

        metrics.qaRequest("registered");
        log.info("Q&A request {} registered for workspace {} ({} questions)",
            request.requestId(), workspaceId, request.questions().size());
        broadcastHub.broadcast(workspaceId, EventType.QA_REQUEST, taskId, Map.of("request", request));
        return registration;
    }

    /**
     * @return false if the workspace has no pending request with this id
     */
    public boolean respond(String workspaceId, String requestId, List<QAAnswer> answers) {
        return resolve(workspaceId, requestId, QAResolution.answered(requestId, answers));
    }

    /**
     * Resolve without answers; the agent continues on its own judgement.
     *
     * @return false if the workspace has no pending request with this id
     */
    public boolean abort(String workspaceId, String requestId) {
        return resolve(workspaceId, requestId, QAResolution.aborted(requestId));
    }

    public Optional<PendingQARequest> pending(String workspaceId) {
        return Optional.ofNullable(pendingByWorkspace.get(workspaceId)).map(QARegistration::request);
    }

    public void abortWorkspace(String workspaceId) {
        pending(workspaceId).ifPresent(request -> abort(workspaceId, request.requestId()));
    }

    public void abortAll() {
        List.copyOf(pendingByWorkspace.keySet()).forEach(this::abortWorkspace);
    }

    public int pendingCount() {
        return pendingByWorkspace.size();
    }

    // ========== Internal Methods ==========

    private boolean resolve(String workspaceId, String requestId, QAResolution resolution) {
        QARegistration registration = pendingByWorkspace.get(workspaceId);
        if (registration == null
                || !registration.request().requestId().equals(requestId)
                || !pendingByWorkspace.remove(workspaceId, registration)) {
            log.debug("No pending Q&A request {} in workspace {}", requestId, workspaceId);
            return false;
        }
        registration.resolution().complete(resolution);
        metrics.qaRequest(resolution.aborted() ? "aborted" : "answered");
        log.info("Q&A request {} {}", requestId, resolution.aborted() ? "aborted" : "answered");
        broadcastResolved(registration.request(), resolution.aborted());
        return true;
    }

    private void broadcastResolved(PendingQARequest request, boolean aborted) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("requestId", request.requestId());
        payload.put("aborted", aborted);
        broadcastHub.broadcast(request.workspaceId(), EventType.QA_RESOLVED, request.taskId(), payload);
    }
}
