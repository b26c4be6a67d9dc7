package com.taskfactory.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskfactory.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client for an external agent runner reachable over HTTP.
 *
 * Sessions are opened with {@code POST /api/sessions}, carrying a session id
 * proposed by this client. The runner reports status changes back through the
 * task factory API, which routes them here via
 * {@link #dispatchCallback(String, AgentCallback)}. The listener is registered
 * under the proposed id before the request goes out, so callbacks that beat
 * the response are not lost.
 *
 * Usage:
 * <pre>
 * HttpAgentClient agent = new HttpAgentClient("http://agent-runner:7070", objectMapper);
 * ExecutionHandle handle = agent.open(ExecutionRequest.forExecution(task, workspace), listener);
 * handle.deliver("Also update the README", List.of(), DeliveryMode.STEER);
 * </pre>
 */
public class HttpAgentClient implements ExecutionCollaborator, PlanningCollaborator {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentClient.class);

    private final String runnerUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Map<String, ExecutionListener> listeners = new ConcurrentHashMap<>();

    public HttpAgentClient(String runnerUrl, ObjectMapper objectMapper) {
        this(runnerUrl, objectMapper, Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public HttpAgentClient(String runnerUrl, ObjectMapper objectMapper,
                           Duration connectTimeout, Duration requestTimeout) {
        this.runnerUrl = runnerUrl.endsWith("/") ? runnerUrl.substring(0, runnerUrl.length() - 1) : runnerUrl;
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public ExecutionHandle open(ExecutionRequest request, ExecutionListener listener) throws AgentException {
        String proposedId = UUID.randomUUID().toString();
        ObjectNode body = objectMapper.valueToTree(request);
        body.put("sessionId", proposedId);

        listeners.put(proposedId, listener);
        JsonNode response;
        try {
            response = send("POST", "/api/sessions", body, requestTimeout);
        } catch (AgentException e) {
            listeners.remove(proposedId, listener);
            throw e;
        }

        String sessionId = response.path("sessionId").asText(proposedId);
        if (sessionId.isBlank()) {
            listeners.remove(proposedId, listener);
            throw new AgentException(AgentException.PROTOCOL, "Runner returned a blank sessionId");
        }
        if (!sessionId.equals(proposedId) && listeners.remove(proposedId, listener)) {
            log.debug("Runner assigned session id {} instead of {}", sessionId, proposedId);
            listeners.put(sessionId, listener);
        }
        String sessionReference = response.path("sessionReference").asText(sessionId);

        log.info("Opened {} session {} for task {}", request.purpose(), sessionId, request.taskId());
        return new HttpExecutionHandle(sessionId, sessionReference);
    }

    @Override
    public CompletableFuture<TaskPlan> plan(PlanningRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("workspaceId", request.workspaceId());
        body.put("workspacePath", request.workspacePath());
        body.put("taskId", request.taskId());
        body.put("title", request.title());
        body.put("description", request.description());
        body.put("acceptanceCriteria", request.acceptanceCriteria());
        body.put("maxWallClockMs", request.maxWallClock().toMillis());
        body.put("maxToolCalls", request.maxToolCalls());

        HttpRequest httpRequest;
        try {
            httpRequest = jsonRequest("POST", "/api/plans", body, request.maxWallClock());
        } catch (AgentException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Requesting plan for task {}", request.taskId());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw new CompletionException(new AgentException(AgentException.REJECTED,
                        "Planning failed with status " + response.statusCode() + ": " + response.body(), false));
                }
                try {
                    return objectMapper.readValue(response.body(), TaskPlan.class);
                } catch (IOException e) {
                    throw new CompletionException(
                        new AgentException(AgentException.PROTOCOL, "Unreadable plan from runner", e));
                }
            });
    }

    /**
     * Route a status notification from the runner to the session's listener.
     *
     * @return false if the session is unknown (already finished or never opened here)
     */
    public boolean dispatchCallback(String sessionId, AgentCallback callback) {
        ExecutionListener listener = listeners.get(sessionId);
        if (listener == null) {
            log.debug("Ignoring {} callback for unknown session {}", callback.type(), sessionId);
            return false;
        }

        switch (callback.type()) {
            case AgentCallback.RUNNING -> listener.onRunning();
            case AgentCallback.IDLE -> listener.onIdle();
            case AgentCallback.COMPLETED -> {
                listeners.remove(sessionId);
                listener.onCompleted(ExecutionResult.succeeded(callback.summary()));
            }
            case AgentCallback.FAILED -> {
                listeners.remove(sessionId);
                listener.onCompleted(ExecutionResult.failed(callback.errorMessage()));
            }
            default -> {
                log.warn("Unknown callback type {} for session {}", callback.type(), sessionId);
                return false;
            }
        }
        return true;
    }

    /**
     * Number of sessions this client still expects callbacks for.
     */
    public int trackedSessionCount() {
        return listeners.size();
    }

    // ========== Internal Methods ==========

    private JsonNode send(String method, String path, Object body, Duration timeout) throws AgentException {
        HttpRequest request = jsonRequest(method, path, body, timeout);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw AgentException.rejected(
                    method + " " + path + " failed with status " + response.statusCode() + ": " + response.body());
            }
            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new AgentException(AgentException.UNAVAILABLE, "Agent runner unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(AgentException.UNAVAILABLE, "Interrupted calling agent runner", e);
        }
    }

    private HttpRequest jsonRequest(String method, String path, Object body, Duration timeout) throws AgentException {
        HttpRequest.BodyPublisher publisher;
        if (body == null) {
            publisher = HttpRequest.BodyPublishers.noBody();
        } else {
            try {
                publisher = HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
            } catch (IOException e) {
                throw new AgentException(AgentException.PROTOCOL, "Cannot serialize request for " + path, e);
            }
        }
        return HttpRequest.newBuilder()
            .uri(URI.create(runnerUrl + path))
            .header("Content-Type", "application/json")
            .timeout(timeout)
            .method(method, publisher)
            .build();
    }

    private final class HttpExecutionHandle implements ExecutionHandle {

        private final String sessionId;
        private final String sessionReference;

        private HttpExecutionHandle(String sessionId, String sessionReference) {
            this.sessionId = sessionId;
            this.sessionReference = sessionReference;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public String sessionReference() {
            return sessionReference;
        }

        @Override
        public void deliver(String message, List<ImageAttachment> images, DeliveryMode mode) throws AgentException {
            Map<String, Object> body = new HashMap<>();
            body.put("message", message);
            body.put("mode", mode.name().toLowerCase());
            body.put("images", images != null ? images : List.of());
            send("POST", "/api/sessions/" + sessionId + "/messages", body, requestTimeout);
            log.debug("Delivered {} message to session {}", mode, sessionId);
        }

        @Override
        public CompletableFuture<Void> stop() {
            listeners.remove(sessionId);
            HttpRequest request;
            try {
                request = jsonRequest("DELETE", "/api/sessions/" + sessionId, null, requestTimeout);
            } catch (AgentException e) {
                return CompletableFuture.failedFuture(e);
            }
            return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenAccept(response -> {
                    if (response.statusCode() / 100 != 2 && response.statusCode() != 404) {
                        log.warn("Stop of session {} returned status {}", sessionId, response.statusCode());
                    } else {
                        log.info("Stopped session {}", sessionId);
                    }
                });
        }
    }
}
