package com.taskfactory.api.rest;

import com.taskfactory.agent.AgentCallback;
import com.taskfactory.agent.HttpAgentClient;
import com.taskfactory.core.exception.SessionNotFoundException;
import com.taskfactory.core.model.QAQuestion;
import com.taskfactory.core.model.QAResolution;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.qa.QARegistration;
import com.taskfactory.engine.service.WorkspaceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Endpoints the agent runner calls back into.
 */
@RestController
@RequestMapping("/api/v1/agent")
public class AgentCallbackController {

    private static final Logger log = LoggerFactory.getLogger(AgentCallbackController.class);

    private final HttpAgentClient agentClient;
    private final QAChannel qaChannel;
    private final WorkspaceService workspaceService;

    public AgentCallbackController(HttpAgentClient agentClient, QAChannel qaChannel,
                                   WorkspaceService workspaceService) {
        this.agentClient = agentClient;
        this.qaChannel = qaChannel;
        this.workspaceService = workspaceService;
    }

    /**
     * Status change of a runner session: running, idle, completed or failed.
     */
    @PostMapping("/sessions/{sessionId}/events")
    public ResponseEntity<Map<String, Object>> sessionEvent(
            @PathVariable String sessionId,
            @Valid @RequestBody SessionEventRequest request) {
        AgentCallback callback = new AgentCallback(request.type(), request.errorMessage(), request.summary());
        if (!agentClient.dispatchCallback(sessionId, callback)) {
            throw new SessionNotFoundException(sessionId, "session is unknown or already finished");
        }
        return ResponseEntity.ok(Map.of("accepted", true));
    }

    /**
     * Register clarifying questions. The response is held open until a human
     * answers or aborts.
     */
    @PostMapping("/workspaces/{workspaceId}/qa")
    public CompletableFuture<QAResolution> askQuestions(
            @PathVariable String workspaceId,
            @Valid @RequestBody AskRequest request) {
        workspaceService.getWorkspace(workspaceId);
        QARegistration registration = qaChannel.register(workspaceId, request.taskId(), request.questions());
        log.debug("Agent waiting on Q&A request {}", registration.request().requestId());
        return registration.resolution();
    }

    // ========== DTOs ==========

    public record SessionEventRequest(
        @NotBlank String type,
        String errorMessage,
        String summary
    ) {}

    public record AskRequest(
        String taskId,
        @NotEmpty List<QAQuestion> questions
    ) {}
}
