package com.taskfactory.api.rest;

import com.taskfactory.core.exception.RequestNotFoundException;
import com.taskfactory.core.model.PendingQARequest;
import com.taskfactory.core.model.QAAnswer;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.service.WorkspaceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for answering the clarifying questions an agent asked.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/qa")
public class QAController {

    private final QAChannel qaChannel;
    private final WorkspaceService workspaceService;

    public QAController(QAChannel qaChannel, WorkspaceService workspaceService) {
        this.qaChannel = qaChannel;
        this.workspaceService = workspaceService;
    }

    /**
     * Poll fallback for clients that missed the qa:request event.
     */
    @GetMapping("/pending")
    public ResponseEntity<PendingQARequest> getPending(@PathVariable String workspaceId) {
        workspaceService.getWorkspace(workspaceId);
        return qaChannel.pending(workspaceId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/respond")
    public ResponseEntity<Map<String, Object>> respond(
            @PathVariable String workspaceId,
            @Valid @RequestBody RespondRequest request) {
        if (!qaChannel.respond(workspaceId, request.requestId(), request.answers())) {
            throw new RequestNotFoundException(request.requestId());
        }
        return ResponseEntity.ok(Map.of("resolved", true));
    }

    /**
     * Let the agent carry on without answers.
     */
    @PostMapping("/abort")
    public ResponseEntity<Map<String, Object>> abort(
            @PathVariable String workspaceId,
            @Valid @RequestBody AbortRequest request) {
        if (!qaChannel.abort(workspaceId, request.requestId())) {
            throw new RequestNotFoundException(request.requestId());
        }
        return ResponseEntity.ok(Map.of("resolved", true));
    }

    // ========== DTOs ==========

    public record RespondRequest(
        @NotBlank String requestId,
        List<QAAnswer> answers
    ) {}

    public record AbortRequest(
        @NotBlank String requestId
    ) {}
}
