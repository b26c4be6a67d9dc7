package com.taskfactory.api.rest;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.automation.AutomationEngine;
import com.taskfactory.engine.automation.AutomationSettings;
import com.taskfactory.engine.service.WorkspaceService;
import com.taskfactory.scheduler.QueueCoordinator;
import com.taskfactory.scheduler.QueueStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for workspaces, their WIP overrides, automation and queue.
 */
@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final AutomationEngine automationEngine;
    private final QueueCoordinator queueCoordinator;

    public WorkspaceController(
            WorkspaceService workspaceService,
            AutomationEngine automationEngine,
            QueueCoordinator queueCoordinator) {
        this.workspaceService = workspaceService;
        this.automationEngine = automationEngine;
        this.queueCoordinator = queueCoordinator;
    }

    @GetMapping
    public ResponseEntity<List<Workspace>> listWorkspaces() {
        return ResponseEntity.ok(workspaceService.listWorkspaces());
    }

    @PostMapping
    public ResponseEntity<Workspace> createWorkspace(@Valid @RequestBody CreateWorkspaceRequest request) {
        Workspace workspace = workspaceService.createWorkspace(request.name(), request.rootPath());
        return ResponseEntity.status(HttpStatus.CREATED).body(workspace);
    }

    @GetMapping("/{workspaceId}")
    public ResponseEntity<Workspace> getWorkspace(@PathVariable String workspaceId) {
        return ResponseEntity.ok(workspaceService.getWorkspace(workspaceId));
    }

    /**
     * Delete a workspace with its tasks, sessions and pending Q&A.
     */
    @DeleteMapping("/{workspaceId}")
    public ResponseEntity<Void> deleteWorkspace(@PathVariable String workspaceId) {
        workspaceService.deleteWorkspace(workspaceId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Replace the workspace's WIP overrides. A null limit falls back to the global default.
     */
    @PutMapping("/{workspaceId}/config")
    public ResponseEntity<Workspace> updateConfig(
            @PathVariable String workspaceId,
            @Valid @RequestBody UpdateConfigRequest request) {
        return ResponseEntity.ok(workspaceService.updateWipLimits(workspaceId, request.wipLimits()));
    }

    @GetMapping("/{workspaceId}/automation")
    public ResponseEntity<AutomationSettings> getAutomation(@PathVariable String workspaceId) {
        workspaceService.getWorkspace(workspaceId);
        return ResponseEntity.ok(automationEngine.settings(workspaceId));
    }

    @PutMapping("/{workspaceId}/automation")
    public ResponseEntity<AutomationSettings> updateAutomation(
            @PathVariable String workspaceId,
            @RequestBody AutomationRequest request) {
        workspaceService.getWorkspace(workspaceId);
        return ResponseEntity.ok(automationEngine.updateAutomation(
            workspaceId, request.promoteOnPlanReady(), request.autoExecute()));
    }

    // ========== Queue ==========

    @GetMapping("/{workspaceId}/queue")
    public ResponseEntity<QueueStatus> getQueueStatus(@PathVariable String workspaceId) {
        return ResponseEntity.ok(queueCoordinator.status(workspaceId));
    }

    /**
     * Resume queue processing. Also clears an open execution breaker.
     */
    @PostMapping("/{workspaceId}/queue/start")
    public ResponseEntity<QueueStatus> startQueue(@PathVariable String workspaceId) {
        return ResponseEntity.ok(queueCoordinator.startQueueProcessing(workspaceId));
    }

    @PostMapping("/{workspaceId}/queue/stop")
    public ResponseEntity<QueueStatus> stopQueue(@PathVariable String workspaceId) {
        return ResponseEntity.ok(queueCoordinator.stopQueueProcessing(workspaceId));
    }

    // ========== DTOs ==========

    public record CreateWorkspaceRequest(
        @NotBlank String name,
        @NotBlank String rootPath
    ) {}

    public record UpdateConfigRequest(
        @NotNull Map<Phase, Integer> wipLimits
    ) {}

    public record AutomationRequest(
        Boolean promoteOnPlanReady,
        Boolean autoExecute
    ) {}
}
