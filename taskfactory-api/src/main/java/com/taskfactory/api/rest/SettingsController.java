package com.taskfactory.api.rest;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.WorkflowSettings;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.scheduler.QueueCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for the global workflow defaults. Changes apply to the next check
 * without a restart.
 */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final WorkflowSettingsResolver settingsResolver;
    private final QueueCoordinator queueCoordinator;

    public SettingsController(WorkflowSettingsResolver settingsResolver, QueueCoordinator queueCoordinator) {
        this.settingsResolver = settingsResolver;
        this.queueCoordinator = queueCoordinator;
    }

    @GetMapping("/workflow")
    public ResponseEntity<WorkflowSettings> getWorkflowSettings() {
        return ResponseEntity.ok(settingsResolver.globalDefaults());
    }

    /**
     * Update global limits and automation defaults. Phases absent from
     * {@code wipLimits} keep their limit; a null value makes a phase unlimited.
     */
    @PutMapping("/workflow")
    public ResponseEntity<WorkflowSettings> updateWorkflowSettings(@RequestBody UpdateWorkflowRequest request) {
        WorkflowSettings updated = settingsResolver.updateGlobalDefaults(
            request.wipLimits(), request.promoteOnPlanReady(), request.autoExecute());
        // A raised limit or re-enabled auto-execute may unblock any queue.
        queueCoordinator.kickAll();
        return ResponseEntity.ok(updated);
    }

    // ========== DTOs ==========

    public record UpdateWorkflowRequest(
        Map<Phase, Integer> wipLimits,
        Boolean promoteOnPlanReady,
        Boolean autoExecute
    ) {}
}
