package com.taskfactory.api.rest;

import com.taskfactory.core.exception.ConfigurationValidationException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.automation.AutomationEngine;
import com.taskfactory.engine.automation.AutomationSettings;
import com.taskfactory.engine.service.WorkspaceService;
import com.taskfactory.scheduler.BreakerStatus;
import com.taskfactory.scheduler.QueueCoordinator;
import com.taskfactory.scheduler.QueueStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkspaceController.class)
class WorkspaceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WorkspaceService workspaceService;

    @MockBean
    private AutomationEngine automationEngine;

    @MockBean
    private QueueCoordinator queueCoordinator;

    @Test
    @DisplayName("POST /workspaces creates a workspace")
    void createWorkspace() throws Exception {
        Workspace workspace = Workspace.create("demo", "/work/demo");
        when(workspaceService.createWorkspace("demo", "/work/demo")).thenReturn(workspace);

        mockMvc.perform(post("/api/v1/workspaces")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"demo\",\"rootPath\":\"/work/demo\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(workspace.id()))
            .andExpect(jsonPath("$.name").value("demo"));
    }

    @Test
    @DisplayName("POST /workspaces without a name is rejected")
    void createWorkspaceWithoutName() throws Exception {
        mockMvc.perform(post("/api/v1/workspaces")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"\",\"rootPath\":\"/work/demo\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.name").exists());
    }

    @Test
    @DisplayName("Unknown workspace maps to 404")
    void unknownWorkspace() throws Exception {
        when(workspaceService.getWorkspace("missing")).thenThrow(new NotFoundException("Workspace", "missing"));

        mockMvc.perform(get("/api/v1/workspaces/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("Workspace not found: missing"));
    }

    @Test
    @DisplayName("DELETE /workspaces/{ws} cascades and returns 204")
    void deleteWorkspace() throws Exception {
        mockMvc.perform(delete("/api/v1/workspaces/ws-1"))
            .andExpect(status().isNoContent());

        verify(workspaceService).deleteWorkspace("ws-1");
    }

    @Test
    @DisplayName("Negative WIP overrides are reported with their errors")
    void invalidConfig() throws Exception {
        when(workspaceService.updateWipLimits(eq("ws-1"), anyMap()))
            .thenThrow(new ConfigurationValidationException(List.of("WIP limit for executing must be >= 0")));

        mockMvc.perform(put("/api/v1/workspaces/ws-1/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wipLimits\":{\"executing\":-1}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_CONFIGURATION"))
            .andExpect(jsonPath("$.details.errors[0]").value("WIP limit for executing must be >= 0"));
    }

    @Test
    @DisplayName("PUT /automation passes only the toggles that were sent")
    void updateAutomation() throws Exception {
        when(automationEngine.updateAutomation("ws-1", true, null)).thenReturn(new AutomationSettings(true, true));

        mockMvc.perform(put("/api/v1/workspaces/ws-1/automation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"promoteOnPlanReady\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.promoteOnPlanReady").value(true))
            .andExpect(jsonPath("$.autoExecute").value(true));

        verify(automationEngine).updateAutomation("ws-1", true, null);
    }

    @Test
    @DisplayName("POST /queue/start returns the queue status")
    void startQueue() throws Exception {
        QueueStatus status = new QueueStatus("ws-1", true, List.of("TASK-1"), 2, 1, BreakerStatus.closed(0));
        when(queueCoordinator.startQueueProcessing(any())).thenReturn(status);

        mockMvc.perform(post("/api/v1/workspaces/ws-1/queue/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.enabled").value(true))
            .andExpect(jsonPath("$.runningTaskIds[0]").value("TASK-1"))
            .andExpect(jsonPath("$.tasksInReady").value(2))
            .andExpect(jsonPath("$.breaker.open").value(false));
    }
}
