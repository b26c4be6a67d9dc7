package com.taskfactory.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class TaskFactoryApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Workspace and task round trip through the full context")
    void createWorkspaceAndTask() throws Exception {
        String body = mockMvc.perform(post("/api/v1/workspaces")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"smoke\",\"rootPath\":\"/work/smoke\"}"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode workspace = objectMapper.readTree(body);
        String tasks = "/api/v1/workspaces/" + workspace.path("id").asText() + "/tasks";

        mockMvc.perform(post(tasks)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Add login\",\"acceptanceCriteria\":[\"user can sign in\"]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.phase").value("backlog"));

        mockMvc.perform(get(tasks).param("phase", "backlog"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].title").value("Add login"));

        mockMvc.perform(get("/api/v1/workspaces/" + workspace.path("id").asText() + "/queue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.breaker.open").value(false));
    }

    @Test
    @DisplayName("Health reports the task factory component")
    void healthIncludesTaskFactory() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.taskFactory.status").value("UP"));
    }
}
