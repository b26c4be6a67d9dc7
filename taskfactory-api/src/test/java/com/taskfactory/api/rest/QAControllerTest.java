package com.taskfactory.api.rest;

import com.taskfactory.core.model.PendingQARequest;
import com.taskfactory.core.model.QAAnswer;
import com.taskfactory.core.model.QAQuestion;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.service.WorkspaceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(QAController.class)
class QAControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QAChannel qaChannel;

    @MockBean
    private WorkspaceService workspaceService;

    @Test
    @DisplayName("No pending request gives an empty response")
    void noPendingRequest() throws Exception {
        when(qaChannel.pending("ws-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/workspaces/ws-1/qa/pending"))
            .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Pending request is returned with its questions")
    void pendingRequest() throws Exception {
        PendingQARequest request = PendingQARequest.create("ws-1", "TASK-1",
            List.of(new QAQuestion("q1", "Which database?", List.of("postgres", "sqlite"))));
        when(qaChannel.pending("ws-1")).thenReturn(Optional.of(request));

        mockMvc.perform(get("/api/v1/workspaces/ws-1/qa/pending"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestId").value(request.requestId()))
            .andExpect(jsonPath("$.questions[0].options[1]").value("sqlite"));
    }

    @Test
    @DisplayName("Answers resolve the pending request")
    void respond() throws Exception {
        List<QAAnswer> answers = List.of(new QAAnswer("q1", "postgres"));
        when(qaChannel.respond("ws-1", "req-1", answers)).thenReturn(true);

        mockMvc.perform(post("/api/v1/workspaces/ws-1/qa/respond")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requestId\":\"req-1\",\"answers\":[{\"questionId\":\"q1\",\"selectedOption\":\"postgres\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resolved").value(true));

        verify(qaChannel).respond("ws-1", "req-1", answers);
    }

    @Test
    @DisplayName("Answering an unknown request is not found")
    void respondToUnknownRequest() throws Exception {
        mockMvc.perform(post("/api/v1/workspaces/ws-1/qa/respond")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requestId\":\"gone\",\"answers\":[]}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("REQUEST_NOT_FOUND"));
    }

    @Test
    @DisplayName("A request is answered only through the workspace that owns it")
    void respondThroughOtherWorkspace() throws Exception {
        List<QAAnswer> answers = List.of(new QAAnswer("q1", "postgres"));
        when(qaChannel.respond("ws-1", "req-1", answers)).thenReturn(true);

        mockMvc.perform(post("/api/v1/workspaces/ws-2/qa/respond")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requestId\":\"req-1\",\"answers\":[{\"questionId\":\"q1\",\"selectedOption\":\"postgres\"}]}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("REQUEST_NOT_FOUND"));

        verify(qaChannel).respond("ws-2", "req-1", answers);
    }

    @Test
    @DisplayName("Abort resolves the request without answers")
    void abort() throws Exception {
        when(qaChannel.abort("ws-1", "req-1")).thenReturn(true);

        mockMvc.perform(post("/api/v1/workspaces/ws-1/qa/abort")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requestId\":\"req-1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resolved").value(true));
    }
}
