package com.governance.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RunControllerTest {

    private static final String PUBLISH = """
        {
          "playbookId": "issue-publish",
          "environment": "staging",
          "triggeredBy": "ci",
          "variables": {"input": {"owner": "acme", "repo": "web", "canonicalId": "I001", "title": "Hello", "publish": true}}
        }
        """;

    private static final String MERGE = """
        {
          "playbookId": "pr-merge",
          "environment": "production",
          "triggeredBy": "ci",
          "variables": {"input": {"owner": "acme", "repo": "web", "prNumber": 42}, "evidence": {"pr_merged": true}}
        }
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = new ControlPlaneFixture().mockMvc;
    }

    private String start(String body) throws Exception {
        String response = mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode run = objectMapper.readTree(response);
        return run.get("runId").asText();
    }

    @Test
    void startRun_issuePublish_shouldComplete() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PUBLISH))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.environment").value("staging"))
            .andExpect(jsonPath("$.steps", hasSize(2)))
            .andExpect(jsonPath("$.steps[1].stepName").value("publish"))
            .andExpect(jsonPath("$.steps[1].status").value("SUCCEEDED"))
            .andExpect(jsonPath("$.steps[1].attempts").value(1))
            .andExpect(jsonPath("$.summary.total").value(2))
            .andExpect(jsonPath("$.summary.succeeded").value(2))
            .andExpect(jsonPath("$.variables.published.title").value("Hello"));
    }

    @Test
    @DisplayName("pr-merge waits on approval; resuming grants it and finishes the run")
    void resumeRun_afterApprovalPause_shouldComplete() throws Exception {
        String runId = start(MERGE);

        mockMvc.perform(get("/api/v1/runs/{runId}", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PAUSED"))
            .andExpect(jsonPath("$.approvalStepIndex").value(0))
            .andExpect(jsonPath("$.steps[0].errorCode").value("APPROVAL_REQUIRED"));

        mockMvc.perform(post("/api/v1/runs/{runId}/resume", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resumedBy\": \"alice\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.approvalGrantedBy").value("alice"))
            .andExpect(jsonPath("$.summary.succeeded").value(2));
    }

    @Test
    void resumeRun_withoutAdvance_shouldLeaveRunRunning() throws Exception {
        String runId = start(MERGE);

        mockMvc.perform(post("/api/v1/runs/{runId}/resume", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resumedBy\": \"alice\", \"advance\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"));

        mockMvc.perform(get("/api/v1/runs/recoverable"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].runId").value(runId));

        mockMvc.perform(post("/api/v1/runs/{runId}/advance", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void operatorActions_onWrongStatus_shouldConflict() throws Exception {
        String runId = start(PUBLISH);

        mockMvc.perform(post("/api/v1/runs/{runId}/pause", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"pausedBy\": \"bob\", \"reason\": \"too late\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));

        mockMvc.perform(post("/api/v1/runs/{runId}/cancel", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cancelledBy\": \"bob\"}"))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/runs/{runId}/resume", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resumedBy\": \"bob\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void resumeRun_withoutActor_shouldBeBadRequest() throws Exception {
        String runId = start(MERGE);

        mockMvc.perform(post("/api/v1/runs/{runId}/resume", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"advance\": false}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(GlobalExceptionHandler.BAD_REQUEST));
    }

    @Test
    void unknownRunsAndPlaybooks() throws Exception {
        String body = mockMvc.perform(get("/api/v1/runs/{runId}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.retryable").value(false))
            .andReturn().getResponse().getContentAsString();
        assertEquals("NOT_FOUND", objectMapper.readTree(body).get("errorCode").asText());

        mockMvc.perform(get("/api/v1/runs/{runId}", "not-a-uuid"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"playbookId\": \"nope\", \"environment\": \"staging\", \"triggeredBy\": \"ci\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }
}
