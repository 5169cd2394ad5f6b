package com.governance.api.rest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StateMachineControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = new ControlPlaneFixture().mockMvc;
    }

    @Test
    void states_shouldListEveryState() throws Exception {
        mockMvc.perform(get("/api/v1/state-machine/states"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(8)));

        mockMvc.perform(get("/api/v1/state-machine/states/{name}", "MERGE_READY"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.terminal").value(false))
            .andExpect(jsonPath("$.requiredChecks", contains("build", "test", "review")));

        mockMvc.perform(get("/api/v1/state-machine/states/{name}", "IMPLEMENTING"))
            .andExpect(jsonPath("$.labels", contains("status:implementing", "in-progress")));
    }

    @Test
    void state_unknown_shouldBeNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/state-machine/states/{name}", "LIMBO"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void nextStates_ofTerminalState_shouldBeEmpty() throws Exception {
        mockMvc.perform(get("/api/v1/state-machine/states/{name}/next", "DONE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.terminal").value(true))
            .andExpect(jsonPath("$.nextStates", hasSize(0)));
    }

    @Test
    void checkTransition_reportsMissingEvidence() throws Exception {
        mockMvc.perform(post("/api/v1/state-machine/transitions/check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\": \"CREATED\", \"to\": \"SPEC_READY\", \"evidence\": {\"spec_complete\": true}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allowed").value(false))
            .andExpect(jsonPath("$.code").value("PRECONDITIONS_UNMET"))
            .andExpect(jsonPath("$.transition").value("CREATED_TO_SPEC_READY"))
            .andExpect(jsonPath("$.missingPreconditions", contains("draft_valid")));
    }

    @Test
    void checkTransition_automaticOnTrigger() throws Exception {
        mockMvc.perform(post("/api/v1/state-machine/transitions/check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\": \"MERGE_READY\", \"to\": \"DONE\", \"trigger\": \"pr_merged\", \"evidence\": {\"pr_merged\": true}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allowed").value(true))
            .andExpect(jsonPath("$.code").value("TRANSITION_ALLOWED"));

        mockMvc.perform(post("/api/v1/state-machine/transitions/check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"from\": \"CREATED\", \"to\": \"DONE\"}"))
            .andExpect(jsonPath("$.code").value("NOT_A_SUCCESSOR"))
            .andExpect(jsonPath("$.transition").value(nullValue()));
    }

    @Test
    void mapExternal_perSource() throws Exception {
        mockMvc.perform(get("/api/v1/state-machine/external/{source}/{status}", "pr-status", "approved"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("PR_STATUS"))
            .andExpect(jsonPath("$.state").value("MERGE_READY"));

        mockMvc.perform(get("/api/v1/state-machine/external/{source}/{status}", "project_status", "Closed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value(nullValue()));

        mockMvc.perform(get("/api/v1/state-machine/external/{source}/{status}", "email", "sent"))
            .andExpect(status().isBadRequest());
    }
}
