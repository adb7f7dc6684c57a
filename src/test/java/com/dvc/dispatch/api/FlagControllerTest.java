package com.dvc.dispatch.api;

import com.dvc.core.orchestrator.ChallengeOrchestrator;
import com.dvc.core.orchestrator.FlagResult;
import com.dvc.core.orchestrator.FlagSubmission;
import com.dvc.core.orchestrator.InvalidSessionException;
import com.dvc.core.orchestrator.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FlagController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class FlagControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ChallengeOrchestrator orchestrator;

    @Test
    @DisplayName("POST /flags returns the result of a correct flag")
    void correctFlag() throws Exception {
        when(orchestrator.validateFlagSubmission("abc123", "flag{0123456789abcdef}")).thenReturn(
                new FlagResult("abc123", true, "Correct! Challenge completed.", 100, 30L, null));

        mockMvc.perform(post("/api/v1/flags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"abc123\",\"flag\":\"flag{0123456789abcdef}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.points").value(100))
                .andExpect(jsonPath("$.grace_seconds").value(30));
    }

    @Test
    @DisplayName("POST /flags for a wrong flag returns 200 with valid=false and no hints")
    void wrongFlag() throws Exception {
        when(orchestrator.validateFlagSubmission(any(), any()))
                .thenReturn(new FlagResult("abc123", false, "Incorrect flag", null, null, null));

        mockMvc.perform(post("/api/v1/flags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"abc123\",\"flag\":\"flag{nope}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.message").value("Incorrect flag"))
                .andExpect(jsonPath("$.points").doesNotExist());
    }

    @Test
    @DisplayName("POST /flags for an unknown session returns 404")
    void unknownSession() throws Exception {
        when(orchestrator.validateFlagSubmission(any(), any()))
                .thenThrow(new InvalidSessionException("Unknown session: missing"));

        mockMvc.perform(post("/api/v1/flags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"missing\",\"flag\":\"flag{0123456789abcdef}\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("INVALID_SESSION"));
    }

    @Test
    @DisplayName("POST /flags/batch summarises the results")
    void batch() throws Exception {
        var submissions = List.of(
                new FlagSubmission("a", "flag{0123456789abcdef}"),
                new FlagSubmission("b", "flag{fedcba9876543210}"));
        when(orchestrator.validateFlagBatch(submissions)).thenReturn(List.of(
                new FlagResult("a", true, "Correct!", 100, 30L, null),
                new FlagResult("b", false, "Unknown session: b", null, null, "INVALID_SESSION")));

        mockMvc.perform(post("/api/v1/flags/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FlagBatchRequest(submissions))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.valid").value(1))
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[1].error").value("INVALID_SESSION"));
    }

    @Test
    @DisplayName("POST /flags/batch with more than 50 submissions returns 400")
    void batchTooLarge() throws Exception {
        var submissions = new ArrayList<FlagSubmission>();
        for (int i = 0; i < 51; i++) {
            submissions.add(new FlagSubmission("s" + i, "flag{0123456789abcdef}"));
        }

        mockMvc.perform(post("/api/v1/flags/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FlagBatchRequest(submissions))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("50")));
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("POST /flags/batch with no submissions returns 400")
    void batchEmpty() throws Exception {
        when(orchestrator.validateFlagBatch(any()))
                .thenThrow(new ValidationException("At least one submission is required"));

        mockMvc.perform(post("/api/v1/flags/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissions\":[]}"))
                .andExpect(status().isBadRequest());
    }
}
