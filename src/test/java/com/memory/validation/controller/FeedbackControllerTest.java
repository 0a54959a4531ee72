package com.memory.validation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.validation.model.HumanDecision;
import com.memory.validation.model.ValidationFeedback;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.service.FeedbackService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static com.memory.validation.testutil.TestDataFactory.createFeedback;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FeedbackController.class)
class FeedbackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FeedbackService feedbackService;

    @Test
    void submit_success() throws Exception {
        ValidationFeedback feedback = createFeedback("MEM-1", ValidationOutcome.AUTO_APPROVE,
                HumanDecision.REJECTED, 0.81);
        when(feedbackService.submit(any(ValidationFeedback.class))).thenReturn(feedback);

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "recordId", "MEM-1",
                                "predictedDecision", "AUTO_APPROVE",
                                "actualDecision", "REJECTED",
                                "reviewerConfidence", 0.9,
                                "timeTakenSeconds", 45,
                                "qualityRating", 4,
                                "predictedConfidence", 0.81))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordId").value("MEM-1"))
                .andExpect(jsonPath("$.actualDecision").value("REJECTED"))
                .andExpect(jsonPath("$.falsePositive").value(true));
    }

    @Test
    void submit_invalid_returns400() throws Exception {
        when(feedbackService.submit(any(ValidationFeedback.class)))
                .thenThrow(new IllegalArgumentException("qualityRating must be between 1 and 5"));

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "recordId", "MEM-1",
                                "predictedDecision", "AUTO_APPROVE",
                                "actualDecision", "APPROVED",
                                "qualityRating", 9))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("qualityRating must be between 1 and 5"));
    }
}
