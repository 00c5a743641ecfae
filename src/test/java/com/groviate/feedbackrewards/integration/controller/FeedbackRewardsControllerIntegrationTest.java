package com.groviate.feedbackrewards.integration.controller;

import com.groviate.feedbackrewards.FeedbackRewardsApplication;
import com.groviate.feedbackrewards.dto.ActivityRecordView;
import com.groviate.feedbackrewards.dto.FeedbackSubmissionResponse;
import com.groviate.feedbackrewards.dto.RewardStateResponse;
import com.groviate.feedbackrewards.dto.SubmitFeedbackRequest;
import com.groviate.feedbackrewards.exception.FeedbackValidationException;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.ReconciliationReport;
import com.groviate.feedbackrewards.service.FeedbackSubmissionService;
import com.groviate.feedbackrewards.service.ReconciliationJob;
import com.groviate.feedbackrewards.service.RewardQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = FeedbackRewardsApplication.class)
@AutoConfigureMockMvc
class FeedbackRewardsControllerIntegrationTest {

    private static final QualityMetrics METRICS = new QualityMetrics(0.9, 0.7, 0.6, 1.0);

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    FeedbackSubmissionService submissionService;
    @MockitoBean
    RewardQueryService queryService;
    @MockitoBean
    ReconciliationJob reconciliationJob;

    @Test
    @DisplayName("Отзыв сохранён -> 201 и очки в ответе")
    void givenAcceptedFeedbackWhenPostThenReturns201() throws Exception {
        when(submissionService.submitFeedback(any(SubmitFeedbackRequest.class)))
                .thenReturn(FeedbackSubmissionResponse.accepted(42L, 28, METRICS, "Feedback submitted successfully"));

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(feedbackJson("Good idea, you should add hints")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.feedbackId").value(42))
                .andExpect(jsonPath("$.pointsAwarded").value(28))
                .andExpect(jsonPath("$.qualityMetrics.specificity").value(0.9));
    }

    @Test
    @DisplayName("Отзыв не сохранён -> 503 и success=false")
    void givenPersistFailureWhenPostThenReturns503() throws Exception {
        when(submissionService.submitFeedback(any(SubmitFeedbackRequest.class)))
                .thenReturn(FeedbackSubmissionResponse.failure(METRICS, "Feedback could not be saved"));

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(feedbackJson("text")))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("Ошибка валидации сервиса -> 400 с кодом FEEDBACK_VALIDATION")
    void givenValidationErrorWhenPostThenReturns400WithCode() throws Exception {
        when(submissionService.submitFeedback(any(SubmitFeedbackRequest.class)))
                .thenThrow(new FeedbackValidationException("Feedback content must not be empty"));

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(feedbackJson("")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("FEEDBACK_VALIDATION"))
                .andExpect(jsonPath("$.path").value("/api/v1/feedback"));
    }

    @Test
    @DisplayName("Слишком длинный projectId -> 400 REQUEST_VALIDATION, сервис не вызывается")
    void givenTooLongProjectIdWhenPostThenRequestValidationError() throws Exception {
        String body = """
                {"projectId": "%s", "authorId": "u1", "content": "text"}
                """.formatted("p".repeat(65));

        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("REQUEST_VALIDATION"));

        verifyNoInteractions(submissionService);
    }

    @Test
    @DisplayName("Битый JSON -> 400 REQUEST_VALIDATION")
    void givenMalformedJsonWhenPostThenRequestValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("REQUEST_VALIDATION"));
    }

    @Test
    @DisplayName("Неожиданная ошибка -> 500 UNEXPECTED без деталей")
    void givenUnexpectedErrorWhenGetStateThenReturns500() throws Exception {
        when(queryService.getState("u1")).thenThrow(new IllegalStateException("secret details"));

        mockMvc.perform(get("/api/v1/rewards/u1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("UNEXPECTED"))
                .andExpect(jsonPath("$.message").value("Unexpected server error"));
    }

    @Test
    @DisplayName("GET баланса -> очки, уровень и порог следующего уровня")
    void givenUserWhenGetStateThenReturnsState() throws Exception {
        when(queryService.getState("u1")).thenReturn(new RewardStateResponse("u1", 135L, 2, 250));

        mockMvc.perform(get("/api/v1/rewards/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points").value(135))
                .andExpect(jsonPath("$.level").value(2))
                .andExpect(jsonPath("$.pointsToNextLevel").value(250));
    }

    @Test
    @DisplayName("GET истории -> limit передаётся в сервис")
    void givenLimitWhenGetActivityThenPassedToService() throws Exception {
        when(queryService.getRecentActivity("u1", 5)).thenReturn(List.of(
                new ActivityRecordView(1L, "feedback_given", 10, "feedback:1:base", null,
                        Instant.parse("2026-03-01T10:00:00Z"))));

        mockMvc.perform(get("/api/v1/rewards/u1/activity").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].correlationKey").value("feedback:1:base"))
                .andExpect(jsonPath("$[0].points").value(10));

        verify(queryService).getRecentActivity("u1", 5);
    }

    @Test
    @DisplayName("POST сверки -> отчёт с drift")
    void givenUserWhenReconcileThenReturnsReport() throws Exception {
        when(reconciliationJob.reconcile("u1")).thenReturn(ReconciliationReport.of("u1", 120, 135));

        mockMvc.perform(post("/api/v1/rewards/u1/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previousTotal").value(120))
                .andExpect(jsonPath("$.correctedTotal").value(135))
                .andExpect(jsonPath("$.drift").value(15));
    }

    private static String feedbackJson(String content) {
        return """
                {"projectId": "p1", "authorId": "u1", "content": "%s"}
                """.formatted(content);
    }
}
