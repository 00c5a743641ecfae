package com.groviate.feedbackrewards.controller;

import com.groviate.feedbackrewards.dto.FeedbackSubmissionResponse;
import com.groviate.feedbackrewards.dto.QualityPreviewRequest;
import com.groviate.feedbackrewards.dto.QualityPreviewResponse;
import com.groviate.feedbackrewards.dto.SubmitFeedbackRequest;
import com.groviate.feedbackrewards.service.FeedbackSubmissionService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Приём отзывов и предпросмотр оценки качества.
 */
@RestController
@Slf4j
@RequestMapping("/api/v1/feedback")
public class FeedbackController {

    private final FeedbackSubmissionService submissionService;

    public FeedbackController(FeedbackSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    /**
     * {@code POST /api/v1/feedback}
     *
     * @return 201 если отзыв сохранён (даже если награды ещё начисляются), 503 если сохранить не удалось
     */
    @PostMapping
    public ResponseEntity<FeedbackSubmissionResponse> submit(@Valid @RequestBody SubmitFeedbackRequest request) {
        FeedbackSubmissionResponse response = submissionService.submitFeedback(request);
        HttpStatus status = response.success() ? HttpStatus.CREATED : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/quality/preview")
    public QualityPreviewResponse preview(@Valid @RequestBody QualityPreviewRequest request) {
        return submissionService.previewQuality(request.content());
    }
}
