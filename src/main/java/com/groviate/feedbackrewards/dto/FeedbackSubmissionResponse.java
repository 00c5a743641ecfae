package com.groviate.feedbackrewards.dto;

import com.groviate.feedbackrewards.model.QualityMetrics;

public record FeedbackSubmissionResponse(
        boolean success,
        Long feedbackId,
        Integer pointsAwarded,
        QualityMetrics qualityMetrics,
        String message
) {

    public static FeedbackSubmissionResponse accepted(Long feedbackId,
                                                      int pointsAwarded,
                                                      QualityMetrics metrics,
                                                      String message) {
        return new FeedbackSubmissionResponse(true, feedbackId, pointsAwarded, metrics, message);
    }

    public static FeedbackSubmissionResponse failure(QualityMetrics metrics, String message) {
        return new FeedbackSubmissionResponse(false, null, null, metrics, message);
    }
}
