package com.groviate.feedbackrewards.exception;

import org.springframework.http.HttpStatus;

/**
 * Временная ошибка внешней оценки качества (таймаут, 5xx, битый ответ). Ретраится.
 */
public class QualityScoringException extends FeedbackRewardsException {

    public QualityScoringException(String message, Throwable cause) {
        super("QUALITY_SCORING", HttpStatus.BAD_GATEWAY, message, cause);
    }

    public QualityScoringException(String message) {
        super("QUALITY_SCORING", HttpStatus.BAD_GATEWAY, message);
    }
}
