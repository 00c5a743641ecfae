package com.groviate.feedbackrewards.exception;

import org.springframework.http.HttpStatus;

/**
 * Ошибка внешней оценки, которую не имеет смысла ретраить.
 * Примеры: 400 (плохой запрос), 401/403 (ключ/права), NonTransientAiException.
 */
public class QualityScoringRejectedException extends FeedbackRewardsException {

    public QualityScoringRejectedException(String message, Throwable cause) {
        super("QUALITY_SCORING_REJECTED", HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
