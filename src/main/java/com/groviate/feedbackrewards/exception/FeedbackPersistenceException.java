package com.groviate.feedbackrewards.exception;

import org.springframework.http.HttpStatus;

/**
 * Не удалось сохранить сам отзыв.
 */
public class FeedbackPersistenceException extends FeedbackRewardsException {

    public FeedbackPersistenceException(String message, Throwable cause) {
        super("FEEDBACK_PERSISTENCE", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
