package com.groviate.feedbackrewards.exception;

import org.springframework.http.HttpStatus;

/**
 * Невалидный отзыв (пустой текст, нет автора/проекта, превышена длина).
 * Бросается до любой записи в БД.
 */
public class FeedbackValidationException extends FeedbackRewardsException {

    public FeedbackValidationException(String message) {
        super("FEEDBACK_VALIDATION", HttpStatus.BAD_REQUEST, message);
    }
}
