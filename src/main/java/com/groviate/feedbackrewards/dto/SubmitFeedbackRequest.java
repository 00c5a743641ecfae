package com.groviate.feedbackrewards.dto;

import jakarta.validation.constraints.Size;

/**
 * Запрос на отправку отзыва. Пустые поля проверяет сервис (FEEDBACK_VALIDATION).
 */
public record SubmitFeedbackRequest(
        @Size(max = 64) String projectId,
        @Size(max = 64) String authorId,
        String content,
        @Size(max = 64) String category
) {
}
