package com.groviate.feedbackrewards.model;

import java.util.List;

/**
 * Срез истории отзывов пользователя, по которому проверяются достижения.
 *
 * @param totalFeedbackCount   всего отзывов
 * @param distinctProjectCount число различных проектов
 * @param recentQualityScores  качество последних оценённых отзывов, от новых к старым
 */
public record UserFeedbackHistory(String userId,
                                  long totalFeedbackCount,
                                  long distinctProjectCount,
                                  List<Double> recentQualityScores) {

    public UserFeedbackHistory {
        recentQualityScores = recentQualityScores == null ? List.of() : List.copyOf(recentQualityScores);
    }

    public double averageRecentQuality() {
        return recentQualityScores.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }
}
