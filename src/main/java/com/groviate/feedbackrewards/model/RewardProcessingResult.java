package com.groviate.feedbackrewards.model;

import java.util.List;

/**
 * Итог фонового начисления наград за один отзыв.
 *
 * @param creditedPoints очки, фактически записанные в журнал за сам отзыв (база + качество)
 * @param complete       все начисления за отзыв записаны (или уже были записаны ранее)
 */
public record RewardProcessingResult(Long feedbackId,
                                     int creditedPoints,
                                     boolean complete,
                                     List<String> earnedAchievements) {

    public RewardProcessingResult {
        earnedAchievements = earnedAchievements == null ? List.of() : List.copyOf(earnedAchievements);
    }

    public static RewardProcessingResult failed(Long feedbackId) {
        return new RewardProcessingResult(feedbackId, 0, false, List.of());
    }
}
