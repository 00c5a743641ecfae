package com.groviate.feedbackrewards.dto;

import java.time.Instant;

public record EarnedAchievementView(
        String achievementId,
        String title,
        String description,
        int pointsReward,
        Instant earnedAt
) {
}
