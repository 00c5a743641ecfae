package com.groviate.feedbackrewards.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Закрытый каталог достижений.
 * Каждое достижение несёт стабильный id (часть ключа идемпотентности), награду и собственный предикат.
 * Новое правило = новая константа, без ветвлений в AchievementEvaluator.
 */
@Getter
public enum Achievement {

    FIRST_FEEDBACK("first-feedback", "First Feedback",
            "Provided your first feedback", 25) {
        @Override
        public boolean isEarned(UserFeedbackHistory history) {
            return history.totalFeedbackCount() >= 1;
        }
    },

    FEEDBACK_CHAMPION("feedback-champion", "Feedback Champion",
            "Give feedback to 10 different projects", 200) {
        @Override
        public boolean isEarned(UserFeedbackHistory history) {
            return history.distinctProjectCount() >= CHAMPION_DISTINCT_PROJECTS;
        }
    },

    QUALITY_REVIEWER("quality-reviewer", "Quality Reviewer",
            "Achieve an average feedback quality score of 0.8+", 100) {
        @Override
        public boolean isEarned(UserFeedbackHistory history) {
            return history.recentQualityScores().size() >= REVIEWER_MIN_SCORED_ITEMS
                    && history.averageRecentQuality() >= REVIEWER_MIN_AVERAGE_QUALITY;
        }
    };

    public static final int CHAMPION_DISTINCT_PROJECTS = 10;
    public static final int REVIEWER_MIN_SCORED_ITEMS = 5;
    public static final double REVIEWER_MIN_AVERAGE_QUALITY = 0.8;

    private final String id;
    private final String title;
    private final String description;
    private final int pointsReward;

    Achievement(String id, String title, String description, int pointsReward) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.pointsReward = pointsReward;
    }

    public abstract boolean isEarned(UserFeedbackHistory history);

    public static Optional<Achievement> findById(String id) {
        return Arrays.stream(values())
                .filter(a -> a.getId().equals(id))
                .findFirst();
    }

    public String correlationKey(String userId) {
        return "achievement:" + userId + ":" + id;
    }
}
