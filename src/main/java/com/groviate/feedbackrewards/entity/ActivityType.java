package com.groviate.feedbackrewards.entity;

import lombok.Getter;

/**
 * Тип события в журнале начислений.
 */
@Getter
public enum ActivityType {

    FEEDBACK_GIVEN("feedback_given"),
    FEEDBACK_QUALITY("feedback_quality"),
    ACHIEVEMENT_EARNED("achievement_earned");

    private final String code;

    ActivityType(String code) {
        this.code = code;
    }
}
