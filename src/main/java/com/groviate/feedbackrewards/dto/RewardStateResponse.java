package com.groviate.feedbackrewards.dto;

import com.groviate.feedbackrewards.entity.RewardLevel;
import com.groviate.feedbackrewards.entity.UserRewardState;

public record RewardStateResponse(String userId, long points, int level, int pointsToNextLevel) {

    public static RewardStateResponse from(UserRewardState state) {
        return new RewardStateResponse(
                state.getUserId(),
                state.getPoints() != null ? state.getPoints() : 0L,
                state.getLevel(),
                state.getPointsToNextLevel());
    }

    /**
     * Пользователь ещё ничего не получал.
     */
    public static RewardStateResponse empty(String userId) {
        RewardLevel first = RewardLevel.forPoints(0);
        return new RewardStateResponse(userId, 0L, first.getNumber(), first.getNextThreshold());
    }
}
