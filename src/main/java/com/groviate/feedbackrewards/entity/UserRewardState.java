package com.groviate.feedbackrewards.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Агрегат: текущий баланс пользователя.
 * Пишется только журналом начислений и сверкой.
 */
@Entity
@Table(name = "user_reward_states")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRewardState {

    @Id
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "points", nullable = false)
    private Long points;

    @Column(name = "reward_level", nullable = false)
    private Integer level;

    @Column(name = "points_to_next_level", nullable = false)
    private Integer pointsToNextLevel;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static UserRewardState initial(String userId, Instant now) {
        RewardLevel first = RewardLevel.forPoints(0);
        return UserRewardState.builder()
                .userId(userId)
                .points(0L)
                .level(first.getNumber())
                .pointsToNextLevel(first.getNextThreshold())
                .updatedAt(now)
                .build();
    }

    public void applyLevel(RewardLevel rewardLevel) {
        this.level = rewardLevel.getNumber();
        this.pointsToNextLevel = rewardLevel.getNextThreshold();
    }
}
