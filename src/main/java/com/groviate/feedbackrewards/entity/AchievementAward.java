package com.groviate.feedbackrewards.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(
        name = "achievement_awards",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_achievement_awards_user_achievement",
                columnNames = {"user_id", "achievement_id"}
        )
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AchievementAward {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "achievement_id", nullable = false, length = 64)
    private String achievementId;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;
}
