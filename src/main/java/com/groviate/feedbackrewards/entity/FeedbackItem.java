package com.groviate.feedbackrewards.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Отзыв пользователя о проекте вместе с производными оценками качества.
 * После сохранения меняется только pointsAwarded.
 */
@Entity
@Table(
        name = "feedback_items",
        indexes = {
                @Index(name = "idx_feedback_items_author_created", columnList = "author_id, created_at"),
                @Index(name = "idx_feedback_items_project", columnList = "project_id")
        }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "author_id", nullable = false, length = 64)
    private String authorId;

    @Column(name = "content", nullable = false, length = 10000)
    private String content;

    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "subcategory", length = 64)
    private String subcategory;

    @Column(name = "specificity_score")
    private Double specificityScore;

    @Column(name = "actionability_score")
    private Double actionabilityScore;

    @Column(name = "novelty_score")
    private Double noveltyScore;

    @Column(name = "sentiment")
    private Double sentiment;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "points_awarded", nullable = false)
    private Integer pointsAwarded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (pointsAwarded == null) pointsAwarded = 0;
    }
}
