package com.groviate.feedbackrewards.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Запись журнала начислений (append-only).
 * correlationKey уникален на одно логическое событие и служит границей идемпотентности.
 */
@Entity
@Table(
        name = "activity_records",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_activity_records_correlation_key",
                columnNames = {"correlation_key"}
        ),
        indexes = @Index(name = "idx_activity_records_user", columnList = "user_id")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 32)
    private ActivityType activityType;

    @Column(name = "points", nullable = false)
    private Integer points;

    @Column(name = "correlation_key", nullable = false, length = 200)
    private String correlationKey;

    @Column(name = "metadata", length = 4000)
    private String metadata; // JSON

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
