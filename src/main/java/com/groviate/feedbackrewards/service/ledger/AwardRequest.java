package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.entity.ActivityType;

import java.time.Instant;

/**
 * Провалидированный запрос на начисление, общий для всех уровней записи.
 */
public record AwardRequest(String userId,
                           ActivityType activityType,
                           int points,
                           String correlationKey,
                           String metadataJson) {

    public ActivityRecord toRecord(Instant createdAt) {
        return ActivityRecord.builder()
                .userId(userId)
                .activityType(activityType)
                .points(points)
                .correlationKey(correlationKey)
                .metadata(metadataJson)
                .createdAt(createdAt)
                .build();
    }
}
