package com.groviate.feedbackrewards.dto;

import com.groviate.feedbackrewards.entity.ActivityRecord;

import java.time.Instant;

public record ActivityRecordView(
        Long id,
        String activityType,
        int points,
        String correlationKey,
        String metadata,
        Instant createdAt
) {

    public static ActivityRecordView from(ActivityRecord record) {
        return new ActivityRecordView(
                record.getId(),
                record.getActivityType().getCode(),
                record.getPoints(),
                record.getCorrelationKey(),
                record.getMetadata(),
                record.getCreatedAt());
    }
}
