package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.entity.ActivityRecord;

/**
 * Типизированный исход одного уровня записи. Исключения наружу из уровня не выходят.
 */
public record TierOutcome(Status status,
                          ActivityRecord record,
                          boolean aggregatePending,
                          RuntimeException cause) {

    public enum Status {
        WRITTEN,
        DUPLICATE,
        REJECTED,
        UNAVAILABLE
    }

    public static TierOutcome written(ActivityRecord record) {
        return new TierOutcome(Status.WRITTEN, record, false, null);
    }

    /**
     * Запись сохранена, инкремент баланса не прошёл.
     */
    public static TierOutcome writtenAggregatePending(ActivityRecord record, RuntimeException cause) {
        return new TierOutcome(Status.WRITTEN, record, true, cause);
    }

    public static TierOutcome duplicate(ActivityRecord existing) {
        return new TierOutcome(Status.DUPLICATE, existing, false, null);
    }

    public static TierOutcome rejected(RuntimeException cause) {
        return new TierOutcome(Status.REJECTED, null, false, cause);
    }

    public static TierOutcome unavailable(RuntimeException cause) {
        return new TierOutcome(Status.UNAVAILABLE, null, false, cause);
    }
}
