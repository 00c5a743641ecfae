package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.exception.LedgerPersistenceException;

/**
 * Результат {@link RewardLedger#recordAward}.
 *
 * @param tier             уровень, который записал награду (null, если записи не было)
 * @param aggregatePending запись в журнале есть, но баланс не обновлён (ждёт сверки)
 * @param cause            причина для REJECTED / FAILED
 */
public record AwardResult(AwardStatus status,
                          ActivityRecord record,
                          String tier,
                          boolean aggregatePending,
                          Exception cause) {

    public static AwardResult recorded(ActivityRecord record, String tier, boolean aggregatePending) {
        return new AwardResult(AwardStatus.RECORDED, record, tier, aggregatePending, null);
    }

    public static AwardResult duplicate(ActivityRecord existing) {
        return new AwardResult(AwardStatus.DUPLICATE, existing, null, false, null);
    }

    public static AwardResult rejected(Exception cause) {
        return new AwardResult(AwardStatus.REJECTED, null, null, false, cause);
    }

    public static AwardResult failed(LedgerPersistenceException cause) {
        return new AwardResult(AwardStatus.FAILED, null, null, false, cause);
    }

    /**
     * Идемпотентный повтор считается успехом.
     */
    public boolean isSuccess() {
        return status == AwardStatus.RECORDED || status == AwardStatus.DUPLICATE;
    }

    public int points() {
        return record != null && record.getPoints() != null ? record.getPoints() : 0;
    }
}
