package com.groviate.feedbackrewards.service.ledger;

public enum AwardStatus {
    /** Новая запись в журнале */
    RECORDED,
    /** Запись с таким correlationKey уже была, повторного начисления нет */
    DUPLICATE,
    /** Невалидный запрос, цепочка уровней прервана */
    REJECTED,
    /** Все уровни записи недоступны */
    FAILED
}
