package com.groviate.feedbackrewards.exception;

import org.springframework.http.HttpStatus;

/**
 * Ни один уровень записи в журнал начислений не смог сохранить награду.
 */
public class LedgerPersistenceException extends FeedbackRewardsException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super("LEDGER_PERSISTENCE", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
