package com.groviate.feedbackrewards.model;

/**
 * Результат сверки баланса с журналом. drift = correctedTotal - previousTotal.
 */
public record ReconciliationReport(String userId, long previousTotal, long correctedTotal, long drift) {

    public static ReconciliationReport of(String userId, long previousTotal, long correctedTotal) {
        return new ReconciliationReport(userId, previousTotal, correctedTotal, correctedTotal - previousTotal);
    }

    public boolean hasDrift() {
        return drift != 0;
    }
}
