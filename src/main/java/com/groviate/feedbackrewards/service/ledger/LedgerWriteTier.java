package com.groviate.feedbackrewards.service.ledger;

/**
 * Один уровень цепочки записи в журнал начислений.
 * Реализации упорядочены через {@link org.springframework.core.annotation.Order}:
 * чем меньше номер, тем сильнее гарантия.
 */
public interface LedgerWriteTier {

    String name();

    boolean isEnabled();

    /**
     * Записывает награду и увеличивает баланс. Не бросает исключений: любая ошибка
     * превращается в {@link TierOutcome}.
     */
    TierOutcome write(AwardRequest request);
}
