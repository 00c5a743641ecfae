package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.entity.RewardLevel;
import com.groviate.feedbackrewards.entity.UserRewardState;
import com.groviate.feedbackrewards.repository.UserRewardStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * JPA-операции над балансом пользователя. Используется только журналом и сверкой.
 */
@Component
@Slf4j
public class RewardStateWriter {

    private final UserRewardStateRepository stateRepository;
    private final TransactionTemplate requiresNewTx;
    private final Clock clock;

    public RewardStateWriter(UserRewardStateRepository stateRepository,
                             PlatformTransactionManager transactionManager,
                             FeedbackRewardsProperties props,
                             Clock clock) {
        this.stateRepository = stateRepository;
        this.clock = clock;
        this.requiresNewTx = new TransactionTemplate(transactionManager);
        this.requiresNewTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.requiresNewTx.setTimeout(props.getLedger().getStatementTimeoutSeconds());
    }

    /**
     * Создаёт строку баланса при первом обращении к пользователю.
     * Конкурентная вставка той же строки не ошибка.
     */
    public void ensureState(String userId) {
        try {
            requiresNewTx.executeWithoutResult(status -> {
                if (!stateRepository.existsById(userId)) {
                    stateRepository.saveAndFlush(UserRewardState.initial(userId, clock.instant()));
                    log.debug("Создана строка баланса: userId={}", userId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Строка баланса уже создана параллельно: userId={}", userId);
        }
    }

    /**
     * Атомарно увеличивает баланс и пересчитывает уровень. Должен вызываться внутри транзакции.
     *
     * @return баланс после инкремента
     * @throws IllegalStateException если строки баланса нет
     */
    public long applyIncrement(String userId, long delta) {
        int updated = stateRepository.incrementPoints(userId, delta, clock.instant());
        if (updated == 0) {
            throw new IllegalStateException("Нет строки баланса для userId=" + userId);
        }

        long points = stateRepository.findPointsByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Строка баланса исчезла: userId=" + userId));

        RewardLevel level = RewardLevel.forPoints(points);
        stateRepository.updateLevel(userId, level.getNumber(), level.getNextThreshold());
        return points;
    }
}
