package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Уровень 3: неатомарный путь. Вставка записи и инкремент баланса в двух отдельных транзакциях.
 * <p>
 * Сбой между шагами оставляет журнал и баланс рассинхронизированными.
 * Это принятый риск: расхождение исправляет {@link com.groviate.feedbackrewards.service.ReconciliationJob}.
 */
@Component
@Order(3)
@Slf4j
public class TwoStepTier implements LedgerWriteTier {

    public static final String NAME = "two-step";

    private final ActivityRecordRepository activityRecordRepository;
    private final RewardStateWriter stateWriter;
    private final LedgerFailureClassifier failureClassifier;
    private final FeedbackRewardsProperties props;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TwoStepTier(ActivityRecordRepository activityRecordRepository,
                       RewardStateWriter stateWriter,
                       LedgerFailureClassifier failureClassifier,
                       FeedbackRewardsProperties props,
                       PlatformTransactionManager transactionManager,
                       Clock clock) {
        this.activityRecordRepository = activityRecordRepository;
        this.stateWriter = stateWriter;
        this.failureClassifier = failureClassifier;
        this.props = props;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(props.getLedger().getStatementTimeoutSeconds());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return props.getLedger().getTiers().getTwoStep().isEnabled();
    }

    @Override
    public TierOutcome write(AwardRequest request) {
        ActivityRecord saved;
        try {
            saved = transactionTemplate.execute(status ->
                    activityRecordRepository.saveAndFlush(request.toRecord(clock.instant())));
        } catch (RuntimeException e) {
            return failureClassifier.classify(request, e);
        }

        try {
            transactionTemplate.executeWithoutResult(status ->
                    stateWriter.applyIncrement(request.userId(), request.points()));
            return TierOutcome.written(saved);
        } catch (RuntimeException e) {
            log.warn("[{}] Запись в журнале есть, баланс не обновлён (нужна сверка): userId={}, key={}, points={}, cause={}",
                    NAME, request.userId(), request.correlationKey(), request.points(), e.getMessage());
            return TierOutcome.writtenAggregatePending(saved, e);
        }
    }
}
