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
 * Уровень 1: вставка записи и атомарный инкремент баланса в одной JPA-транзакции.
 */
@Component
@Order(1)
@Slf4j
public class CombinedTransactionTier implements LedgerWriteTier {

    public static final String NAME = "combined-transaction";

    private final ActivityRecordRepository activityRecordRepository;
    private final RewardStateWriter stateWriter;
    private final LedgerFailureClassifier failureClassifier;
    private final FeedbackRewardsProperties props;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CombinedTransactionTier(ActivityRecordRepository activityRecordRepository,
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
        return props.getLedger().getTiers().getCombinedTransaction().isEnabled();
    }

    @Override
    public TierOutcome write(AwardRequest request) {
        try {
            ActivityRecord saved = transactionTemplate.execute(status -> {
                ActivityRecord record = activityRecordRepository.saveAndFlush(request.toRecord(clock.instant()));
                long balance = stateWriter.applyIncrement(request.userId(), request.points());
                log.debug("[{}] key={} записан, баланс={}", NAME, request.correlationKey(), balance);
                return record;
            });
            return TierOutcome.written(saved);
        } catch (RuntimeException e) {
            return failureClassifier.classify(request, e);
        }
    }
}
