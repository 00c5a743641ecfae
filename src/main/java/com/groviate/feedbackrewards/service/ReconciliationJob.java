package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.entity.RewardLevel;
import com.groviate.feedbackrewards.entity.UserRewardState;
import com.groviate.feedbackrewards.model.ReconciliationReport;
import com.groviate.feedbackrewards.model.RewardProcessingResult;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import com.groviate.feedbackrewards.repository.FeedbackItemRepository;
import com.groviate.feedbackrewards.repository.UserRewardStateRepository;
import com.groviate.feedbackrewards.service.ledger.RewardStateWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Сверка баланса пользователя с журналом начислений.
 * <p>
 * Журнал - источник истины: баланс пересчитывается как сумма записей и перезаписывается,
 * если разошёлся (например, после сбоя неатомарного уровня записи).
 * Повторный запуск без новых записей всегда даёт drift = 0.
 * <p>
 * Полная сверка сначала дозачисляет награды за отзывы, начисление которых не дошло до журнала
 * (все уровни записи упали или задача не попала в пул).
 */
@Service
@Slf4j
public class ReconciliationJob {

    private final UserRewardStateRepository stateRepository;
    private final ActivityRecordRepository activityRecordRepository;
    private final FeedbackItemRepository feedbackItemRepository;
    private final RewardProcessingService rewardProcessingService;
    private final RewardStateWriter stateWriter;
    private final RewardMetricsService metrics;
    private final FeedbackRewardsProperties props;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReconciliationJob(UserRewardStateRepository stateRepository,
                             ActivityRecordRepository activityRecordRepository,
                             FeedbackItemRepository feedbackItemRepository,
                             RewardProcessingService rewardProcessingService,
                             RewardStateWriter stateWriter,
                             RewardMetricsService metrics,
                             FeedbackRewardsProperties props,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.stateRepository = stateRepository;
        this.activityRecordRepository = activityRecordRepository;
        this.feedbackItemRepository = feedbackItemRepository;
        this.rewardProcessingService = rewardProcessingService;
        this.stateWriter = stateWriter;
        this.metrics = metrics;
        this.props = props;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(props.getLedger().getStatementTimeoutSeconds());
    }

    /**
     * Сверяет баланс одного пользователя. Строка баланса блокируется на время пересчёта,
     * чтобы параллельный инкремент не потерялся.
     */
    public ReconciliationReport reconcile(String userId) {
        stateWriter.ensureState(userId);

        ReconciliationReport report = transactionTemplate.execute(status -> {
            UserRewardState state = stateRepository.findByUserIdForUpdate(userId)
                    .orElseThrow(() -> new IllegalStateException("Нет строки баланса для userId=" + userId));

            long previous = state.getPoints() != null ? state.getPoints() : 0L;
            long ledgerSum = activityRecordRepository.sumPointsByUserId(userId);

            RewardLevel level = RewardLevel.forPoints(ledgerSum);
            boolean levelStale = state.getLevel() == null || state.getLevel() != level.getNumber();

            if (previous != ledgerSum || levelStale) {
                state.setPoints(ledgerSum);
                state.applyLevel(level);
                state.setUpdatedAt(clock.instant());
                stateRepository.save(state);
            }

            return ReconciliationReport.of(userId, previous, ledgerSum);
        });

        if (report != null && report.hasDrift()) {
            metrics.markReconciliationDrift();
            log.warn("Расхождение баланса исправлено: userId={}, было={}, стало={}, drift={}",
                    userId, report.previousTotal(), report.correctedTotal(), report.drift());
        } else {
            log.debug("Баланс сходится с журналом: userId={}", userId);
        }
        return report;
    }

    /**
     * Повторно запускает начисление за отзывы без базовой записи или без бонуса за качество.
     * Начисления идемпотентны по correlationKey, поэтому уже записанное не удваивается.
     *
     * @return сколько отзывов начислено полностью
     */
    public int recoverMissingRewards() {
        int batchSize = Math.max(1, props.getReconciliation().getRewardSweepBatchSize());
        List<Long> feedbackIds = feedbackItemRepository.findIdsWithMissingRewards(
                QualityPointsCalculator.MIN_QUALITY_FOR_BONUS, PageRequest.of(0, batchSize));
        if (feedbackIds.isEmpty()) {
            return 0;
        }

        int recovered = 0;
        for (Long feedbackId : feedbackIds) {
            try {
                RewardProcessingResult result = rewardProcessingService.processRewards(feedbackId);
                if (result.complete()) {
                    recovered++;
                }
            } catch (Exception e) {
                log.warn("Дозачисление за отзыв не удалось: feedbackId={}, cause={}", feedbackId, e.getMessage());
            }
        }

        log.warn("Дозачислены награды за отзывы без начислений: найдено={}, начислено={}",
                feedbackIds.size(), recovered);
        return recovered;
    }

    /**
     * Дозачисляет потерянные награды за отзывы, затем сверяет всех пользователей,
     * у кого есть баланс или записи в журнале.
     * Ошибка по одному пользователю логируется и не останавливает остальных.
     *
     * @return отчёты только с ненулевым drift
     */
    public List<ReconciliationReport> reconcileAll() {
        try {
            recoverMissingRewards();
        } catch (Exception e) {
            log.warn("Поиск отзывов без начислений не удался: {}", e.getMessage());
        }

        Set<String> userIds = new TreeSet<>(stateRepository.findAllUserIds());
        userIds.addAll(activityRecordRepository.findDistinctUserIds());

        List<ReconciliationReport> drifted = new ArrayList<>();
        int failed = 0;

        for (String userId : userIds) {
            try {
                ReconciliationReport report = reconcile(userId);
                if (report != null && report.hasDrift()) {
                    drifted.add(report);
                }
            } catch (Exception e) {
                failed++;
                log.warn("Сверка не удалась для userId={}: {}", userId, e.getMessage());
            }
        }

        log.info("Сверка завершена: пользователей={}, с расхождением={}, ошибок={}",
                userIds.size(), drifted.size(), failed);
        return drifted;
    }
}
