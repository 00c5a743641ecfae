package com.groviate.feedbackrewards.scheduler;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.model.ReconciliationReport;
import com.groviate.feedbackrewards.service.ReconciliationJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Периодическая сверка балансов всех пользователей с журналом начислений.
 */
@Slf4j
@Component
public class ReconciliationScheduler {

    private final FeedbackRewardsProperties props;
    private final ReconciliationJob reconciliationJob;

    public ReconciliationScheduler(FeedbackRewardsProperties props, ReconciliationJob reconciliationJob) {
        this.props = props;
        this.reconciliationJob = reconciliationJob;
    }

    @Scheduled(cron = "${feedback-rewards.reconciliation.cron:0 0 3 * * *}")
    public void tick() {
        if (!props.getReconciliation().isSchedulerEnabled()) return;

        try {
            List<ReconciliationReport> drifted = reconciliationJob.reconcileAll();
            if (!drifted.isEmpty()) {
                log.warn("Плановая сверка исправила балансы: {}", drifted);
            }
        } catch (Exception e) {
            log.warn("Плановая сверка не выполнена: {}", e.getMessage());
        }
    }
}
