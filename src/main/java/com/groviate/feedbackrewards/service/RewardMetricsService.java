package com.groviate.feedbackrewards.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Метрики движка наград.
 * <p>
 * Все счётчики разбиты тегом {@code result} по исходу операции,
 * провалы уровней журнала дополнительно тегом {@code tier}.
 */
@Service
public class RewardMetricsService {

    private static final String METRIC_SUBMISSION_TOTAL = "feedback_submission_total";
    private static final String METRIC_SUBMISSION_DURATION = "feedback_submission_duration";
    private static final String METRIC_QUALITY_ANALYSIS_TOTAL = "quality_analysis_total";
    private static final String METRIC_LEDGER_AWARD_TOTAL = "ledger_award_total";
    private static final String METRIC_LEDGER_TIER_FALLTHROUGH_TOTAL = "ledger_tier_fallthrough_total";
    private static final String METRIC_RECONCILIATION_DRIFT_TOTAL = "reconciliation_drift_total";
    private static final String TAG_RESULT = "result";
    private static final String TAG_TIER = "tier";

    private final MeterRegistry registry;

    private final Counter submissionSuccess;
    private final Counter submissionFailed;
    private final Counter submissionRejected;

    private final Timer durationSuccess;
    private final Timer durationFailed;
    private final Timer durationRejected;

    private final Counter analysisRemote;
    private final Counter analysisFallback;
    private final Counter analysisNeutral;

    private final Counter reconciliationDrift;

    public RewardMetricsService(MeterRegistry registry) {
        this.registry = registry;

        this.submissionSuccess = submissionCounter("success");
        this.submissionFailed = submissionCounter("failed");
        this.submissionRejected = submissionCounter("rejected");

        this.durationSuccess = submissionTimer("success");
        this.durationFailed = submissionTimer("failed");
        this.durationRejected = submissionTimer("rejected");

        this.analysisRemote = analysisCounter("remote");
        this.analysisFallback = analysisCounter("fallback");
        this.analysisNeutral = analysisCounter("neutral");

        this.reconciliationDrift = Counter.builder(METRIC_RECONCILIATION_DRIFT_TOTAL)
                .register(registry);
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void markSubmissionSuccess(Timer.Sample sample) {
        submissionSuccess.increment();
        if (sample != null) sample.stop(durationSuccess);
    }

    public void markSubmissionFailed(Timer.Sample sample) {
        submissionFailed.increment();
        if (sample != null) sample.stop(durationFailed);
    }

    public void markSubmissionRejected(Timer.Sample sample) {
        submissionRejected.increment();
        if (sample != null) sample.stop(durationRejected);
    }

    public void markAnalysisRemote() {
        analysisRemote.increment();
    }

    public void markAnalysisFallback() {
        analysisFallback.increment();
    }

    public void markAnalysisNeutral() {
        analysisNeutral.increment();
    }

    /**
     * @param result recorded / duplicate / rejected / failed
     */
    public void markAward(String result) {
        Counter.builder(METRIC_LEDGER_AWARD_TOTAL)
                .tag(TAG_RESULT, result)
                .register(registry)
                .increment();
    }

    public void markTierFallthrough(String tier) {
        Counter.builder(METRIC_LEDGER_TIER_FALLTHROUGH_TOTAL)
                .tag(TAG_TIER, tier)
                .register(registry)
                .increment();
    }

    public void markReconciliationDrift() {
        reconciliationDrift.increment();
    }

    private Counter submissionCounter(String result) {
        return Counter.builder(METRIC_SUBMISSION_TOTAL)
                .tag(TAG_RESULT, result)
                .register(registry);
    }

    private Timer submissionTimer(String result) {
        return Timer.builder(METRIC_SUBMISSION_DURATION)
                .tag(TAG_RESULT, result)
                .register(registry);
    }

    private Counter analysisCounter(String result) {
        return Counter.builder(METRIC_QUALITY_ANALYSIS_TOTAL)
                .tag(TAG_RESULT, result)
                .register(registry);
    }
}
