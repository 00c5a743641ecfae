package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.dto.FeedbackSubmissionResponse;
import com.groviate.feedbackrewards.dto.QualityPreviewResponse;
import com.groviate.feedbackrewards.dto.SubmitFeedbackRequest;
import com.groviate.feedbackrewards.entity.FeedbackItem;
import com.groviate.feedbackrewards.exception.FeedbackPersistenceException;
import com.groviate.feedbackrewards.exception.FeedbackValidationException;
import com.groviate.feedbackrewards.model.FeedbackClassification;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.RewardProcessingResult;
import com.groviate.feedbackrewards.repository.FeedbackItemRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Точка входа для отправки отзыва.
 * <p>
 * Успех отправки определяется только сохранением самого отзыва. Начисление наград и
 * проверка достижений - best-effort: их сбой не откатывает отзыв и не превращает ответ в ошибку,
 * расхождения позже устраняет сверка. Это осознанный выбор доступности в пользу согласованности.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackSubmissionService {

    static final String MSG_ACCEPTED = "Feedback submitted successfully";
    static final String MSG_REWARDS_PENDING = "Feedback submitted successfully; rewards are still being processed";
    static final String MSG_REWARDS_INCOMPLETE =
            "Feedback submitted successfully; some rewards could not be credited yet and will be retried";
    static final String MSG_PERSIST_FAILED = "Feedback could not be saved, please try again later";

    private final FeedbackQualityAnalyzer qualityAnalyzer;
    private final QualityPointsCalculator pointsCalculator;
    private final FeedbackClassifier classifier;
    private final QualitySuggestionService suggestionService;
    private final FeedbackItemRepository feedbackItemRepository;
    private final RewardProcessingService rewardProcessingService;
    private final FeedbackRewardsProperties props;
    private final RewardMetricsService metrics;
    private final Clock clock;

    /**
     * Валидирует, оценивает, сохраняет отзыв и запускает начисление наград.
     *
     * @throws FeedbackValidationException пустой текст/автор/проект или превышена длина (до записи в БД)
     */
    public FeedbackSubmissionResponse submitFeedback(SubmitFeedbackRequest request) {
        Timer.Sample sample = metrics.start();

        try {
            validate(request);
        } catch (FeedbackValidationException e) {
            metrics.markSubmissionRejected(sample);
            throw e;
        }

        QualityMetrics qualityMetrics = qualityAnalyzer.analyze(request.content());
        FeedbackClassification classification = classifier.classify(request.content(), request.category());

        FeedbackItem saved;
        try {
            saved = persist(request, qualityMetrics, classification);
        } catch (FeedbackPersistenceException e) {
            log.error("Отзыв не сохранён, награды не начисляются: projectId={}, authorId={}",
                    request.projectId(), request.authorId(), e);
            metrics.markSubmissionFailed(sample);
            return FeedbackSubmissionResponse.failure(qualityMetrics, MSG_PERSIST_FAILED);
        }

        log.info("Отзыв сохранён: feedbackId={}, projectId={}, authorId={}, quality={}",
                saved.getId(), saved.getProjectId(), saved.getAuthorId(), saved.getQualityScore());

        int expectedPoints = QualityPointsCalculator.BASE_SUBMISSION_POINTS + pointsCalculator.calculate(qualityMetrics);
        RewardProcessingResult rewards = startAndAwaitRewards(saved.getId());

        metrics.markSubmissionSuccess(sample);

        if (rewards == null) {
            return FeedbackSubmissionResponse.accepted(saved.getId(), expectedPoints, qualityMetrics, MSG_REWARDS_PENDING);
        }
        if (!rewards.complete()) {
            log.warn("Награды за отзыв начислены не полностью, дозачислит сверка: feedbackId={}, credited={}, expected={}",
                    saved.getId(), rewards.creditedPoints(), expectedPoints);
            return FeedbackSubmissionResponse.accepted(
                    saved.getId(), rewards.creditedPoints(), qualityMetrics, MSG_REWARDS_INCOMPLETE);
        }
        return FeedbackSubmissionResponse.accepted(saved.getId(), rewards.creditedPoints(), qualityMetrics, MSG_ACCEPTED);
    }

    /**
     * Оценка качества текста без сохранения и начислений.
     */
    public QualityPreviewResponse previewQuality(String content) {
        QualityMetrics qualityMetrics = qualityAnalyzer.analyze(content);
        FeedbackClassification classification = classifier.classify(content, null);
        return new QualityPreviewResponse(
                qualityMetrics,
                qualityMetrics.qualityScore(),
                pointsCalculator.calculate(qualityMetrics),
                classification.category(),
                classification.subcategory(),
                suggestionService.suggest(qualityMetrics));
    }

    private void validate(SubmitFeedbackRequest request) {
        if (request == null) {
            throw new FeedbackValidationException("Feedback request is empty");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new FeedbackValidationException("Feedback content must not be empty");
        }
        if (request.content().length() > props.getSubmission().getMaxContentLength()) {
            throw new FeedbackValidationException(
                    "Feedback content is longer than " + props.getSubmission().getMaxContentLength() + " characters");
        }
        if (request.projectId() == null || request.projectId().isBlank()) {
            throw new FeedbackValidationException("Project reference is required");
        }
        if (request.authorId() == null || request.authorId().isBlank()) {
            throw new FeedbackValidationException("Author reference is required");
        }
    }

    private FeedbackItem persist(SubmitFeedbackRequest request,
                                 QualityMetrics qualityMetrics,
                                 FeedbackClassification classification) {
        FeedbackItem item = FeedbackItem.builder()
                .projectId(request.projectId().trim())
                .authorId(request.authorId().trim())
                .content(request.content())
                .category(classification.category())
                .subcategory(classification.subcategory())
                .specificityScore(qualityMetrics.specificity())
                .actionabilityScore(qualityMetrics.actionability())
                .noveltyScore(qualityMetrics.novelty())
                .sentiment(qualityMetrics.sentiment())
                .qualityScore(qualityMetrics.qualityScore())
                .pointsAwarded(0)
                .createdAt(clock.instant())
                .build();
        try {
            return feedbackItemRepository.saveAndFlush(item);
        } catch (RuntimeException e) {
            throw new FeedbackPersistenceException("Не удалось сохранить отзыв", e);
        }
    }

    /**
     * Запускает начисление в фоне и ждёт его ограниченное время. Таймаут не отменяет начисление.
     *
     * @return итог начисления или null, если оно ещё идёт / не запустилось
     */
    private RewardProcessingResult startAndAwaitRewards(Long feedbackId) {
        CompletableFuture<RewardProcessingResult> future;
        try {
            future = rewardProcessingService.processRewardsAsync(feedbackId);
        } catch (TaskRejectedException e) {
            log.error("Очередь начислений переполнена, награды дозачислит полная сверка: feedbackId={}",
                    feedbackId, e);
            return null;
        }

        long awaitMs = props.getSubmission().getRewardAwaitMs();
        try {
            return future.get(awaitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Начисление за отзыв ещё идёт, отвечаем без ожидания: feedbackId={}", feedbackId);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            log.warn("Начисление за отзыв завершилось ошибкой: feedbackId={}, cause={}",
                    feedbackId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }
}
