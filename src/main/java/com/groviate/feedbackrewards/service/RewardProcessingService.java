package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.entity.AchievementAward;
import com.groviate.feedbackrewards.entity.ActivityType;
import com.groviate.feedbackrewards.entity.FeedbackItem;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.RewardProcessingResult;
import com.groviate.feedbackrewards.repository.FeedbackItemRepository;
import com.groviate.feedbackrewards.service.achievement.AchievementEvaluator;
import com.groviate.feedbackrewards.service.ledger.AwardResult;
import com.groviate.feedbackrewards.service.ledger.RewardLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Начисление наград за уже сохранённый отзыв.
 * <p>
 * Работает в отдельном пуле (rewardExecutor) и не зависит от жизни HTTP-запроса:
 * отключение клиента не отменяет начисление. Все ошибки поглощаются и логируются,
 * недописанное позже исправляет повторный вызов (идемпотентно) или сверка.
 * <ol>
 *   <li>базовые очки за отзыв ({@code feedback:<id>:base})</li>
 *   <li>бонус за качество, если он больше нуля ({@code feedback:<id>:quality})</li>
 *   <li>pointsAwarded отзыва = фактически начисленные очки</li>
 *   <li>проверка достижений автора</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardProcessingService {

    private final FeedbackItemRepository feedbackItemRepository;
    private final QualityPointsCalculator pointsCalculator;
    private final RewardLedger rewardLedger;
    private final AchievementEvaluator achievementEvaluator;

    @Async("rewardExecutor")
    public CompletableFuture<RewardProcessingResult> processRewardsAsync(Long feedbackId) {
        try {
            return CompletableFuture.completedFuture(processRewards(feedbackId));
        } catch (Exception e) {
            log.error("Начисление наград упало: feedbackId={}", feedbackId, e);
            return CompletableFuture.completedFuture(RewardProcessingResult.failed(feedbackId));
        }
    }

    /**
     * Синхронная версия. Безопасна для повторного вызова: все начисления идемпотентны.
     */
    public RewardProcessingResult processRewards(Long feedbackId) {
        String runId = UUID.randomUUID().toString().substring(0, 8);

        Optional<FeedbackItem> found = feedbackItemRepository.findById(feedbackId);
        if (found.isEmpty()) {
            log.warn("[{}] Отзыв не найден, начислять нечего: feedbackId={}", runId, feedbackId);
            return RewardProcessingResult.failed(feedbackId);
        }

        FeedbackItem item = found.get();
        String authorId = item.getAuthorId();

        AwardResult base = rewardLedger.recordAward(
                authorId,
                ActivityType.FEEDBACK_GIVEN,
                QualityPointsCalculator.BASE_SUBMISSION_POINTS,
                baseKey(feedbackId),
                feedbackMetadata(item));

        boolean complete = base.isSuccess();
        int credited = base.isSuccess() ? base.points() : 0;

        int qualityPoints = pointsCalculator.calculate(metricsOf(item));
        if (qualityPoints > 0) {
            Map<String, Object> metadata = feedbackMetadata(item);
            metadata.put("qualityScore", item.getQualityScore());

            AwardResult quality = rewardLedger.recordAward(
                    authorId,
                    ActivityType.FEEDBACK_QUALITY,
                    qualityPoints,
                    qualityKey(feedbackId),
                    metadata);

            complete = complete && quality.isSuccess();
            credited += quality.isSuccess() ? quality.points() : 0;
        }

        try {
            feedbackItemRepository.updatePointsAwarded(feedbackId, credited);
        } catch (Exception e) {
            log.warn("[{}] Не удалось обновить pointsAwarded: feedbackId={}, cause={}", runId, feedbackId, e.getMessage());
        }

        List<String> earned = List.of();
        try {
            earned = achievementEvaluator.evaluate(authorId).stream()
                    .map(AchievementAward::getAchievementId)
                    .toList();
        } catch (Exception e) {
            log.warn("[{}] Проверка достижений не удалась: userId={}, cause={}", runId, authorId, e.getMessage());
        }

        if (!complete) {
            log.warn("[{}] Начисление за отзыв неполное, потребуется повтор/сверка: feedbackId={}, credited={}",
                    runId, feedbackId, credited);
        } else {
            log.info("[{}] Награды за отзыв начислены: feedbackId={}, userId={}, points={}, achievements={}",
                    runId, feedbackId, authorId, credited, earned);
        }

        return new RewardProcessingResult(feedbackId, credited, complete, earned);
    }

    public static String baseKey(Long feedbackId) {
        return "feedback:" + feedbackId + ":base";
    }

    public static String qualityKey(Long feedbackId) {
        return "feedback:" + feedbackId + ":quality";
    }

    private Map<String, Object> feedbackMetadata(FeedbackItem item) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("feedbackId", item.getId());
        metadata.put("projectId", item.getProjectId());
        return metadata;
    }

    private QualityMetrics metricsOf(FeedbackItem item) {
        if (item.getSpecificityScore() == null || item.getActionabilityScore() == null
                || item.getNoveltyScore() == null) {
            return null;
        }
        return new QualityMetrics(
                item.getSpecificityScore(),
                item.getActionabilityScore(),
                item.getNoveltyScore(),
                item.getSentiment() != null ? item.getSentiment() : 0.0);
    }
}
