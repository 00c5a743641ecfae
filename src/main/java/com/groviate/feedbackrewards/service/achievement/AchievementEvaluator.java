package com.groviate.feedbackrewards.service.achievement;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.entity.AchievementAward;
import com.groviate.feedbackrewards.entity.ActivityType;
import com.groviate.feedbackrewards.entity.FeedbackItem;
import com.groviate.feedbackrewards.model.Achievement;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.UserFeedbackHistory;
import com.groviate.feedbackrewards.repository.AchievementAwardRepository;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import com.groviate.feedbackrewards.repository.FeedbackItemRepository;
import com.groviate.feedbackrewards.service.ledger.AwardResult;
import com.groviate.feedbackrewards.service.ledger.RewardLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Проверка достижений пользователя по каталогу {@link Achievement}.
 * <p>
 * Для каждого выполненного правила:
 * <ol>
 *   <li>если награды нет - вставляем её (уникальный индекс user+achievement отсекает гонку)</li>
 *   <li>начисляем очки через журнал с ключом {@code achievement:<userId>:<achievementId>}</li>
 *   <li>если награда уже есть, а начисления в журнале нет (прошлый прогон упал) - начисляем повторно</li>
 * </ol>
 * Каждое правило обрабатывается независимо: ошибка одного не мешает остальным.
 */
@Service
@Slf4j
public class AchievementEvaluator {

    private final FeedbackItemRepository feedbackItemRepository;
    private final AchievementAwardRepository awardRepository;
    private final ActivityRecordRepository activityRecordRepository;
    private final RewardLedger rewardLedger;
    private final FeedbackRewardsProperties props;
    private final Clock clock;

    public AchievementEvaluator(FeedbackItemRepository feedbackItemRepository,
                                AchievementAwardRepository awardRepository,
                                ActivityRecordRepository activityRecordRepository,
                                RewardLedger rewardLedger,
                                FeedbackRewardsProperties props,
                                Clock clock) {
        this.feedbackItemRepository = feedbackItemRepository;
        this.awardRepository = awardRepository;
        this.activityRecordRepository = activityRecordRepository;
        this.rewardLedger = rewardLedger;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @return только новые награды, созданные в этом вызове
     */
    public List<AchievementAward> evaluate(String userId) {
        UserFeedbackHistory history = loadHistory(userId);
        List<AchievementAward> newlyEarned = new ArrayList<>();

        for (Achievement achievement : Achievement.values()) {
            if (!achievement.isEarned(history)) {
                continue;
            }
            try {
                processEarned(userId, achievement, history).ifPresent(newlyEarned::add);
            } catch (DataAccessException e) {
                log.warn("Не удалось обработать достижение {} для userId={}: {}",
                        achievement.getId(), userId, e.getMessage());
            }
        }

        return newlyEarned;
    }

    UserFeedbackHistory loadHistory(String userId) {
        long total = feedbackItemRepository.countByAuthorId(userId);
        long distinctProjects = feedbackItemRepository.countDistinctProjectsByAuthorId(userId);

        int window = Math.max(1, props.getAchievements().getQualityWindow());
        List<Double> recentScores = feedbackItemRepository
                .findRecentScoredByAuthorId(userId, PageRequest.of(0, window))
                .stream()
                .map(this::qualityOf)
                .toList();

        return new UserFeedbackHistory(userId, total, distinctProjects, recentScores);
    }

    private Optional<AchievementAward> processEarned(String userId,
                                                     Achievement achievement,
                                                     UserFeedbackHistory history) {
        String correlationKey = achievement.correlationKey(userId);

        if (awardRepository.existsByUserIdAndAchievementId(userId, achievement.getId())) {
            if (!activityRecordRepository.existsByCorrelationKey(correlationKey)) {
                log.warn("Награда {} есть, а начисления нет - повторяем: userId={}", achievement.getId(), userId);
                creditAchievement(userId, achievement, history);
            }
            return Optional.empty();
        }

        AchievementAward award;
        try {
            award = awardRepository.saveAndFlush(AchievementAward.builder()
                    .userId(userId)
                    .achievementId(achievement.getId())
                    .earnedAt(clock.instant())
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.info("Достижение {} уже выдано параллельным вызовом: userId={}", achievement.getId(), userId);
            return Optional.empty();
        }

        log.info("Получено достижение: userId={}, achievement={}", userId, achievement.getId());
        creditAchievement(userId, achievement, history);
        return Optional.of(award);
    }

    private void creditAchievement(String userId, Achievement achievement, UserFeedbackHistory history) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("achievementId", achievement.getId());
        metadata.put("achievementName", achievement.getTitle());
        metadata.put("achievementDescription", achievement.getDescription());
        metadata.put("distinctProjects", history.distinctProjectCount());
        metadata.put("averageQualityScore", history.averageRecentQuality());

        AwardResult result = rewardLedger.recordAward(
                userId,
                ActivityType.ACHIEVEMENT_EARNED,
                achievement.getPointsReward(),
                achievement.correlationKey(userId),
                metadata);

        if (!result.isSuccess()) {
            // награда уже сохранена, начисление повторится при следующей проверке
            log.warn("Очки за достижение {} не начислены: userId={}, status={}",
                    achievement.getId(), userId, result.status());
        }
    }

    private double qualityOf(FeedbackItem item) {
        return new QualityMetrics(
                item.getSpecificityScore(),
                item.getActionabilityScore(),
                item.getNoveltyScore(),
                item.getSentiment() != null ? item.getSentiment() : 0.0
        ).qualityScore();
    }
}
