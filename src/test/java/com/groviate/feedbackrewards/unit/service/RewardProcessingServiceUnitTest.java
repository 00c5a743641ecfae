package com.groviate.feedbackrewards.unit.service;

import com.groviate.feedbackrewards.entity.AchievementAward;
import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.entity.ActivityType;
import com.groviate.feedbackrewards.entity.FeedbackItem;
import com.groviate.feedbackrewards.exception.LedgerPersistenceException;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.RewardProcessingResult;
import com.groviate.feedbackrewards.repository.FeedbackItemRepository;
import com.groviate.feedbackrewards.service.QualityPointsCalculator;
import com.groviate.feedbackrewards.service.RewardProcessingService;
import com.groviate.feedbackrewards.service.achievement.AchievementEvaluator;
import com.groviate.feedbackrewards.service.ledger.AwardResult;
import com.groviate.feedbackrewards.service.ledger.RewardLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RewardProcessingServiceUnitTest {

    @Mock
    FeedbackItemRepository feedbackItemRepository;
    @Mock
    RewardLedger rewardLedger;
    @Mock
    AchievementEvaluator achievementEvaluator;

    private RewardProcessingService service;

    @BeforeEach
    void setUp() {
        service = new RewardProcessingService(
                feedbackItemRepository,
                new QualityPointsCalculator(),
                rewardLedger,
                achievementEvaluator
        );
    }

    @Test
    @DisplayName("Качественный отзыв -> база 10 + бонус 18, pointsAwarded = 28, проверка достижений")
    void givenQualityFeedbackWhenProcessRewardsThenBaseAndBonusCredited() {
        when(feedbackItemRepository.findById(5L)).thenReturn(Optional.of(item(5L, new QualityMetrics(0.9, 0.7, 0.6, 1.0))));
        when(rewardLedger.recordAward(eq("u1"), eq(ActivityType.FEEDBACK_GIVEN), eq(10), eq("feedback:5:base"), anyMap()))
                .thenReturn(AwardResult.recorded(record(10), "combined-transaction", false));
        when(rewardLedger.recordAward(eq("u1"), eq(ActivityType.FEEDBACK_QUALITY), eq(18), eq("feedback:5:quality"), anyMap()))
                .thenReturn(AwardResult.recorded(record(18), "combined-transaction", false));
        when(achievementEvaluator.evaluate("u1"))
                .thenReturn(List.of(AchievementAward.builder().userId("u1").achievementId("first-feedback").build()));

        RewardProcessingResult result = service.processRewards(5L);

        assertThat(result.creditedPoints()).isEqualTo(28);
        assertThat(result.complete()).isTrue();
        assertThat(result.earnedAchievements()).containsExactly("first-feedback");
        verify(feedbackItemRepository).updatePointsAwarded(5L, 28);
    }

    @Test
    @DisplayName("Качество ниже порога -> только базовые очки, бонус не пишется")
    void givenLowQualityWhenProcessRewardsThenOnlyBaseCredited() {
        when(feedbackItemRepository.findById(6L)).thenReturn(Optional.of(item(6L, QualityMetrics.neutral())));
        when(rewardLedger.recordAward(eq("u1"), eq(ActivityType.FEEDBACK_GIVEN), eq(10), eq("feedback:6:base"), anyMap()))
                .thenReturn(AwardResult.recorded(record(10), "jdbc-statement", false));
        when(achievementEvaluator.evaluate("u1")).thenReturn(List.of());

        RewardProcessingResult result = service.processRewards(6L);

        assertThat(result.creditedPoints()).isEqualTo(10);
        verify(rewardLedger, never())
                .recordAward(anyString(), eq(ActivityType.FEEDBACK_QUALITY), anyInt(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Журнал не записал бонус -> результат неполный, ошибка не выходит наружу")
    void givenLedgerFailsForBonusWhenProcessRewardsThenIncompleteResult() {
        when(feedbackItemRepository.findById(5L)).thenReturn(Optional.of(item(5L, new QualityMetrics(0.9, 0.7, 0.6, 1.0))));
        when(rewardLedger.recordAward(eq("u1"), eq(ActivityType.FEEDBACK_GIVEN), eq(10), anyString(), anyMap()))
                .thenReturn(AwardResult.duplicate(record(10)));
        when(rewardLedger.recordAward(eq("u1"), eq(ActivityType.FEEDBACK_QUALITY), eq(18), anyString(), anyMap()))
                .thenReturn(AwardResult.failed(new LedgerPersistenceException("all tiers down", null)));
        when(achievementEvaluator.evaluate("u1")).thenThrow(new IllegalStateException("db down"));

        RewardProcessingResult result = service.processRewards(5L);

        assertThat(result.complete()).isFalse();
        assertThat(result.creditedPoints()).isEqualTo(10);
        assertThat(result.earnedAchievements()).isEmpty();
    }

    @Test
    @DisplayName("Отзыв не найден -> ничего не начисляется")
    void givenUnknownFeedbackWhenProcessRewardsThenNothingCredited() {
        when(feedbackItemRepository.findById(99L)).thenReturn(Optional.empty());

        RewardProcessingResult result = service.processRewards(99L);

        assertThat(result.complete()).isFalse();
        verifyNoInteractions(rewardLedger, achievementEvaluator);
    }

    @Test
    @DisplayName("Async-обёртка никогда не завершается исключением")
    void givenRepositoryThrowsWhenProcessRewardsAsyncThenFailedResult() throws Exception {
        when(feedbackItemRepository.findById(1L)).thenThrow(new IllegalStateException("boom"));

        RewardProcessingResult result = service.processRewardsAsync(1L).get();

        assertThat(result).isEqualTo(RewardProcessingResult.failed(1L));
        verify(rewardLedger, never()).recordAward(any(), any(), anyInt(), any(), any());
    }

    private static FeedbackItem item(Long id, QualityMetrics m) {
        return FeedbackItem.builder()
                .id(id)
                .projectId("p1")
                .authorId("u1")
                .content("text")
                .specificityScore(m.specificity())
                .actionabilityScore(m.actionability())
                .noveltyScore(m.novelty())
                .sentiment(m.sentiment())
                .qualityScore(m.qualityScore())
                .pointsAwarded(0)
                .build();
    }

    private static ActivityRecord record(int points) {
        return ActivityRecord.builder().id(1L).userId("u1").points(points).build();
    }
}
