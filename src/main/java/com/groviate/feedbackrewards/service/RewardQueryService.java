package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.dto.ActivityRecordView;
import com.groviate.feedbackrewards.dto.EarnedAchievementView;
import com.groviate.feedbackrewards.dto.RewardStateResponse;
import com.groviate.feedbackrewards.entity.AchievementAward;
import com.groviate.feedbackrewards.model.Achievement;
import com.groviate.feedbackrewards.repository.AchievementAwardRepository;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import com.groviate.feedbackrewards.repository.UserRewardStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Чтение баланса, истории начислений и достижений пользователя.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RewardQueryService {

    public static final int DEFAULT_ACTIVITY_LIMIT = 20;
    public static final int MAX_ACTIVITY_LIMIT = 100;

    private final UserRewardStateRepository stateRepository;
    private final ActivityRecordRepository activityRecordRepository;
    private final AchievementAwardRepository awardRepository;

    public RewardStateResponse getState(String userId) {
        return stateRepository.findById(userId)
                .map(RewardStateResponse::from)
                .orElseGet(() -> RewardStateResponse.empty(userId));
    }

    /**
     * @param limit null или меньше 1 = {@value #DEFAULT_ACTIVITY_LIMIT}, больше {@value #MAX_ACTIVITY_LIMIT} обрезается
     */
    public List<ActivityRecordView> getRecentActivity(String userId, Integer limit) {
        int size = (limit == null || limit < 1) ? DEFAULT_ACTIVITY_LIMIT : Math.min(limit, MAX_ACTIVITY_LIMIT);
        return activityRecordRepository
                .findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, size))
                .stream()
                .map(ActivityRecordView::from)
                .toList();
    }

    public List<EarnedAchievementView> getAchievements(String userId) {
        return awardRepository.findByUserIdOrderByEarnedAtAscIdAsc(userId).stream()
                .map(this::toView)
                .flatMap(Optional::stream)
                .toList();
    }

    // награды с id, которого больше нет в каталоге, не показываем
    private Optional<EarnedAchievementView> toView(AchievementAward award) {
        return Achievement.findById(award.getAchievementId())
                .map(a -> new EarnedAchievementView(
                        a.getId(), a.getTitle(), a.getDescription(), a.getPointsReward(), award.getEarnedAt()));
    }
}
