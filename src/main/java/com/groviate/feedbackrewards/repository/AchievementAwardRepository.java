package com.groviate.feedbackrewards.repository;

import com.groviate.feedbackrewards.entity.AchievementAward;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AchievementAwardRepository extends JpaRepository<AchievementAward, Long> {

    boolean existsByUserIdAndAchievementId(String userId, String achievementId);

    List<AchievementAward> findByUserIdOrderByEarnedAtAscIdAsc(String userId);
}
