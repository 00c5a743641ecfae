package com.groviate.feedbackrewards.repository;

import com.groviate.feedbackrewards.entity.FeedbackItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface FeedbackItemRepository extends JpaRepository<FeedbackItem, Long> {

    long countByAuthorId(String authorId);

    @Query("select count(distinct f.projectId) from FeedbackItem f where f.authorId = :authorId")
    long countDistinctProjectsByAuthorId(@Param("authorId") String authorId);

    /**
     * Последние отзывы автора, у которых есть все три оценки качества (новые первыми).
     */
    @Query("""
            select f from FeedbackItem f
            where f.authorId = :authorId
              and f.specificityScore is not null
              and f.actionabilityScore is not null
              and f.noveltyScore is not null
            order by f.createdAt desc, f.id desc
            """)
    List<FeedbackItem> findRecentScoredByAuthorId(@Param("authorId") String authorId, Pageable pageable);

    /**
     * Отзывы, за которые в журнале нет базового начисления или нет бонуса за качество,
     * хотя качество его предполагает (старые первыми).
     */
    @Query("""
            select f.id from FeedbackItem f
            where not exists (
                    select a.id from ActivityRecord a
                    where a.correlationKey = concat('feedback:', cast(f.id as String), ':base'))
               or (f.qualityScore >= :minQuality and not exists (
                    select a.id from ActivityRecord a
                    where a.correlationKey = concat('feedback:', cast(f.id as String), ':quality')))
            order by f.id asc
            """)
    List<Long> findIdsWithMissingRewards(@Param("minQuality") double minQuality, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update FeedbackItem f set f.pointsAwarded = :points where f.id = :id")
    int updatePointsAwarded(@Param("id") Long id, @Param("points") int points);
}
