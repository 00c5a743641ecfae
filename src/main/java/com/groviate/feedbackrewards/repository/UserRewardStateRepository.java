package com.groviate.feedbackrewards.repository;

import com.groviate.feedbackrewards.entity.UserRewardState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserRewardStateRepository extends JpaRepository<UserRewardState, String> {

    /**
     * Атомарный инкремент на стороне БД (без read-modify-write в приложении).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserRewardState s
            set s.points = s.points + :delta, s.updatedAt = :now
            where s.userId = :userId
            """)
    int incrementPoints(@Param("userId") String userId, @Param("delta") long delta, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserRewardState s
            set s.level = :level, s.pointsToNextLevel = :pointsToNextLevel
            where s.userId = :userId
            """)
    int updateLevel(@Param("userId") String userId,
                    @Param("level") int level,
                    @Param("pointsToNextLevel") int pointsToNextLevel);

    @Query("select s.points from UserRewardState s where s.userId = :userId")
    Optional<Long> findPointsByUserId(@Param("userId") String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from UserRewardState s where s.userId = :userId")
    Optional<UserRewardState> findByUserIdForUpdate(@Param("userId") String userId);

    @Query("select s.userId from UserRewardState s")
    List<String> findAllUserIds();
}
