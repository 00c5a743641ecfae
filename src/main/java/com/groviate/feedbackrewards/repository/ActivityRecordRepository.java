package com.groviate.feedbackrewards.repository;

import com.groviate.feedbackrewards.entity.ActivityRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ActivityRecordRepository extends JpaRepository<ActivityRecord, Long> {

    Optional<ActivityRecord> findByCorrelationKey(String correlationKey);

    boolean existsByCorrelationKey(String correlationKey);

    @Query("select coalesce(sum(a.points), 0) from ActivityRecord a where a.userId = :userId")
    long sumPointsByUserId(@Param("userId") String userId);

    List<ActivityRecord> findByUserIdOrderByCreatedAtDescIdDesc(String userId, Pageable pageable);

    @Query("select distinct a.userId from ActivityRecord a")
    List<String> findDistinctUserIds();
}
