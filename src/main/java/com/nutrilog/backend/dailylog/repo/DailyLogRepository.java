package com.nutrilog.backend.dailylog.repo;

import com.nutrilog.backend.dailylog.entity.DailyLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyLogRepository extends JpaRepository<DailyLogEntity, String> {

    Optional<DailyLogEntity> findByIdAndUserId(String id, Long userId);

    List<DailyLogEntity> findByUserIdAndLogDateOrderByCreatedAtUtcAsc(Long userId, LocalDate logDate);

    /**
     * Newest first; legacy rows without a timestamp go after timestamped ones, newest date first.
     */
    @Query("""
                select d from DailyLogEntity d
                where d.userId = :userId
                order by d.createdAtUtc desc nulls last, d.logDate desc nulls last
            """)
    List<DailyLogEntity> findRecentByUserId(@Param("userId") Long userId, Pageable pageable);
}
