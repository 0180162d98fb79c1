package org.example.coach.repository;

import org.example.coach.entity.LeaderboardEntryEntity;
import org.example.coach.entity.LeaderboardPeriod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaderboardEntryRepository extends JpaRepository<LeaderboardEntryEntity, Long> {

    Optional<LeaderboardEntryEntity> findByUserIdAndPeriod(Long userId, LeaderboardPeriod period);

    List<LeaderboardEntryEntity> findByPeriodOrderByScoreDescIdAsc(LeaderboardPeriod period);

    long countByPeriod(LeaderboardPeriod period);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE LeaderboardEntryEntity e
            SET e.score = 0
            WHERE e.period = :period
            """)
    int resetScores(@Param("period") LeaderboardPeriod period);
}
