package org.example.coach.repository;

import org.example.coach.entity.DailyAnalyticsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DailyAnalyticsRepository extends JpaRepository<DailyAnalyticsEntity, Long> {

    boolean existsByDate(LocalDate date);

    List<DailyAnalyticsEntity> findByDateGreaterThanEqualOrderByDateAsc(LocalDate from);
}
