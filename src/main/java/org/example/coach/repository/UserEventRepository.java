package org.example.coach.repository;

import org.example.coach.entity.UserEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface UserEventRepository extends JpaRepository<UserEventEntity, Long> {

    long countByEventTypeAndOccurredAtGreaterThanEqualAndOccurredAtLessThan(
            String eventType,
            LocalDateTime from,
            LocalDateTime to);

    long countByEventTypeAndOccurredAtGreaterThanEqual(String eventType, LocalDateTime from);

    @Query("""
            SELECT COUNT(DISTINCT e.userId)
            FROM UserEventEntity e
            WHERE e.occurredAt >= :from
              AND e.occurredAt < :to
            """)
    long countDistinctUsersBetween(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to);

    @Query("""
            SELECT e
            FROM UserEventEntity e
            WHERE e.eventType = :eventType
              AND e.occurredAt >= :from
            ORDER BY e.occurredAt ASC
            """)
    List<UserEventEntity> findByTypeSince(
            @Param("eventType") String eventType,
            @Param("from") LocalDateTime from);
}
