package org.example.coach.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "analytics_daily")
public class DailyAnalyticsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "metrics_date", nullable = false, unique = true)
    private LocalDate date;

    @Column(nullable = false)
    private long dailyActiveUsers;

    @Column(nullable = false)
    private long newUsers;

    @Column(nullable = false)
    private long quizCompletions;

    @Column(nullable = false)
    private long scenarioCompletions;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public DailyAnalyticsEntity() {
    }

    public DailyAnalyticsEntity(
            LocalDate date,
            long dailyActiveUsers,
            long newUsers,
            long quizCompletions,
            long scenarioCompletions) {
        this.date = date;
        this.dailyActiveUsers = dailyActiveUsers;
        this.newUsers = newUsers;
        this.quizCompletions = quizCompletions;
        this.scenarioCompletions = scenarioCompletions;
    }

    public Long getId() {
        return id;
    }

    public LocalDate getDate() {
        return date;
    }

    public long getDailyActiveUsers() {
        return dailyActiveUsers;
    }

    public long getNewUsers() {
        return newUsers;
    }

    public long getQuizCompletions() {
        return quizCompletions;
    }

    public long getScenarioCompletions() {
        return scenarioCompletions;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }
}
