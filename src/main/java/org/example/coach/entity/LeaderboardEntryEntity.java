package org.example.coach.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(
        name = "leaderboard_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "period_code"}),
        indexes = @Index(name = "idx_leaderboard_period_score", columnList = "period_code, score")
)
public class LeaderboardEntryEntity {

    // Generated ids grow with insertion order and break score ties.
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_code", nullable = false, length = 20)
    private LeaderboardPeriod period;

    @Column(nullable = false)
    private int score = 0;

    @Column(name = "rank_position")
    private Integer rank;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public LeaderboardEntryEntity() {
    }

    public LeaderboardEntryEntity(Long userId, LeaderboardPeriod period, int score) {
        this.userId = userId;
        this.period = period;
        this.score = score;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public LeaderboardPeriod getPeriod() {
        return period;
    }

    public void setPeriod(LeaderboardPeriod period) {
        this.period = period;
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public Integer getRank() {
        return rank;
    }

    public void setRank(Integer rank) {
        this.rank = rank;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
