package org.example.coach.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Durable progression state of one chat user. The id is the messaging platform's user id.
 */
@Entity
@Table(name = "learners")
public class LearnerEntity {

    private static final String BADGE_SEPARATOR = ",";

    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(length = 255)
    private String username;

    @Column(name = "first_name", length = 255)
    private String firstName;

    @Column(name = "last_name", length = 255)
    private String lastName;

    @Column(nullable = false)
    private int coins = 0;

    @Column(name = "quizzes_passed", nullable = false)
    private int quizzesPassed = 0;

    @Column(name = "max_unlocked_level", nullable = false)
    private int maxUnlockedLevel = 1;

    @Column(name = "scenario_score", nullable = false)
    private int scenarioScore = 0;

    @Column(name = "scenario_badges", nullable = false, length = 1000)
    private String scenarioBadges = "";

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public LearnerEntity() {
    }

    public LearnerEntity(Long userId) {
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public int getCoins() {
        return coins;
    }

    public void setCoins(int coins) {
        this.coins = coins;
    }

    public int getQuizzesPassed() {
        return quizzesPassed;
    }

    public void setQuizzesPassed(int quizzesPassed) {
        this.quizzesPassed = quizzesPassed;
    }

    public int getMaxUnlockedLevel() {
        return maxUnlockedLevel;
    }

    public void setMaxUnlockedLevel(int maxUnlockedLevel) {
        this.maxUnlockedLevel = maxUnlockedLevel;
    }

    public int getScenarioScore() {
        return scenarioScore;
    }

    public void setScenarioScore(int scenarioScore) {
        this.scenarioScore = scenarioScore;
    }

    public String getScenarioBadges() {
        return scenarioBadges;
    }

    public void setScenarioBadges(String scenarioBadges) {
        this.scenarioBadges = scenarioBadges == null ? "" : scenarioBadges;
    }

    public Set<String> getBadgeSet() {
        if (scenarioBadges == null || scenarioBadges.isBlank()) {
            return new TreeSet<>();
        }
        return Arrays.stream(scenarioBadges.split(BADGE_SEPARATOR))
                .map(String::trim)
                .filter(badge -> !badge.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Adds a badge to the held set.
     *
     * @return true if the badge was not held before
     */
    public boolean addBadge(String badge) {
        if (badge == null || badge.isBlank()) {
            return false;
        }
        Set<String> badges = getBadgeSet();
        if (!badges.add(badge.trim())) {
            return false;
        }
        scenarioBadges = String.join(BADGE_SEPARATOR, badges);
        return true;
    }

    public boolean hasBadge(String badge) {
        return badge != null && getBadgeSet().contains(badge.trim());
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
