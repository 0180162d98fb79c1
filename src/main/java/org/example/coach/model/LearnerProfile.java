package org.example.coach.model;

import java.util.Set;

public record LearnerProfile(
        long userId,
        String displayName,
        int coins,
        int quizzesPassed,
        int maxUnlockedLevel,
        int scenarioScore,
        Set<String> badges,
        int leaderboardScore
) {
}
