package org.example.coach.model;

public record LeaderboardPosition(
        int rank,
        int score,
        double percentile
) {
}
