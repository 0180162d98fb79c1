package org.example.coach.model;

public record LeaderboardRow(
        int rank,
        long userId,
        String displayName,
        int score
) {
}
