package org.example.coach.model;

import java.util.List;

public record LeaderboardSnapshot(
        String period,
        List<LeaderboardRow> entries,
        long totalPlayers,
        LeaderboardPosition requester
) {
}
