package org.example.coach.model;

import java.util.List;

public record AnalyticsSummary(
        int days,
        long totalUsers,
        long activeUsers7d,
        long quizStarts,
        long quizCompletions,
        double quizCompletionRate,
        List<ScenarioPopularity> topScenarios,
        List<DailyMetrics> daily
) {

    public record ScenarioPopularity(String scenarioId, long starts) {
    }

    public record DailyMetrics(
            String date,
            long dailyActiveUsers,
            long newUsers,
            long quizCompletions,
            long scenarioCompletions
    ) {
    }
}
