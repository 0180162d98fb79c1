package org.example.coach.service;

import org.example.coach.service.conversation.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Time-driven jobs: leaderboard window resets, the daily analytics roll-up and idle session eviction.
 * Leaderboard resets take the same per-period lock as live score updates.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final LeaderboardService leaderboardService;
    private final AnalyticsService analyticsService;
    private final SessionStore sessionStore;

    public MaintenanceScheduler(
            LeaderboardService leaderboardService,
            AnalyticsService analyticsService,
            SessionStore sessionStore) {
        this.leaderboardService = leaderboardService;
        this.analyticsService = analyticsService;
        this.sessionStore = sessionStore;
    }

    @Scheduled(cron = "${coach.schedule.weekly-reset-cron:0 0 0 * * MON}", zone = "UTC")
    public void resetWeeklyLeaderboard() {
        try {
            leaderboardService.resetWeeklyLeaderboard();
        } catch (DataAccessException e) {
            log.error("Weekly leaderboard reset failed", e);
        }
    }

    @Scheduled(cron = "${coach.schedule.monthly-reset-cron:0 0 0 1 * *}", zone = "UTC")
    public void resetMonthlyLeaderboard() {
        try {
            leaderboardService.resetMonthlyLeaderboard();
        } catch (DataAccessException e) {
            log.error("Monthly leaderboard reset failed", e);
        }
    }

    @Scheduled(cron = "${coach.schedule.daily-aggregate-cron:0 0 0 * * *}", zone = "UTC")
    public void aggregateDailyMetrics() {
        try {
            analyticsService.aggregateDailyMetrics();
        } catch (DataAccessException e) {
            log.error("Daily analytics aggregation failed", e);
        }
    }

    @Scheduled(cron = "${coach.schedule.session-sweep-cron:0 */15 * * * *}", zone = "UTC")
    public void evictIdleSessions() {
        sessionStore.evictIdle();
    }
}
