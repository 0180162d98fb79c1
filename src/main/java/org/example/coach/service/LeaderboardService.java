package org.example.coach.service;

import org.example.coach.entity.LeaderboardEntryEntity;
import org.example.coach.entity.LeaderboardPeriod;
import org.example.coach.entity.LearnerEntity;
import org.example.coach.model.LeaderboardPosition;
import org.example.coach.model.LeaderboardRow;
import org.example.coach.model.LeaderboardSnapshot;
import org.example.coach.repository.LeaderboardEntryRepository;
import org.example.coach.repository.LearnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derived standings over the all-time, weekly and monthly windows.
 * <p>
 * Scores are recomputed from the learner record, never accumulated. Every write
 * re-ranks the whole period so ranks always form 1..N with ties kept in insertion order.
 */
@Service
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private final LeaderboardEntryRepository entryRepository;
    private final LearnerRepository learnerRepository;
    private final LeaderboardLocks locks;

    public LeaderboardService(
            LeaderboardEntryRepository entryRepository,
            LearnerRepository learnerRepository,
            LeaderboardLocks locks) {
        this.entryRepository = entryRepository;
        this.learnerRepository = learnerRepository;
        this.locks = locks;
    }

    public static int score(int coins, int quizzesPassed, int scenarioScore) {
        return Math.floorDiv(coins, 10) + quizzesPassed * 10 + scenarioScore;
    }

    public static int score(LearnerEntity learner) {
        return score(learner.getCoins(), learner.getQuizzesPassed(), learner.getScenarioScore());
    }

    @Transactional
    public void updateLeaderboard(long userId) {
        LearnerEntity learner = learnerRepository.findById(userId).orElse(null);
        if (learner == null) {
            log.warn("Skipping leaderboard update for unknown user {}", userId);
            return;
        }
        updateLeaderboard(learner);
    }

    @Transactional
    public void updateLeaderboard(LearnerEntity learner) {
        int score = score(learner);
        locks.runWithLocks(EnumSet.allOf(LeaderboardPeriod.class), () -> {
            for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
                LeaderboardEntryEntity entry = entryRepository.findByUserIdAndPeriod(learner.getUserId(), period)
                        .orElseGet(() -> new LeaderboardEntryEntity(learner.getUserId(), period, 0));
                entry.setScore(score);
                entryRepository.save(entry);
                recomputeRanks(period);
            }
        });
        log.debug("Leaderboard score for user {} is now {}", learner.getUserId(), score);
    }

    @Transactional
    public void resetWeeklyLeaderboard() {
        resetPeriod(LeaderboardPeriod.WEEKLY);
    }

    @Transactional
    public void resetMonthlyLeaderboard() {
        resetPeriod(LeaderboardPeriod.MONTHLY);
    }

    @Transactional(readOnly = true)
    public LeaderboardSnapshot getLeaderboard(LeaderboardPeriod period, int limit, Long requestingUserId) {
        List<LeaderboardEntryEntity> ordered = entryRepository.findByPeriodOrderByScoreDescIdAsc(period);
        int total = ordered.size();
        int safeLimit = Math.max(0, limit);
        List<LeaderboardEntryEntity> top = ordered.subList(0, Math.min(safeLimit, total));

        Map<Long, LearnerEntity> learners = learnerRepository.findAllById(
                        top.stream().map(LeaderboardEntryEntity::getUserId).toList())
                .stream()
                .collect(Collectors.toMap(LearnerEntity::getUserId, Function.identity()));

        List<LeaderboardRow> rows = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            LeaderboardEntryEntity entry = top.get(i);
            LearnerEntity learner = learners.get(entry.getUserId());
            String name = learner == null ? "User " + entry.getUserId() : LearnerService.displayName(learner);
            rows.add(new LeaderboardRow(i + 1, entry.getUserId(), name, entry.getScore()));
        }

        LeaderboardPosition requester = null;
        if (requestingUserId != null) {
            for (int i = 0; i < total; i++) {
                LeaderboardEntryEntity entry = ordered.get(i);
                if (entry.getUserId().equals(requestingUserId)) {
                    int rank = i + 1;
                    requester = new LeaderboardPosition(rank, entry.getScore(), percentile(rank, total));
                    break;
                }
            }
        }
        return new LeaderboardSnapshot(period.code(), rows, total, requester);
    }

    static double percentile(int rank, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return (total - rank + 1) * 100.0 / total;
    }

    private void resetPeriod(LeaderboardPeriod period) {
        locks.runWithLocks(EnumSet.of(period), () -> {
            int cleared = entryRepository.resetScores(period);
            recomputeRanks(period);
            log.info("Reset {} leaderboard: {} entries cleared", period.code(), cleared);
        });
    }

    private void recomputeRanks(LeaderboardPeriod period) {
        List<LeaderboardEntryEntity> ordered = entryRepository.findByPeriodOrderByScoreDescIdAsc(period);
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setRank(i + 1);
        }
        entryRepository.saveAll(ordered);
    }
}
