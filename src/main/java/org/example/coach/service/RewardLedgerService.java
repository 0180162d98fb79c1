package org.example.coach.service;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.model.CoinSpend;
import org.example.coach.model.RewardGrant;
import org.example.coach.repository.LearnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies coin, score and badge changes to learners and refreshes their standings.
 * <p>
 * Every call is applied exactly once; callers own deduplication.
 */
@Service
public class RewardLedgerService {

    private static final Logger log = LoggerFactory.getLogger(RewardLedgerService.class);

    private final LearnerService learnerService;
    private final LearnerRepository learnerRepository;
    private final LeaderboardService leaderboardService;
    private final ConversationMetricsService metricsService;

    public RewardLedgerService(
            LearnerService learnerService,
            LearnerRepository learnerRepository,
            LeaderboardService leaderboardService,
            ConversationMetricsService metricsService) {
        this.learnerService = learnerService;
        this.learnerRepository = learnerRepository;
        this.leaderboardService = leaderboardService;
        this.metricsService = metricsService;
    }

    /**
     * Grants a scenario reward. Coins and scenario score only move for a positive delta;
     * a badge already held is reported as not granted.
     */
    @Transactional
    public RewardGrant grantReward(long userId, int coinDelta, String badgeId) {
        LearnerEntity learner = learnerService.loadOrCreate(userId);
        int coinsGranted = 0;
        if (coinDelta > 0) {
            learner.setCoins(learner.getCoins() + coinDelta);
            learner.setScenarioScore(learner.getScenarioScore() + coinDelta);
            coinsGranted = coinDelta;
        }
        String badgeGranted = learner.addBadge(badgeId) ? badgeId.trim() : null;
        learnerRepository.save(learner);
        leaderboardService.updateLeaderboard(learner);
        metricsService.recordRewardGranted();
        log.info("Granted user {} {} coins (badge: {}), scenario score {}",
                userId, coinsGranted, badgeGranted, learner.getScenarioScore());
        return new RewardGrant(coinsGranted, badgeGranted, learner.getScenarioScore(), learner.getBadgeSet());
    }

    /**
     * Adds coins without touching the scenario score.
     *
     * @return the new balance
     */
    @Transactional
    public int creditCoins(long userId, int amount, String reason) {
        LearnerEntity learner = learnerService.loadOrCreate(userId);
        if (amount > 0) {
            learner.setCoins(learner.getCoins() + amount);
            learnerRepository.save(learner);
            leaderboardService.updateLeaderboard(learner);
            log.info("Credited user {} {} coins ({})", userId, amount, reason);
        }
        return learner.getCoins();
    }

    @Transactional
    public CoinSpend spendCoins(long userId, int cost, String reason) {
        LearnerEntity learner = learnerService.loadOrCreate(userId);
        if (cost < 0 || learner.getCoins() < cost) {
            return new CoinSpend(false, cost, learner.getCoins());
        }
        learner.setCoins(learner.getCoins() - cost);
        learnerRepository.save(learner);
        leaderboardService.updateLeaderboard(learner);
        log.info("User {} spent {} coins ({})", userId, cost, reason);
        return new CoinSpend(true, cost, learner.getCoins());
    }
}
