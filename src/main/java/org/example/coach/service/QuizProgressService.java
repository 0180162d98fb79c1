package org.example.coach.service;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.QuizResult;
import org.example.coach.repository.LearnerRepository;
import org.example.coach.service.quiz.QuizCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class QuizProgressService {

    private static final Logger log = LoggerFactory.getLogger(QuizProgressService.class);

    private final LearnerService learnerService;
    private final LearnerRepository learnerRepository;
    private final LeaderboardService leaderboardService;
    private final AnalyticsService analyticsService;
    private final ConversationMetricsService metricsService;

    public QuizProgressService(
            LearnerService learnerService,
            LearnerRepository learnerRepository,
            LeaderboardService leaderboardService,
            AnalyticsService analyticsService,
            ConversationMetricsService metricsService) {
        this.learnerService = learnerService;
        this.learnerRepository = learnerRepository;
        this.leaderboardService = leaderboardService;
        this.analyticsService = analyticsService;
        this.metricsService = metricsService;
    }

    /**
     * Applies a finished attempt: coins always, a pass count when passed, and the next level
     * when the attempt was perfect and that level is not yet open.
     */
    @Transactional
    public QuizResult recordCompletion(long userId, QuizCompletion completion) {
        LearnerEntity learner = learnerService.loadOrCreate(userId);
        if (completion.passed()) {
            learner.setQuizzesPassed(learner.getQuizzesPassed() + 1);
        }
        learner.setCoins(learner.getCoins() + completion.reward());

        Integer unlocked = null;
        Integer candidate = completion.unlockCandidate();
        if (candidate != null && candidate > learner.getMaxUnlockedLevel()) {
            learner.setMaxUnlockedLevel(candidate);
            unlocked = candidate;
        }
        learnerRepository.save(learner);
        leaderboardService.updateLeaderboard(learner);

        metricsService.recordQuizCompleted(completion.passed());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", completion.level());
        data.put("correct", completion.correctCount());
        data.put("total", completion.totalQuestions());
        data.put("passed", completion.passed());
        analyticsService.track(userId, UserEventType.QUIZ_COMPLETE, data);

        log.info("User {} finished level {} with {}/{} (passed={}, reward={}, unlocked={})",
                userId, completion.level(), completion.correctCount(), completion.totalQuestions(),
                completion.passed(), completion.reward(), unlocked);
        return new QuizResult(
                completion.level(),
                completion.correctCount(),
                completion.totalQuestions(),
                completion.passed(),
                completion.perfect(),
                completion.reward(),
                unlocked,
                learner.getCoins()
        );
    }
}
