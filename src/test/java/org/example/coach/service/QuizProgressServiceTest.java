package org.example.coach.service;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.QuizResult;
import org.example.coach.repository.LearnerRepository;
import org.example.coach.service.quiz.QuizCompletion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuizProgressServiceTest {

    @Mock
    private LearnerService learnerService;

    @Mock
    private LearnerRepository learnerRepository;

    @Mock
    private LeaderboardService leaderboardService;

    @Mock
    private AnalyticsService analyticsService;

    @Captor
    private ArgumentCaptor<Map<String, Object>> eventDataCaptor;

    private ConversationMetricsService metricsService;
    private QuizProgressService quizProgressService;
    private LearnerEntity learner;

    @BeforeEach
    void setUp() {
        metricsService = new ConversationMetricsService();
        quizProgressService = new QuizProgressService(
                learnerService, learnerRepository, leaderboardService, analyticsService, metricsService);
        learner = new LearnerEntity(9L);
        when(learnerService.loadOrCreate(9L)).thenReturn(learner);
    }

    @Test
    void recordCompletion_perfectRun_unlocksNextLevelAndPays() {
        QuizResult result = quizProgressService.recordCompletion(9L, new QuizCompletion(1, 3, 3, true, true, 15, 2));

        assertEquals(2, result.unlockedLevel());
        assertEquals(15, result.coinsAwarded());
        assertEquals(15, result.balance());
        assertEquals(2, learner.getMaxUnlockedLevel());
        assertEquals(1, learner.getQuizzesPassed());
        verify(learnerRepository).save(learner);
        verify(leaderboardService).updateLeaderboard(learner);
    }

    @Test
    void recordCompletion_replayedLowerLevel_neverLowersUnlockedLevel() {
        learner.setMaxUnlockedLevel(3);

        QuizResult result = quizProgressService.recordCompletion(9L, new QuizCompletion(1, 3, 3, true, true, 15, 2));

        assertNull(result.unlockedLevel());
        assertEquals(3, learner.getMaxUnlockedLevel());
    }

    @Test
    void recordCompletion_failedAttempt_paysBaseWithoutPassCount() {
        QuizResult result = quizProgressService.recordCompletion(9L, new QuizCompletion(2, 1, 3, false, false, 10, null));

        assertEquals(10, result.balance());
        assertEquals(0, learner.getQuizzesPassed());
        assertEquals(1, learner.getMaxUnlockedLevel());
        assertEquals(1L, metricsService.snapshot().get("quizzesCompleted"));
        assertEquals(0L, metricsService.snapshot().get("quizzesPassed"));
    }

    @Test
    void recordCompletion_tracksCompletionEvent() {
        quizProgressService.recordCompletion(9L, new QuizCompletion(1, 3, 5, true, false, 10, null));

        verify(analyticsService).track(eq(9L), eq(UserEventType.QUIZ_COMPLETE), eventDataCaptor.capture());
        assertEquals(1, eventDataCaptor.getValue().get("level"));
        assertEquals(5, eventDataCaptor.getValue().get("total"));
        assertTrue((Boolean) eventDataCaptor.getValue().get("passed"));
    }
}
