package org.example.coach.service.conversation;

import org.example.coach.entity.LeaderboardPeriod;
import org.example.coach.entity.LearnerEntity;
import org.example.coach.model.SenderProfile;
import org.example.coach.repository.LeaderboardEntryRepository;
import org.example.coach.repository.LearnerRepository;
import org.example.coach.entity.UserEventType;
import org.example.coach.service.AnalyticsService;
import org.example.coach.service.QuizProgressService;
import org.example.coach.service.ReferralService;
import org.example.coach.service.content.ContentCatalog;
import org.example.coach.service.content.QuizQuestion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
class ConversationFlowTest {

    @Autowired
    private ConversationEngine engine;

    @Autowired
    private SessionStore sessionStore;

    @Autowired
    private ContentCatalog contentCatalog;

    @Autowired
    private LearnerRepository learnerRepository;

    @Autowired
    private LeaderboardEntryRepository leaderboardEntryRepository;

    @Autowired
    private ReferralService referralService;

    @MockitoSpyBean
    private AnalyticsService analyticsService;

    @MockitoSpyBean
    private QuizProgressService quizProgressService;

    @Test
    void start_newUser_registersAndAsksForLanguage() {
        ConversationReply reply = text(1001L, "/start");

        assertEquals(ViewId.LANGUAGE_SELECT, onlyView(reply).view());
        LearnerEntity learner = learnerRepository.findById(1001L).orElseThrow();
        assertEquals("learner1001", learner.getUsername());

        ConversationReply menu = press(1001L, "set_lang|en");
        assertEquals(ViewId.MAIN_MENU, onlyView(menu).view());
        assertEquals("en", sessionStore.find(1001L).orElseThrow().getLanguage());
    }

    @Test
    void quiz_perfectLevelOne_paysUnlocksAndRanks() {
        text(1002L, "/start");
        press(1002L, "set_lang|en");
        assertEquals(ViewId.QUIZ_LEVELS, onlyView(press(1002L, "quiz")).view());
        assertEquals(ViewId.QUIZ_QUESTION, onlyView(press(1002L, "quiz_level|1")).view());

        List<QuizQuestion> questions = contentCatalog.getQuestions("en", 1);
        ConversationReply last = null;
        for (int i = 0; i < questions.size(); i++) {
            last = press(1002L, "quiz_ans|1|" + i + "|" + questions.get(i).correctOptionIndex());
        }

        OutboundView result = onlyView(last);
        assertEquals(ViewId.QUIZ_RESULT, result.view());
        assertTrue(result.text().contains("Level 2 unlocked"));
        LearnerEntity learner = learnerRepository.findById(1002L).orElseThrow();
        assertEquals(15, learner.getCoins());
        assertEquals(1, learner.getQuizzesPassed());
        assertEquals(2, learner.getMaxUnlockedLevel());
        assertEquals(11, leaderboardEntryRepository
                .findByUserIdAndPeriod(1002L, LeaderboardPeriod.WEEKLY).orElseThrow().getScore());

        assertEquals(ViewId.QUIZ_LEVELS, onlyView(press(1002L, "back")).view());
        assertEquals(ViewId.MAIN_MENU, onlyView(press(1002L, "back")).view());
    }

    @Test
    void quiz_backFromQuestion_returnsToLevelsAndDropsAttempt() {
        text(1003L, "/start");
        press(1003L, "set_lang|en");
        press(1003L, "quiz");
        press(1003L, "quiz_level|1");
        press(1003L, "quiz_ans|1|0|0");

        ConversationReply back = press(1003L, "back");

        assertEquals(ViewId.QUIZ_LEVELS, onlyView(back).view());
        SessionState session = sessionStore.find(1003L).orElseThrow();
        assertNull(session.getQuiz());
        assertEquals(List.of(NavFrame.ROOT, NavFrame.of(ViewId.QUIZ_LEVELS)), session.getNavigation().frames());
    }

    @Test
    void quiz_lockedLevel_showsNoticeOnly() {
        text(1004L, "/start");

        ConversationReply reply = press(1004L, "quiz_level|3");

        assertTrue(reply.views().isEmpty());
        assertTrue(reply.notice().contains("locked"));
    }

    @Test
    void scenario_reportPath_grantsRewardBadgeOnce() {
        text(1005L, "/start");
        press(1005L, "set_lang|en");
        press(1005L, "scenarios");
        assertEquals(ViewId.SCENARIO_PLAY, onlyView(press(1005L, "scenario_start|phishing_sms")).view());
        assertEquals(ViewId.SCENARIO_PLAY, onlyView(press(1005L, "scenario_choose|phishing_sms|sms|1")).view());

        OutboundView result = onlyView(press(1005L, "scenario_choose|phishing_sms|app_check|0"));

        assertEquals(ViewId.SCENARIO_RESULT, result.view());
        assertTrue(result.text().contains("New badge: phishing_hero"));
        LearnerEntity learner = learnerRepository.findById(1005L).orElseThrow();
        assertEquals(30, learner.getCoins());
        assertEquals(30, learner.getScenarioScore());
        assertTrue(learner.hasBadge("phishing_hero"));

        press(1005L, "scenario_retry|phishing_sms");
        press(1005L, "scenario_choose|phishing_sms|sms|1");
        OutboundView replay = onlyView(press(1005L, "scenario_choose|phishing_sms|app_check|0"));
        assertFalse(replay.text().contains("New badge"));
        assertEquals(60, learnerRepository.findById(1005L).orElseThrow().getScenarioScore());

        assertEquals(ViewId.SCENARIO_MENU, onlyView(press(1005L, "back")).view());
    }

    @Test
    void scenario_staleButton_isRejectedWithoutMovingTheWalk() {
        text(1006L, "/start");
        press(1006L, "scenario_start|phishing_sms");
        press(1006L, "scenario_choose|phishing_sms|sms|1");

        ConversationReply stale = press(1006L, "scenario_choose|phishing_sms|sms|0");

        assertEquals(ConversationFailure.INVALID_SELECTION, stale.failure());
        assertEquals("app_check", sessionStore.find(1006L).orElseThrow().getScenario().currentNodeId());
    }

    @Test
    void scenario_danglingEdge_endsAsFailWithoutReward() {
        text(1007L, "/start");
        press(1007L, "scenario_start|investment_offer");

        OutboundView result = onlyView(press(1007L, "scenario_choose|investment_offer|offer|0"));

        assertEquals(ViewId.SCENARIO_RESULT, result.view());
        assertEquals(0, learnerRepository.findById(1007L).orElseThrow().getCoins());
    }

    @Test
    void start_withReferralCode_creditsNewcomer() {
        text(1008L, "/start");
        String code = referralService.getOrCreateCode(1008L);

        ConversationReply reply = text(1009L, "/start " + code.toLowerCase());

        assertTrue(reply.notice().contains("+20"));
        assertEquals(20, learnerRepository.findById(1009L).orElseThrow().getCoins());

        ConversationReply again = text(1010L, "/start " + code);
        assertNull(again.notice());
        assertEquals(0, learnerRepository.findById(1010L).orElseThrow().getCoins());
    }

    @Test
    void buyHint_withoutCoins_isRefused() {
        text(1011L, "/start");

        ConversationReply reply = press(1011L, "buy_hint");

        assertTrue(reply.notice().startsWith("Not enough coins"));
        assertEquals(0, learnerRepository.findById(1011L).orElseThrow().getCoins());
    }

    @Test
    void unknownInput_isHandledGracefully() {
        text(1012L, "/start");

        assertEquals(ConversationFailure.INVALID_SELECTION, press(1012L, "self_destruct|1").failure());
        assertTrue(text(1012L, "hello there").notice().contains("/menu"));
        assertTrue(text(1012L, "/dance").notice().contains("/help"));
        assertEquals(ViewId.LEADERBOARD, onlyView(text(1012L, "/leaderboard@test_bot weekly")).view());
    }

    @Test
    void back_atRoot_reRendersMainMenu() {
        text(1013L, "/start");
        press(1013L, "main_menu");

        assertEquals(ViewId.MAIN_MENU, onlyView(press(1013L, "back")).view());
        assertEquals(ViewId.MAIN_MENU, onlyView(press(1013L, "back")).view());
        assertEquals(1, sessionStore.find(1013L).orElseThrow().getNavigation().size());
    }

    @Test
    void quiz_repeatedAnswerPress_isRejectedAndNotScoredAgainstNextQuestion() {
        text(1014L, "/start");
        press(1014L, "quiz_level|1");
        int correct = contentCatalog.getQuestions("en", 1).get(0).correctOptionIndex();
        String firstAnswer = "quiz_ans|1|0|" + correct;
        press(1014L, firstAnswer);

        ConversationReply repeated = press(1014L, firstAnswer);

        assertEquals(ConversationFailure.INVALID_SELECTION, repeated.failure());
        SessionState session = sessionStore.find(1014L).orElseThrow();
        assertEquals(1, session.getQuiz().questionIndex());
        assertEquals(1, session.getQuiz().correctCount());
        assertEquals(ConversationFailure.INVALID_SELECTION, press(1014L, "quiz_ans|2|1|0").failure());
    }

    @Test
    void scenario_failureAfterGrantCommits_doesNotReopenTheWalk() {
        doThrow(new CannotCreateTransactionException("analytics connection refused"))
                .when(analyticsService).track(anyLong(), eq(UserEventType.SCENARIO_COMPLETE), anyMap());
        text(1015L, "/start");
        press(1015L, "scenario_start|phishing_sms");
        press(1015L, "scenario_choose|phishing_sms|sms|1");

        ConversationReply finish = press(1015L, "scenario_choose|phishing_sms|app_check|0");
        ConversationReply again = press(1015L, "scenario_choose|phishing_sms|app_check|0");

        assertEquals(ViewId.SCENARIO_RESULT, onlyView(finish).view());
        assertEquals(ConversationFailure.INVALID_SELECTION, again.failure());
        SessionState session = sessionStore.find(1015L).orElseThrow();
        assertNull(session.getScenario());
        assertEquals(ViewId.SCENARIO_RESULT, session.getNavigation().peek().view());
        LearnerEntity learner = learnerRepository.findById(1015L).orElseThrow();
        assertEquals(30, learner.getCoins());
        assertEquals(30, learner.getScenarioScore());
    }

    @Test
    void quiz_storeUnavailableOnCompletion_reportsFailureAndKeepsSession() {
        doThrow(new DataAccessResourceFailureException("database down"))
                .when(quizProgressService).recordCompletion(anyLong(), any());
        text(1016L, "/start");
        press(1016L, "quiz_level|1");
        List<QuizQuestion> questions = contentCatalog.getQuestions("en", 1);
        int lastIndex = questions.size() - 1;
        for (int i = 0; i < lastIndex; i++) {
            press(1016L, "quiz_ans|1|" + i + "|" + questions.get(i).correctOptionIndex());
        }
        SessionState session = sessionStore.find(1016L).orElseThrow();
        List<NavFrame> framesBefore = session.getNavigation().frames();

        ConversationReply reply = press(1016L,
                "quiz_ans|1|" + lastIndex + "|" + questions.get(lastIndex).correctOptionIndex());

        assertEquals(ConversationFailure.STORE_UNAVAILABLE, reply.failure());
        assertEquals(ConversationFailure.STORE_UNAVAILABLE.userMessage(), reply.notice());
        assertTrue(reply.views().isEmpty());
        assertEquals(lastIndex, session.getQuiz().questionIndex());
        assertEquals(lastIndex, session.getQuiz().correctCount());
        assertEquals(framesBefore, session.getNavigation().frames());
        assertEquals(0, learnerRepository.findById(1016L).orElseThrow().getCoins());
    }

    private ConversationReply text(long userId, String body) {
        return engine.handle(new InboundEvent.TextMessage(userId, body, sender(userId)));
    }

    private ConversationReply press(long userId, String data) {
        return engine.handle(new InboundEvent.ButtonPress(userId, data, sender(userId)));
    }

    private static SenderProfile sender(long userId) {
        return new SenderProfile("learner" + userId, "Test", null);
    }

    private static OutboundView onlyView(ConversationReply reply) {
        assertNull(reply.failure(), () -> "unexpected failure: " + reply.failure());
        assertEquals(1, reply.views().size());
        return reply.views().get(0);
    }
}
