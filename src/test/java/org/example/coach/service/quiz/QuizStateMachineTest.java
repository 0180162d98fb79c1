package org.example.coach.service.quiz;

import org.example.coach.config.CoachProperties;
import org.example.coach.service.content.ContentCatalog;
import org.example.coach.service.content.QuizQuestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuizStateMachineTest {

    @Mock
    private ContentCatalog contentCatalog;

    private CoachProperties properties;
    private QuizStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        properties = new CoachProperties();
        stateMachine = new QuizStateMachine(contentCatalog, properties);
    }

    @Test
    void answer_allCorrectOnThreeQuestions_completesPerfectWithUnlock() {
        when(contentCatalog.getQuestions("en", 1)).thenReturn(questions(3));

        LevelSelection.Started started = assertInstanceOf(LevelSelection.Started.class,
                stateMachine.selectLevel("en", 1, 1));
        QuizSession session = started.session();

        AnswerOutcome first = stateMachine.answer("en", session, 0);
        session = assertInstanceOf(AnswerOutcome.Advanced.class, first).session();
        AnswerOutcome second = stateMachine.answer("en", session, 0);
        session = assertInstanceOf(AnswerOutcome.Advanced.class, second).session();
        AnswerOutcome last = stateMachine.answer("en", session, 0);

        QuizCompletion completion = assertInstanceOf(AnswerOutcome.Completed.class, last).completion();
        assertEquals(3, completion.correctCount());
        assertTrue(completion.passed());
        assertTrue(completion.perfect());
        assertEquals(15, completion.reward());
        assertEquals(2, completion.unlockCandidate());
    }

    @Test
    void complete_threeOfFiveAtThreshold_passesWithoutUnlock() {
        QuizCompletion completion = stateMachine.complete(1, 3, 5);

        assertTrue(completion.passed());
        assertFalse(completion.perfect());
        assertEquals(10, completion.reward());
        assertNull(completion.unlockCandidate());
    }

    @Test
    void complete_belowThreshold_stillPaysBaseReward() {
        QuizCompletion completion = stateMachine.complete(2, 1, 3);

        assertFalse(completion.passed());
        assertEquals(10, completion.reward());
        assertNull(completion.unlockCandidate());
    }

    @Test
    void complete_perfectOnTopLevel_hasNoUnlockCandidate() {
        QuizCompletion completion = stateMachine.complete(3, 3, 3);

        assertTrue(completion.perfect());
        assertEquals(15, completion.reward());
        assertNull(completion.unlockCandidate());
    }

    @Test
    void complete_zeroQuestions_isNeverPerfect() {
        QuizCompletion completion = stateMachine.complete(1, 0, 0);

        assertFalse(completion.perfect());
        assertFalse(completion.passed());
    }

    @Test
    void selectLevel_aboveUnlocked_isLocked() {
        LevelSelection selection = stateMachine.selectLevel("en", 3, 1);

        LevelSelection.Locked locked = assertInstanceOf(LevelSelection.Locked.class, selection);
        assertEquals(3, locked.level());
        assertEquals(1, locked.maxUnlockedLevel());
    }

    @Test
    void selectLevel_outsideConfiguredRange_isUnknown() {
        assertInstanceOf(LevelSelection.UnknownLevel.class, stateMachine.selectLevel("en", 0, 3));
        assertInstanceOf(LevelSelection.UnknownLevel.class, stateMachine.selectLevel("en", 4, 3));
    }

    @Test
    void selectLevel_emptyQuestionSet_reportsNoQuestions() {
        when(contentCatalog.getQuestions("en", 2)).thenReturn(List.of());

        assertInstanceOf(LevelSelection.NoQuestions.class, stateMachine.selectLevel("en", 2, 2));
    }

    @Test
    void answer_indexOutOfRange_leavesSessionUnchanged() {
        when(contentCatalog.getQuestions("en", 1)).thenReturn(questions(3));
        QuizSession session = QuizSession.start(1, 3);

        AnswerOutcome outcome = stateMachine.answer("en", session, 7);

        AnswerOutcome.InvalidSelection invalid = assertInstanceOf(AnswerOutcome.InvalidSelection.class, outcome);
        assertSame(session, invalid.session());
    }

    @Test
    void answer_wrongOption_advancesWithoutCredit() {
        when(contentCatalog.getQuestions("en", 1)).thenReturn(questions(3));

        AnswerOutcome outcome = stateMachine.answer("en", QuizSession.start(1, 3), 1);

        AnswerOutcome.Advanced advanced = assertInstanceOf(AnswerOutcome.Advanced.class, outcome);
        assertFalse(advanced.wasCorrect());
        assertEquals(1, advanced.session().questionIndex());
        assertEquals(0, advanced.session().correctCount());
    }

    @Test
    void complete_customThreshold_isHonoured() {
        properties.getQuiz().setPassThreshold(2);

        assertTrue(stateMachine.complete(1, 2, 3).passed());
    }

    private static List<QuizQuestion> questions(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new QuizQuestion("Question " + i, List.of("Right", "Wrong", "Also wrong"), 0))
                .toList();
    }
}
