package org.example.coach.service.conversation;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.QuizResult;
import org.example.coach.service.AnalyticsService;
import org.example.coach.service.LearnerService;
import org.example.coach.service.QuizProgressService;
import org.example.coach.service.content.QuizQuestion;
import org.example.coach.service.quiz.AnswerOutcome;
import org.example.coach.service.quiz.LevelSelection;
import org.example.coach.service.quiz.QuizSession;
import org.example.coach.service.quiz.QuizStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@Component
public class QuizFlow {

    private static final Logger log = LoggerFactory.getLogger(QuizFlow.class);

    private final QuizStateMachine stateMachine;
    private final QuizProgressService quizProgressService;
    private final LearnerService learnerService;
    private final AnalyticsService analyticsService;
    private final ViewRenderer renderer;

    public QuizFlow(
            QuizStateMachine stateMachine,
            QuizProgressService quizProgressService,
            LearnerService learnerService,
            AnalyticsService analyticsService,
            ViewRenderer renderer) {
        this.stateMachine = stateMachine;
        this.quizProgressService = quizProgressService;
        this.learnerService = learnerService;
        this.analyticsService = analyticsService;
        this.renderer = renderer;
    }

    /**
     * Entry from the main menu or {@code /quiz}.
     */
    public ConversationReply enter(Turn turn) {
        analyticsService.track(turn.userId(), UserEventType.QUIZ_START);
        return showLevels(turn);
    }

    public ConversationReply showLevels(Turn turn) {
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        turn.navigation().push(ViewId.QUIZ_LEVELS);
        return turn.show(renderer.quizLevels(learner.getMaxUnlockedLevel(), stateMachine.maxLevel()));
    }

    public ConversationReply selectLevel(Turn turn, Action action) {
        if (action.intArg(0).isEmpty()) {
            return turn.invalid();
        }
        int level = action.intArg(0).getAsInt();
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        LevelSelection selection = stateMachine.selectLevel(turn.language(), level, learner.getMaxUnlockedLevel());
        if (selection instanceof LevelSelection.Started started) {
            turn.session().setQuiz(started.session());
            turn.navigation().dropTopIf(ViewId.QUIZ_RESULT);
            turn.navigation().push(ViewId.QUIZ_QUESTION);
            analyticsService.track(turn.userId(), UserEventType.QUIZ_LEVEL_START, Map.of("level", level));
            return turn.show(renderer.quizQuestion(started.session(), started.firstQuestion(), null));
        }
        if (selection instanceof LevelSelection.Locked locked) {
            return turn.notice(renderer.lockedLevel(locked.level()));
        }
        if (selection instanceof LevelSelection.NoQuestions) {
            return turn.notice("There are no questions for level " + level + " yet.");
        }
        return turn.invalid();
    }

    public ConversationReply lockedNotice(Turn turn, Action action) {
        if (action.intArg(0).isEmpty()) {
            return turn.invalid();
        }
        return turn.notice(renderer.lockedLevel(action.intArg(0).getAsInt()));
    }

    /**
     * Payload is {@code level|questionIndex|option}. A press whose level or question is not the
     * one on screen (double tap, redelivered webhook, older message) is rejected.
     */
    public ConversationReply answer(Turn turn, Action action) {
        QuizSession quiz = turn.session().getQuiz();
        OptionalInt level = action.intArg(0);
        OptionalInt questionIndex = action.intArg(1);
        OptionalInt option = action.intArg(2);
        if (quiz == null || level.isEmpty() || questionIndex.isEmpty() || option.isEmpty()) {
            return turn.invalid();
        }
        if (level.getAsInt() != quiz.level() || questionIndex.getAsInt() != quiz.questionIndex()) {
            log.debug("Stale answer from user {}: level {} question {}, on screen level {} question {}",
                    turn.userId(), level.getAsInt(), questionIndex.getAsInt(), quiz.level(), quiz.questionIndex());
            return turn.invalid();
        }
        Optional<QuizQuestion> answered = stateMachine.currentQuestion(turn.language(), quiz);
        AnswerOutcome outcome = stateMachine.answer(turn.language(), quiz, option.getAsInt());
        if (outcome instanceof AnswerOutcome.Advanced advanced) {
            turn.session().setQuiz(advanced.session());
            String feedback = renderer.answerFeedback(advanced.wasCorrect(), answered.orElseThrow());
            return turn.show(renderer.quizQuestion(advanced.session(), advanced.nextQuestion(), feedback));
        }
        if (outcome instanceof AnswerOutcome.Completed completed) {
            QuizResult result = quizProgressService.recordCompletion(turn.userId(), completed.completion());
            turn.session().setQuiz(null);
            turn.navigation().dropTopIf(ViewId.QUIZ_QUESTION);
            turn.navigation().push(ViewId.QUIZ_RESULT);
            turn.session().checkpoint();
            String feedback = renderer.answerFeedback(completed.wasCorrect(), answered.orElseThrow());
            return turn.show(renderer.quizResult(result, feedback));
        }
        return turn.invalid();
    }

    public ConversationReply backToLevels(Turn turn) {
        turn.session().setQuiz(null);
        turn.navigation().reset();
        return showLevels(turn);
    }

    public ConversationReply home(Turn turn) {
        turn.session().setQuiz(null);
        turn.navigation().reset();
        return turn.show(renderer.mainMenu());
    }

    /**
     * Re-renders the question screen after a back action, or the level list when no attempt is active.
     */
    public ConversationReply resume(Turn turn) {
        QuizSession quiz = turn.session().getQuiz();
        Optional<QuizQuestion> question = quiz == null
                ? Optional.empty()
                : stateMachine.currentQuestion(turn.language(), quiz);
        if (question.isEmpty()) {
            turn.session().setQuiz(null);
            turn.navigation().dropTopIf(ViewId.QUIZ_QUESTION);
            return showLevels(turn);
        }
        return turn.show(renderer.quizQuestion(quiz, question.get(), null));
    }
}
