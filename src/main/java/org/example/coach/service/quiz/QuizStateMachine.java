package org.example.coach.service.quiz;

import org.example.coach.config.CoachProperties;
import org.example.coach.service.content.ContentCatalog;
import org.example.coach.service.content.QuizQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Leveled quiz attempts: level gating, question sequencing, scoring and the unlock rule.
 * <p>
 * Pure with respect to storage. The caller persists a {@link QuizCompletion} once an
 * attempt finishes.
 */
@Component
public class QuizStateMachine {

    private static final Logger log = LoggerFactory.getLogger(QuizStateMachine.class);

    private final ContentCatalog contentCatalog;
    private final CoachProperties properties;

    public QuizStateMachine(ContentCatalog contentCatalog, CoachProperties properties) {
        this.contentCatalog = contentCatalog;
        this.properties = properties;
    }

    public int maxLevel() {
        return properties.getQuiz().getMaxLevel();
    }

    public LevelSelection selectLevel(String language, int level, int maxUnlockedLevel) {
        if (level < 1 || level > maxLevel()) {
            return new LevelSelection.UnknownLevel(level);
        }
        if (level > maxUnlockedLevel) {
            return new LevelSelection.Locked(level, maxUnlockedLevel);
        }
        List<QuizQuestion> questions = contentCatalog.getQuestions(language, level);
        if (questions.isEmpty()) {
            log.warn("No quiz questions for language {} level {}", language, level);
            return new LevelSelection.NoQuestions(level);
        }
        return new LevelSelection.Started(QuizSession.start(level, questions.size()), questions.get(0));
    }

    public Optional<QuizQuestion> currentQuestion(String language, QuizSession session) {
        List<QuizQuestion> questions = contentCatalog.getQuestions(language, session.level());
        if (session.questionIndex() < 0 || session.questionIndex() >= questions.size()) {
            return Optional.empty();
        }
        return Optional.of(questions.get(session.questionIndex()));
    }

    public AnswerOutcome answer(String language, QuizSession session, int optionIndex) {
        QuizQuestion question = currentQuestion(language, session).orElse(null);
        if (question == null || optionIndex < 0 || optionIndex >= question.options().size()) {
            return new AnswerOutcome.InvalidSelection(session);
        }
        boolean correct = question.isCorrect(optionIndex);
        QuizSession next = session.advance(correct);
        if (next.isFinished()) {
            return new AnswerOutcome.Completed(next, correct, complete(next.level(), next.correctCount(), next.totalQuestions()));
        }
        QuizQuestion nextQuestion = currentQuestion(language, next).orElse(null);
        if (nextQuestion == null) {
            // Catalog shrank underneath the attempt; score what was answered.
            return new AnswerOutcome.Completed(next, correct, complete(next.level(), next.correctCount(), next.questionIndex()));
        }
        return new AnswerOutcome.Advanced(next, correct, nextQuestion);
    }

    public QuizCompletion complete(int level, int correctCount, int totalQuestions) {
        CoachProperties.Quiz quiz = properties.getQuiz();
        boolean passed = correctCount >= quiz.getPassThreshold();
        boolean perfect = totalQuestions > 0 && correctCount == totalQuestions;
        int reward = quiz.getBaseReward() + (perfect ? quiz.getPerfectBonus() : 0);
        Integer unlockCandidate = perfect && level < quiz.getMaxLevel() ? level + 1 : null;
        return new QuizCompletion(level, correctCount, totalQuestions, passed, perfect, reward, unlockCandidate);
    }
}
