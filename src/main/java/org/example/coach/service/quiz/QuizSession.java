package org.example.coach.service.quiz;

/**
 * An attempt in progress. Lives in the conversation session only.
 */
public record QuizSession(
        int level,
        int questionIndex,
        int correctCount,
        int totalQuestions
) {

    public static QuizSession start(int level, int totalQuestions) {
        return new QuizSession(level, 0, 0, totalQuestions);
    }

    QuizSession advance(boolean correct) {
        return new QuizSession(level, questionIndex + 1, correct ? correctCount + 1 : correctCount, totalQuestions);
    }

    public boolean isFinished() {
        return questionIndex >= totalQuestions;
    }
}
