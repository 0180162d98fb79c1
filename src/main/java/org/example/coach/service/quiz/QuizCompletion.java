package org.example.coach.service.quiz;

/**
 * Outcome of a finished attempt. {@code unlockCandidate} is the level a perfect score opens,
 * or null; whether it is actually new is decided against the learner's stored progress.
 */
public record QuizCompletion(
        int level,
        int correctCount,
        int totalQuestions,
        boolean passed,
        boolean perfect,
        int reward,
        Integer unlockCandidate
) {
}
