package org.example.coach.service.quiz;

import org.example.coach.service.content.QuizQuestion;

public sealed interface AnswerOutcome
        permits AnswerOutcome.InvalidSelection, AnswerOutcome.Advanced, AnswerOutcome.Completed {

    /**
     * Index out of range or no matching question; the session is unchanged.
     */
    record InvalidSelection(QuizSession session) implements AnswerOutcome {
    }

    record Advanced(QuizSession session, boolean wasCorrect, QuizQuestion nextQuestion) implements AnswerOutcome {
    }

    record Completed(QuizSession session, boolean wasCorrect, QuizCompletion completion) implements AnswerOutcome {
    }
}
