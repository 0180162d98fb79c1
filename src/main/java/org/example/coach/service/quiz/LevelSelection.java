package org.example.coach.service.quiz;

import org.example.coach.service.content.QuizQuestion;

public sealed interface LevelSelection
        permits LevelSelection.Started, LevelSelection.Locked, LevelSelection.NoQuestions, LevelSelection.UnknownLevel {

    record Started(QuizSession session, QuizQuestion firstQuestion)
            implements LevelSelection {
    }

    record Locked(int level, int maxUnlockedLevel) implements LevelSelection {
    }

    record NoQuestions(int level) implements LevelSelection {
    }

    record UnknownLevel(int level) implements LevelSelection {
    }
}
