package org.example.coach.model;

public record QuizResult(
        int level,
        int correctCount,
        int totalQuestions,
        boolean passed,
        boolean perfect,
        int coinsAwarded,
        Integer unlockedLevel,
        int balance
) {
}
