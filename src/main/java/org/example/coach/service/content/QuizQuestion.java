package org.example.coach.service.content;

import java.util.List;

public record QuizQuestion(
        String prompt,
        List<String> options,
        int correctOptionIndex
) {
    public QuizQuestion {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public boolean isCorrect(int optionIndex) {
        return optionIndex == correctOptionIndex;
    }
}
