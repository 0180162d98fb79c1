package org.example.coach.service.content;

import java.util.List;
import java.util.Optional;

/**
 * Read-only quiz and scenario content, keyed by language.
 */
public interface ContentCatalog {

    /**
     * Ordered questions for a level. Empty when the language has no set for that level.
     */
    List<QuizQuestion> getQuestions(String language, int level);

    Optional<Scenario> getScenario(String language, String scenarioId);

    /**
     * Scenarios in catalog order.
     */
    List<Scenario> listScenarios(String language);

    String resolveLanguage(String language);
}
