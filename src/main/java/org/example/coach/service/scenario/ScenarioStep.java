package org.example.coach.service.scenario;

import org.example.coach.service.content.Scenario;
import org.example.coach.service.content.ScenarioNode;

public sealed interface ScenarioStep
        permits ScenarioStep.AtDecision, ScenarioStep.Concluded, ScenarioStep.Rejected, ScenarioStep.NotFound {

    /**
     * Walk continues at {@code node}. {@code lastChoice} and {@code lastFeedback} are null on the first node.
     */
    record AtDecision(
            Scenario scenario,
            ScenarioState state,
            ScenarioNode.DecisionNode node,
            ScenarioChoice lastChoice,
            String lastFeedback
    ) implements ScenarioStep {
    }

    record Concluded(Scenario scenario, ScenarioConclusion conclusion) implements ScenarioStep {
    }

    record Rejected(String reason) implements ScenarioStep {
    }

    record NotFound(String scenarioId) implements ScenarioStep {
    }
}
