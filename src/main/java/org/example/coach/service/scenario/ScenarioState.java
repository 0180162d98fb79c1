package org.example.coach.service.scenario;

import java.util.ArrayList;
import java.util.List;

/**
 * Position of an active walk plus the choices made so far.
 */
public record ScenarioState(
        String scenarioId,
        String currentNodeId,
        List<ScenarioChoice> history
) {
    public ScenarioState {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static ScenarioState start(String scenarioId, String startNodeId) {
        return new ScenarioState(scenarioId, startNodeId, List.of());
    }

    ScenarioState moveTo(String nodeId, ScenarioChoice choice) {
        List<ScenarioChoice> next = new ArrayList<>(history);
        next.add(choice);
        return new ScenarioState(scenarioId, nodeId, next);
    }
}
