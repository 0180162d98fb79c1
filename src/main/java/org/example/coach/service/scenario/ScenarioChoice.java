package org.example.coach.service.scenario;

import org.example.coach.service.content.ScenarioImpact;

public record ScenarioChoice(
        String nodeId,
        String label,
        ScenarioImpact impact
) {
}
