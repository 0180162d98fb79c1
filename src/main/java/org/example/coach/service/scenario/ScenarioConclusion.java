package org.example.coach.service.scenario;

import org.example.coach.service.content.ScenarioOutcome;

import java.util.List;

/**
 * End of a walk. Reward and badge are set only for a successful outcome.
 * {@code fallback} marks an ending synthesized from a broken content edge.
 */
public record ScenarioConclusion(
        String scenarioId,
        ScenarioOutcome outcome,
        String text,
        String lastFeedback,
        int reward,
        String badge,
        List<ScenarioChoice> history,
        boolean fallback
) {
    public ScenarioConclusion {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean isSuccess() {
        return outcome == ScenarioOutcome.SUCCESS;
    }
}
