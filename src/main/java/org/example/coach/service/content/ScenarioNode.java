package org.example.coach.service.content;

import java.util.List;

/**
 * A node of a scenario graph: either a decision with ordered options or a terminal outcome.
 */
public sealed interface ScenarioNode permits ScenarioNode.DecisionNode, ScenarioNode.TerminalNode {

    String id();

    String text();

    record DecisionNode(
            String id,
            String text,
            double progress,
            List<ScenarioOption> options
    ) implements ScenarioNode {
        public DecisionNode {
            options = options == null ? List.of() : List.copyOf(options);
            progress = Math.max(0.0, Math.min(1.0, progress));
        }
    }

    /**
     * Ending of a walk. Reward and badge override the scenario's own values when set.
     */
    record TerminalNode(
            String id,
            String text,
            ScenarioOutcome outcome,
            Integer reward,
            String badge
    ) implements ScenarioNode {
    }
}
