package org.example.coach.service.scenario;

import org.example.coach.service.content.ContentCatalog;
import org.example.coach.service.content.Scenario;
import org.example.coach.service.content.ScenarioNode;
import org.example.coach.service.content.ScenarioOption;
import org.example.coach.service.content.ScenarioOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Walks a branching scenario graph one choice at a time.
 * <p>
 * Content faults never escape as exceptions: a blank or unresolvable {@code next}, a decision
 * without options or a missing start node ends the walk with a synthetic {@link ScenarioOutcome#FAIL}.
 */
@Component
public class ScenarioEngine {

    private static final Logger log = LoggerFactory.getLogger(ScenarioEngine.class);

    private final ContentCatalog contentCatalog;

    public ScenarioEngine(ContentCatalog contentCatalog) {
        this.contentCatalog = contentCatalog;
    }

    public ScenarioStep start(String language, String scenarioId) {
        Scenario scenario = contentCatalog.getScenario(language, scenarioId).orElse(null);
        if (scenario == null) {
            return new ScenarioStep.NotFound(scenarioId);
        }
        ScenarioState state = ScenarioState.start(scenario.id(), scenario.startNodeId());
        ScenarioNode startNode = scenario.node(scenario.startNodeId()).orElse(null);
        if (startNode == null) {
            log.warn("Scenario {} has no start node '{}'", scenario.id(), scenario.startNodeId());
            return new ScenarioStep.Concluded(scenario, fallback(scenario, state, scenario.intro()));
        }
        return enter(scenario, state, startNode, null, null);
    }

    /**
     * Applies option {@code optionIndex} on {@code nodeId}. The node must be the walk's current node;
     * a press from an older screen is rejected without changing state.
     */
    public ScenarioStep choose(String language, ScenarioState state, String nodeId, int optionIndex) {
        if (state == null) {
            return new ScenarioStep.Rejected("no active scenario");
        }
        Scenario scenario = contentCatalog.getScenario(language, state.scenarioId()).orElse(null);
        if (scenario == null) {
            return new ScenarioStep.NotFound(state.scenarioId());
        }
        if (nodeId == null || !nodeId.equals(state.currentNodeId())) {
            return new ScenarioStep.Rejected("stale node " + nodeId);
        }
        ScenarioNode current = scenario.node(state.currentNodeId()).orElse(null);
        if (!(current instanceof ScenarioNode.DecisionNode decision)) {
            return new ScenarioStep.Rejected("node " + nodeId + " takes no choices");
        }
        List<ScenarioOption> options = decision.options();
        if (optionIndex < 0 || optionIndex >= options.size()) {
            return new ScenarioStep.Rejected("option " + optionIndex + " out of range");
        }

        ScenarioOption option = options.get(optionIndex);
        ScenarioChoice choice = new ScenarioChoice(decision.id(), option.label(), option.impact());
        ScenarioNode target = option.hasNext() ? scenario.node(option.next()).orElse(null) : null;
        if (target == null) {
            if (option.hasNext()) {
                log.warn("Scenario {} node {} points at missing node '{}'", scenario.id(), decision.id(), option.next());
            }
            ScenarioState ended = state.moveTo(decision.id(), choice);
            return new ScenarioStep.Concluded(scenario, fallback(scenario, ended, option.feedback()));
        }
        return enter(scenario, state.moveTo(target.id(), choice), target, choice, option.feedback());
    }

    private ScenarioStep enter(
            Scenario scenario,
            ScenarioState state,
            ScenarioNode node,
            ScenarioChoice lastChoice,
            String lastFeedback) {
        if (node instanceof ScenarioNode.TerminalNode terminal) {
            return new ScenarioStep.Concluded(scenario, conclude(scenario, state, terminal, lastFeedback));
        }
        ScenarioNode.DecisionNode decision = (ScenarioNode.DecisionNode) node;
        if (decision.options().isEmpty()) {
            log.warn("Scenario {} node {} offers no options", scenario.id(), decision.id());
            return new ScenarioStep.Concluded(scenario, fallback(scenario, state, decision.text()));
        }
        return new ScenarioStep.AtDecision(scenario, state, decision, lastChoice, lastFeedback);
    }

    private ScenarioConclusion conclude(
            Scenario scenario,
            ScenarioState state,
            ScenarioNode.TerminalNode terminal,
            String lastFeedback) {
        ScenarioOutcome outcome = terminal.outcome() == null ? ScenarioOutcome.FAIL : terminal.outcome();
        int reward = 0;
        String badge = null;
        if (outcome == ScenarioOutcome.SUCCESS) {
            reward = terminal.reward() != null ? terminal.reward() : scenario.reward();
            badge = terminal.badge() != null ? terminal.badge() : scenario.badge();
        }
        return new ScenarioConclusion(
                scenario.id(), outcome, terminal.text(), lastFeedback, reward, badge, state.history(), false);
    }

    private ScenarioConclusion fallback(Scenario scenario, ScenarioState state, String text) {
        return new ScenarioConclusion(
                scenario.id(), ScenarioOutcome.FAIL, text, null, 0, null, state.history(), true);
    }
}
