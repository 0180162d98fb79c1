package org.example.coach.service.conversation;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.RewardGrant;
import org.example.coach.service.AnalyticsService;
import org.example.coach.service.ConversationMetricsService;
import org.example.coach.service.LearnerService;
import org.example.coach.service.RewardLedgerService;
import org.example.coach.service.content.ContentCatalog;
import org.example.coach.service.content.Scenario;
import org.example.coach.service.content.ScenarioNode;
import org.example.coach.service.scenario.ScenarioConclusion;
import org.example.coach.service.scenario.ScenarioEngine;
import org.example.coach.service.scenario.ScenarioState;
import org.example.coach.service.scenario.ScenarioStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class ScenarioFlow {

    private static final Logger log = LoggerFactory.getLogger(ScenarioFlow.class);

    private final ScenarioEngine engine;
    private final ContentCatalog contentCatalog;
    private final RewardLedgerService rewardLedgerService;
    private final LearnerService learnerService;
    private final AnalyticsService analyticsService;
    private final ConversationMetricsService metricsService;
    private final ViewRenderer renderer;

    public ScenarioFlow(
            ScenarioEngine engine,
            ContentCatalog contentCatalog,
            RewardLedgerService rewardLedgerService,
            LearnerService learnerService,
            AnalyticsService analyticsService,
            ConversationMetricsService metricsService,
            ViewRenderer renderer) {
        this.engine = engine;
        this.contentCatalog = contentCatalog;
        this.rewardLedgerService = rewardLedgerService;
        this.learnerService = learnerService;
        this.analyticsService = analyticsService;
        this.metricsService = metricsService;
        this.renderer = renderer;
    }

    public ConversationReply showMenu(Turn turn) {
        turn.session().setScenario(null);
        turn.navigation().dropTopIf(ViewId.SCENARIO_RESULT);
        turn.navigation().push(ViewId.SCENARIO_MENU);
        return turn.show(renderMenu(turn));
    }

    public ConversationReply start(Turn turn, String scenarioId) {
        ScenarioStep step = engine.start(turn.language(), scenarioId);
        if (step instanceof ScenarioStep.AtDecision decision) {
            turn.session().setScenario(decision.state());
            turn.navigation().dropTopIf(ViewId.SCENARIO_RESULT);
            turn.navigation().push(new NavFrame(ViewId.SCENARIO_PLAY, scenarioId));
            analyticsService.track(turn.userId(), UserEventType.SCENARIO_START, Map.of("scenario_id", scenarioId));
            return turn.show(renderer.scenarioNode(decision.scenario(), decision.node(), null, null));
        }
        if (step instanceof ScenarioStep.Concluded concluded) {
            analyticsService.track(turn.userId(), UserEventType.SCENARIO_START, Map.of("scenario_id", scenarioId));
            return conclude(turn, concluded.scenario(), concluded.conclusion());
        }
        log.warn("User {} asked for unknown scenario {}", turn.userId(), scenarioId);
        return turn.invalid();
    }

    public ConversationReply choose(Turn turn, Action action) {
        ScenarioState state = turn.session().getScenario();
        String scenarioId = action.arg(0);
        if (state == null || scenarioId == null || !scenarioId.equals(state.scenarioId()) || action.intArg(2).isEmpty()) {
            return turn.invalid();
        }
        ScenarioStep step = engine.choose(turn.language(), state, action.arg(1), action.intArg(2).getAsInt());
        if (step instanceof ScenarioStep.AtDecision decision) {
            turn.session().setScenario(decision.state());
            return turn.show(renderer.scenarioNode(
                    decision.scenario(), decision.node(), decision.lastChoice(), decision.lastFeedback()));
        }
        if (step instanceof ScenarioStep.Concluded concluded) {
            return conclude(turn, concluded.scenario(), concluded.conclusion());
        }
        if (step instanceof ScenarioStep.NotFound) {
            turn.session().setScenario(null);
        }
        log.debug("Rejected scenario choice for user {}: {}", turn.userId(), step);
        return turn.invalid();
    }

    public ConversationReply retry(Turn turn, String scenarioId) {
        turn.session().setScenario(null);
        return start(turn, scenarioId);
    }

    /**
     * Leaves a walk in progress and returns to the scenario list.
     */
    public ConversationReply home(Turn turn) {
        turn.session().setScenario(null);
        turn.navigation().dropTopIf(ViewId.SCENARIO_PLAY);
        return showMenu(turn);
    }

    /**
     * Re-renders the active node after a back action, or the scenario list when no walk is active.
     */
    public ConversationReply resume(Turn turn) {
        ScenarioState state = turn.session().getScenario();
        if (state != null) {
            Scenario scenario = contentCatalog.getScenario(turn.language(), state.scenarioId()).orElse(null);
            if (scenario != null
                    && scenario.node(state.currentNodeId()).orElse(null) instanceof ScenarioNode.DecisionNode node) {
                return turn.show(renderer.scenarioNode(scenario, node, null, null));
            }
        }
        turn.session().setScenario(null);
        turn.navigation().dropTopIf(ViewId.SCENARIO_PLAY);
        return showMenu(turn);
    }

    private ConversationReply conclude(Turn turn, Scenario scenario, ScenarioConclusion conclusion) {
        RewardGrant grant = null;
        if (conclusion.isSuccess()) {
            grant = rewardLedgerService.grantReward(turn.userId(), conclusion.reward(), conclusion.badge());
        }
        turn.session().setScenario(null);
        turn.navigation().dropTopIf(ViewId.SCENARIO_PLAY);
        turn.navigation().push(ViewId.SCENARIO_RESULT);
        // the walk is over once the grant commits; a later failure must not reopen it
        turn.session().checkpoint();
        metricsService.recordScenarioConcluded(conclusion.fallback());
        trackCompletion(turn.userId(), scenario, conclusion);
        return turn.show(renderer.scenarioResult(scenario, conclusion, grant));
    }

    private void trackCompletion(long userId, Scenario scenario, ScenarioConclusion conclusion) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scenario_id", scenario.id());
        data.put("outcome", conclusion.outcome().name().toLowerCase(Locale.ROOT));
        try {
            analyticsService.track(userId, UserEventType.SCENARIO_COMPLETE, data);
        } catch (RuntimeException e) {
            log.warn("Could not record completion of {} for user {}: {}", scenario.id(), userId, e.getMessage());
        }
    }

    private OutboundView renderMenu(Turn turn) {
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        return renderer.scenarioMenu(
                contentCatalog.listScenarios(turn.language()),
                learner.getBadgeSet(),
                learner.getScenarioScore());
    }
}
