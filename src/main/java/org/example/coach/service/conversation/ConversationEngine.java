package org.example.coach.service.conversation;

import org.example.coach.config.RequestCorrelation;
import org.example.coach.service.ConversationMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Single entry point for inbound conversation events.
 * <p>
 * Events for one user are serialized on that user's session lock. Every call returns a reply;
 * store and unexpected failures are classified, logged and the session is rolled back to its
 * last checkpoint: the state before the event, or the state after a committed ledger write.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final SessionStore sessionStore;
    private final AccountFlow accountFlow;
    private final QuizFlow quizFlow;
    private final ScenarioFlow scenarioFlow;
    private final ConversationMetricsService metricsService;
    private final Clock clock;

    public ConversationEngine(
            SessionStore sessionStore,
            AccountFlow accountFlow,
            QuizFlow quizFlow,
            ScenarioFlow scenarioFlow,
            ConversationMetricsService metricsService,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.accountFlow = accountFlow;
        this.quizFlow = quizFlow;
        this.scenarioFlow = scenarioFlow;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public ConversationReply handle(InboundEvent event) {
        long startedAt = System.currentTimeMillis();
        SessionState session = sessionStore.getOrCreate(event.userId());
        RequestCorrelation.bindEvent(event.userId(), eventKind(event));
        session.lock().lock();
        session.checkpoint();
        try {
            session.touch(clock.instant());
            Turn turn = new Turn(event.userId(), session, event.sender(), event instanceof InboundEvent.ButtonPress);
            ConversationReply reply = dispatch(turn, event);
            if (reply.failure() == ConversationFailure.INVALID_SELECTION) {
                metricsService.recordInvalidSelection();
                session.rollback();
            }
            return reply;
        } catch (DataAccessException e) {
            log.error("Record store failure while handling event for user {}", event.userId(), e);
            metricsService.recordStoreFailure();
            session.rollback();
            return ConversationReply.failed(event.userId(), ConversationFailure.STORE_UNAVAILABLE);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while handling event for user {}", event.userId(), e);
            metricsService.recordInternalFailure();
            session.rollback();
            return ConversationReply.failed(event.userId(), ConversationFailure.INTERNAL);
        } finally {
            session.lock().unlock();
            RequestCorrelation.clearEvent();
            metricsService.recordEventHandled(System.currentTimeMillis() - startedAt);
        }
    }

    private static String eventKind(InboundEvent event) {
        if (event instanceof InboundEvent.ButtonPress press) {
            return "button:" + ActionCodec.decode(press.data()).map(action -> action.id().code()).orElse("?");
        }
        return "text";
    }

    private ConversationReply dispatch(Turn turn, InboundEvent event) {
        if (event instanceof InboundEvent.ButtonPress press) {
            Optional<Action> action = ActionCodec.decode(press.data());
            if (action.isEmpty()) {
                log.debug("Unrecognized callback payload '{}'", press.data());
                return turn.invalid();
            }
            return dispatchAction(turn, action.get());
        }
        InboundEvent.TextMessage message = (InboundEvent.TextMessage) event;
        return dispatchText(turn, message.body());
    }

    private ConversationReply dispatchAction(Turn turn, Action action) {
        return switch (action.id()) {
            case SET_LANGUAGE -> accountFlow.chooseLanguage(turn, action);
            case MAIN_MENU -> accountFlow.showMainMenu(turn);
            case BACK -> back(turn);
            case QUIZ_MENU -> quizFlow.enter(turn);
            case QUIZ_LEVEL -> quizFlow.selectLevel(turn, action);
            case QUIZ_LOCKED -> quizFlow.lockedNotice(turn, action);
            case QUIZ_ANSWER -> quizFlow.answer(turn, action);
            case QUIZ_BACK_LEVELS -> quizFlow.backToLevels(turn);
            case QUIZ_HOME -> quizFlow.home(turn);
            case SCENARIO_MENU -> scenarioFlow.showMenu(turn);
            case SCENARIO_START -> action.arg(0) == null ? turn.invalid() : scenarioFlow.start(turn, action.arg(0));
            case SCENARIO_CHOOSE -> scenarioFlow.choose(turn, action);
            case SCENARIO_RETRY -> action.arg(0) == null ? turn.invalid() : scenarioFlow.retry(turn, action.arg(0));
            case SCENARIO_HOME -> scenarioFlow.home(turn);
            case BALANCE -> accountFlow.showBalance(turn);
            case SHOP -> accountFlow.showShop(turn);
            case BUY_HINT -> accountFlow.buyHint(turn);
            case LEVEL_INFO -> accountFlow.levelInfo(turn);
            case LEADERBOARD -> accountFlow.showLeaderboard(turn, action.arg(0));
            case REFERRAL -> accountFlow.showReferral(turn);
            case HELP -> accountFlow.showHelp(turn);
        };
    }

    private ConversationReply dispatchText(Turn turn, String body) {
        String text = body == null ? "" : body.trim();
        if (!text.startsWith("/")) {
            return turn.notice("Please use the menu buttons. Send /menu to open the main menu.");
        }
        String[] parts = text.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        String argument = parts.length > 1 ? parts[1].trim() : null;
        return switch (command) {
            case "/start" -> accountFlow.start(turn, argument);
            case "/menu" -> accountFlow.showMainMenu(turn);
            case "/quiz" -> quizFlow.enter(turn);
            case "/scenarios" -> scenarioFlow.showMenu(turn);
            case "/balance" -> accountFlow.showBalance(turn);
            case "/shop" -> accountFlow.showShop(turn);
            case "/leaderboard" -> accountFlow.showLeaderboard(turn, argument);
            case "/referral" -> accountFlow.showReferral(turn);
            case "/help" -> accountFlow.showHelp(turn);
            default -> turn.notice("Unknown command. Send /help to see what I can do.");
        };
    }

    /**
     * Pops the visible screen and re-renders the one underneath. At the root this re-renders the main menu.
     */
    private ConversationReply back(Turn turn) {
        turn.navigation().pop();
        NavFrame frame = turn.navigation().peek();
        return switch (frame.view()) {
            case MAIN_MENU, NOTICE -> accountFlow.showMainMenu(turn);
            case LANGUAGE_SELECT -> accountFlow.showLanguageSelect(turn);
            case QUIZ_LEVELS, QUIZ_RESULT -> {
                turn.session().setQuiz(null);
                yield quizFlow.showLevels(turn);
            }
            case QUIZ_QUESTION -> quizFlow.resume(turn);
            case SCENARIO_MENU, SCENARIO_RESULT -> scenarioFlow.showMenu(turn);
            case SCENARIO_PLAY -> scenarioFlow.resume(turn);
            case BALANCE -> accountFlow.showBalance(turn);
            case SHOP -> accountFlow.showShop(turn);
            case LEADERBOARD -> accountFlow.showLeaderboard(turn, frame.argument());
            case REFERRAL -> accountFlow.showReferral(turn);
            case HELP -> accountFlow.showHelp(turn);
        };
    }
}
