package org.example.coach.service.conversation;

import org.example.coach.config.CoachProperties;
import org.example.coach.entity.LeaderboardPeriod;
import org.example.coach.entity.LearnerEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.CoinSpend;
import org.example.coach.model.LeaderboardSnapshot;
import org.example.coach.model.ReferralResult;
import org.example.coach.model.ReferralStats;
import org.example.coach.service.AnalyticsService;
import org.example.coach.service.LeaderboardService;
import org.example.coach.service.LearnerService;
import org.example.coach.service.ReferralService;
import org.example.coach.service.ShopService;
import org.example.coach.service.quiz.QuizStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Onboarding, language choice and the account screens: balance, shop, leaderboard, referrals, help.
 */
@Component
public class AccountFlow {

    private static final Logger log = LoggerFactory.getLogger(AccountFlow.class);

    private final LearnerService learnerService;
    private final ReferralService referralService;
    private final ShopService shopService;
    private final LeaderboardService leaderboardService;
    private final AnalyticsService analyticsService;
    private final QuizStateMachine quizStateMachine;
    private final ViewRenderer renderer;
    private final CoachProperties properties;

    @Value("${telegram.bot-username:fraud_coach_bot}")
    private String botUsername;

    public AccountFlow(
            LearnerService learnerService,
            ReferralService referralService,
            ShopService shopService,
            LeaderboardService leaderboardService,
            AnalyticsService analyticsService,
            QuizStateMachine quizStateMachine,
            ViewRenderer renderer,
            CoachProperties properties) {
        this.learnerService = learnerService;
        this.referralService = referralService;
        this.shopService = shopService;
        this.leaderboardService = leaderboardService;
        this.analyticsService = analyticsService;
        this.quizStateMachine = quizStateMachine;
        this.renderer = renderer;
        this.properties = properties;
    }

    /**
     * Handles {@code /start [code]}. A referral code only counts for a learner seen for the first time.
     */
    public ConversationReply start(Turn turn, String referralCode) {
        LearnerService.Registration registration = learnerService.register(turn.userId(), turn.sender());
        String notice = null;
        if (registration.created()) {
            String code = referralCode == null ? null : referralCode.trim().toUpperCase(Locale.ROOT);
            if (code != null && !code.isEmpty()) {
                ReferralResult result = referralService.processReferral(code, turn.userId());
                if (result.success()) {
                    analyticsService.track(turn.userId(), UserEventType.REFERRAL_SIGNUP, Map.of("referral_code", code));
                    notice = "🎁 Referral code applied! +" + result.signupBonus() + " coins.";
                } else {
                    log.info("Referral code {} not applied for user {}: {}", code, turn.userId(), result.status());
                }
            }
            Map<String, Object> data = new HashMap<>();
            data.put("referral_code", code);
            analyticsService.track(turn.userId(), UserEventType.USER_SIGNUP, data);
        } else {
            analyticsService.track(turn.userId(), UserEventType.USER_RETURN);
        }

        SessionState session = turn.session();
        session.setQuiz(null);
        session.setScenario(null);
        turn.navigation().reset();
        turn.navigation().push(ViewId.LANGUAGE_SELECT);
        ConversationReply reply = turn.show(renderer.languageSelect(null));
        return notice == null ? reply : reply.withNotice(notice);
    }

    public ConversationReply chooseLanguage(Turn turn, Action action) {
        String language = action.arg(0);
        if (language == null || language.isBlank()) {
            turn.navigation().push(ViewId.LANGUAGE_SELECT);
            return turn.show(renderer.languageSelect(null));
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        if (!properties.getContent().getLanguages().contains(normalized)) {
            return turn.invalid();
        }
        turn.session().setLanguage(normalized);
        return showMainMenu(turn);
    }

    public ConversationReply showLanguageSelect(Turn turn) {
        turn.navigation().push(ViewId.LANGUAGE_SELECT);
        return turn.show(renderer.languageSelect(null));
    }

    /**
     * Home. Abandons any quiz or scenario in progress.
     */
    public ConversationReply showMainMenu(Turn turn) {
        turn.session().setQuiz(null);
        turn.session().setScenario(null);
        turn.navigation().reset();
        return turn.show(renderer.mainMenu());
    }

    public ConversationReply showBalance(Turn turn) {
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        turn.navigation().push(ViewId.BALANCE);
        return turn.show(renderer.balance(learner, LeaderboardService.score(learner)));
    }

    public ConversationReply showShop(Turn turn) {
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        turn.navigation().push(ViewId.SHOP);
        return turn.show(renderer.shop(learner.getCoins(), shopService.hintCost()));
    }

    public ConversationReply buyHint(Turn turn) {
        CoinSpend spend = shopService.buyHint(turn.userId());
        if (!spend.accepted()) {
            return turn.notice("Not enough coins: a hint costs " + spend.cost() + ", you have " + spend.balance() + ".");
        }
        turn.navigation().push(ViewId.SHOP);
        return turn.show(renderer.shop(spend.balance(), spend.cost())).withNotice(renderer.hintText());
    }

    public ConversationReply levelInfo(Turn turn) {
        LearnerEntity learner = learnerService.loadOrCreate(turn.userId());
        return turn.notice(renderer.levelInfo(learner.getMaxUnlockedLevel(), quizStateMachine.maxLevel()));
    }

    public ConversationReply showLeaderboard(Turn turn, String periodCode) {
        LeaderboardPeriod period = LeaderboardPeriod.fromCode(periodCode).orElse(LeaderboardPeriod.ALL_TIME);
        NavFrame frame = new NavFrame(ViewId.LEADERBOARD, period.code());
        if (turn.navigation().peek().view() == ViewId.LEADERBOARD) {
            turn.navigation().replaceTop(frame);
        } else {
            turn.navigation().push(frame);
        }
        LeaderboardSnapshot snapshot = leaderboardService.getLeaderboard(
                period, properties.getLeaderboard().getDefaultLimit(), turn.userId());
        return turn.show(renderer.leaderboard(snapshot));
    }

    public ConversationReply showReferral(Turn turn) {
        learnerService.loadOrCreate(turn.userId());
        ReferralStats stats = referralService.getStats(turn.userId());
        turn.navigation().push(ViewId.REFERRAL);
        String link = "https://t.me/" + botUsername + "?start=" + stats.code();
        return turn.show(renderer.referral(stats, link));
    }

    public ConversationReply showHelp(Turn turn) {
        turn.navigation().push(ViewId.HELP);
        return turn.show(renderer.help());
    }
}
