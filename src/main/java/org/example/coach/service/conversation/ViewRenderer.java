package org.example.coach.service.conversation;

import org.example.coach.entity.LeaderboardPeriod;
import org.example.coach.entity.LearnerEntity;
import org.example.coach.model.LeaderboardRow;
import org.example.coach.model.LeaderboardSnapshot;
import org.example.coach.model.QuizResult;
import org.example.coach.model.ReferralStats;
import org.example.coach.model.RewardGrant;
import org.example.coach.service.content.QuizQuestion;
import org.example.coach.service.content.Scenario;
import org.example.coach.service.content.ScenarioNode;
import org.example.coach.service.content.ScenarioOption;
import org.example.coach.service.content.ScenarioOutcome;
import org.example.coach.service.quiz.QuizSession;
import org.example.coach.service.scenario.ScenarioChoice;
import org.example.coach.service.scenario.ScenarioConclusion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns engine results into text and inline keyboards.
 */
@Component
public class ViewRenderer {

    private static final int PROGRESS_BAR_WIDTH = 10;

    public OutboundView languageSelect(String preface) {
        String text = "Choose language / Выберите язык / Тілді таңдаңыз:";
        if (preface != null && !preface.isBlank()) {
            text = preface + "\n\n" + text;
        }
        return new OutboundView(ViewId.LANGUAGE_SELECT, text, List.of(
                List.of(Button.of("Русский", ActionId.SET_LANGUAGE, "ru")),
                List.of(Button.of("Қазақша", ActionId.SET_LANGUAGE, "kk")),
                List.of(Button.of("English", ActionId.SET_LANGUAGE, "en"))
        ));
    }

    public OutboundView mainMenu() {
        return new OutboundView(ViewId.MAIN_MENU, "Main menu. Learn to spot fraud and earn coins.", List.of(
                List.of(Button.of("📝 Quiz", ActionId.QUIZ_MENU), Button.of("🎭 Scenarios", ActionId.SCENARIO_MENU)),
                List.of(Button.of("💰 Balance", ActionId.BALANCE), Button.of("🛒 Shop", ActionId.SHOP)),
                List.of(Button.of("🏆 Leaderboard", ActionId.LEADERBOARD, LeaderboardPeriod.ALL_TIME.code()),
                        Button.of("🎁 Referral Program", ActionId.REFERRAL)),
                List.of(Button.of("❓ Help", ActionId.HELP), Button.of("🌐 Language", ActionId.SET_LANGUAGE))
        ));
    }

    public OutboundView quizLevels(int maxUnlockedLevel, int maxLevel) {
        List<List<Button>> rows = new ArrayList<>();
        for (int level = 1; level <= maxLevel; level++) {
            if (level <= maxUnlockedLevel) {
                rows.add(List.of(Button.of("Level " + level, ActionId.QUIZ_LEVEL, level)));
            } else {
                rows.add(List.of(Button.of("🔒 Level " + level, ActionId.QUIZ_LOCKED, level)));
            }
        }
        rows.add(List.of(Button.of("ℹ️ How levels unlock", ActionId.LEVEL_INFO)));
        rows.add(backRow());
        return new OutboundView(ViewId.QUIZ_LEVELS,
                "Choose a level. Answer every question correctly to unlock the next one.", rows);
    }

    public OutboundView quizQuestion(QuizSession session, QuizQuestion question, String feedback) {
        StringBuilder text = new StringBuilder();
        if (feedback != null) {
            text.append(feedback).append("\n\n");
        }
        text.append("Level ").append(session.level())
                .append(" · Question ").append(session.questionIndex() + 1)
                .append('/').append(session.totalQuestions())
                .append("\n\n").append(question.prompt());
        List<List<Button>> rows = new ArrayList<>();
        for (int i = 0; i < question.options().size(); i++) {
            rows.add(List.of(Button.of(question.options().get(i), ActionId.QUIZ_ANSWER,
                    session.level(), session.questionIndex(), i)));
        }
        rows.add(List.of(
                Button.of("⬅️ Levels", ActionId.QUIZ_BACK_LEVELS),
                Button.of("🏠 Home", ActionId.QUIZ_HOME)));
        return new OutboundView(ViewId.QUIZ_QUESTION, text.toString(), rows);
    }

    public String answerFeedback(boolean correct, QuizQuestion question) {
        if (correct) {
            return "✅ Correct!";
        }
        return "❌ Wrong. Correct answer: " + question.options().get(question.correctOptionIndex());
    }

    public OutboundView quizResult(QuizResult result, String feedback) {
        StringBuilder text = new StringBuilder();
        if (feedback != null) {
            text.append(feedback).append("\n\n");
        }
        text.append("Level ").append(result.level()).append(" finished: ")
                .append(result.correctCount()).append('/').append(result.totalQuestions()).append(" correct.\n");
        text.append(result.passed() ? "🎉 Passed!" : "Not passed this time.").append('\n');
        text.append("+").append(result.coinsAwarded()).append(" coins");
        if (result.perfect()) {
            text.append(" (perfect score bonus included)");
        }
        text.append(". Balance: ").append(result.balance()).append('.');
        if (result.unlockedLevel() != null) {
            text.append("\n🔓 Level ").append(result.unlockedLevel()).append(" unlocked!");
        }
        return new OutboundView(ViewId.QUIZ_RESULT, text.toString(), List.of(
                List.of(Button.of("🔁 Try again", ActionId.QUIZ_LEVEL, result.level())),
                List.of(Button.of("⬅️ Levels", ActionId.QUIZ_BACK_LEVELS), Button.of("🏠 Home", ActionId.QUIZ_HOME))
        ));
    }

    public OutboundView scenarioMenu(List<Scenario> scenarios, Set<String> badges, int scenarioScore) {
        StringBuilder text = new StringBuilder("Choose a scenario. Your scenario score: ")
                .append(scenarioScore).append('.');
        List<List<Button>> rows = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            boolean done = scenario.badge() != null && badges.contains(scenario.badge());
            String label = (done ? "✅ " : "") + scenario.title() + " (+" + scenario.reward() + ")";
            rows.add(List.of(Button.of(label, ActionId.SCENARIO_START, scenario.id())));
        }
        if (scenarios.isEmpty()) {
            text.append("\n\nNo scenarios are available yet.");
        }
        rows.add(backRow());
        return new OutboundView(ViewId.SCENARIO_MENU, text.toString(), rows);
    }

    public OutboundView scenarioNode(
            Scenario scenario,
            ScenarioNode.DecisionNode node,
            ScenarioChoice lastChoice,
            String lastFeedback) {
        StringBuilder text = new StringBuilder();
        if (lastChoice == null) {
            text.append("🎭 ").append(scenario.title()).append('\n');
            if (scenario.intro() != null && !scenario.intro().isBlank()) {
                text.append(scenario.intro()).append('\n');
            }
        } else if (lastFeedback != null && !lastFeedback.isBlank()) {
            text.append(lastChoice.impact().icon()).append(' ').append(lastFeedback).append('\n');
        }
        text.append(progressBar(node.progress())).append("\n\n").append(node.text());

        List<List<Button>> rows = new ArrayList<>();
        List<ScenarioOption> options = node.options();
        for (int i = 0; i < options.size(); i++) {
            rows.add(List.of(Button.of(options.get(i).label(), ActionId.SCENARIO_CHOOSE, scenario.id(), node.id(), i)));
        }
        rows.add(List.of(Button.of("⬅️ All scenarios", ActionId.SCENARIO_HOME)));
        return new OutboundView(ViewId.SCENARIO_PLAY, text.toString(), rows);
    }

    public OutboundView scenarioResult(Scenario scenario, ScenarioConclusion conclusion, RewardGrant grant) {
        StringBuilder text = new StringBuilder();
        if (conclusion.lastFeedback() != null && !conclusion.lastFeedback().isBlank()) {
            text.append(conclusion.lastFeedback()).append("\n\n");
        }
        text.append(outcomeHeadline(conclusion.outcome())).append('\n').append(conclusion.text());
        if (!conclusion.history().isEmpty()) {
            text.append("\n\nYour choices:");
            for (ScenarioChoice choice : conclusion.history()) {
                text.append('\n').append(choice.impact().icon()).append(' ').append(choice.label());
            }
        }
        if (grant != null) {
            if (grant.coinsGranted() > 0) {
                text.append("\n\n+").append(grant.coinsGranted()).append(" coins");
            }
            if (grant.badgeGranted() != null) {
                text.append("\n🏅 New badge: ").append(grant.badgeGranted());
            }
            text.append("\nScenario score: ").append(grant.newScore());
        }
        return new OutboundView(ViewId.SCENARIO_RESULT, text.toString(), List.of(
                List.of(Button.of("🔁 Retry", ActionId.SCENARIO_RETRY, scenario.id())),
                List.of(Button.of("📚 All scenarios", ActionId.SCENARIO_MENU), Button.of("🏠 Home", ActionId.MAIN_MENU))
        ));
    }

    public OutboundView balance(LearnerEntity learner, int leaderboardScore) {
        Set<String> badges = learner.getBadgeSet();
        String text = "💰 Coins: " + learner.getCoins()
                + "\n📝 Quizzes passed: " + learner.getQuizzesPassed()
                + "\n🔓 Highest level: " + learner.getMaxUnlockedLevel()
                + "\n🎭 Scenario score: " + learner.getScenarioScore()
                + "\n🏆 Leaderboard score: " + leaderboardScore
                + "\n🏅 Badges: " + (badges.isEmpty() ? "none yet" : String.join(", ", badges));
        return new OutboundView(ViewId.BALANCE, text, List.of(backRow()));
    }

    public OutboundView shop(int coins, int hintCost) {
        String text = "🛒 Shop\nBalance: " + coins + " coins.\n\n💡 Hint: " + hintCost + " coins";
        return new OutboundView(ViewId.SHOP, text, List.of(
                List.of(Button.of("💡 Buy hint (" + hintCost + ")", ActionId.BUY_HINT)),
                List.of(Button.of("ℹ️ Level info", ActionId.LEVEL_INFO)),
                backRow()
        ));
    }

    public String hintText() {
        return "💡 Hint: banks never ask for SMS codes, CVV or passwords. When in doubt, hang up and call "
                + "the number printed on your card.";
    }

    public String levelInfo(int maxUnlockedLevel, int maxLevel) {
        if (maxUnlockedLevel >= maxLevel) {
            return "🏁 You have unlocked the highest level.";
        }
        return "🔓 Level " + (maxUnlockedLevel + 1) + " unlocks after a perfect score on level " + maxUnlockedLevel + ".";
    }

    public String lockedLevel(int level) {
        return "🔒 Level " + level + " is locked. Get a perfect score on level " + (level - 1) + " first.";
    }

    public OutboundView leaderboard(LeaderboardSnapshot snapshot) {
        StringBuilder text = new StringBuilder("🏆 Leaderboard (")
                .append(periodLabel(snapshot.period())).append(")\n");
        if (snapshot.entries().isEmpty()) {
            text.append("\nNo players yet. Be the first!");
        }
        for (LeaderboardRow row : snapshot.entries()) {
            text.append('\n').append(medal(row.rank())).append(' ')
                    .append(row.displayName()).append(" · ").append(row.score());
        }
        text.append("\n\nPlayers: ").append(snapshot.totalPlayers());
        if (snapshot.requester() != null) {
            text.append("\nYour position: #").append(snapshot.requester().rank())
                    .append(" · percentile ")
                    .append(String.format(Locale.ROOT, "%.1f", snapshot.requester().percentile()))
                    .append('%');
        }
        List<Button> periods = new ArrayList<>();
        for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
            if (!period.code().equals(snapshot.period())) {
                periods.add(Button.of(periodLabel(period.code()), ActionId.LEADERBOARD, period.code()));
            }
        }
        return new OutboundView(ViewId.LEADERBOARD, text.toString(), List.of(periods, backRow()));
    }

    public OutboundView referral(ReferralStats stats, String inviteLink) {
        String text = "🎁 Referral Program\n\nYour code: " + stats.code()
                + "\nInvite link: " + inviteLink
                + "\n\nCompleted referrals: " + stats.completed() + " of " + stats.total()
                + "\nFriends needed for the next bonus: " + stats.referralsToNextBonus();
        return new OutboundView(ViewId.REFERRAL, text, List.of(backRow()));
    }

    public OutboundView help() {
        String text = "❓ Help\n\n/start - restart and pick a language\n/menu - main menu\n/quiz - quiz levels"
                + "\n/scenarios - practice scenarios\n/balance - your coins and badges\n/shop - spend coins"
                + "\n/leaderboard [weekly|monthly] - rankings\n/referral - invite friends";
        return new OutboundView(ViewId.HELP, text, List.of(backRow()));
    }

    public static String progressBar(double progress) {
        double clamped = Math.max(0.0, Math.min(1.0, progress));
        int filled = (int) Math.round(clamped * PROGRESS_BAR_WIDTH);
        return String.format(Locale.ROOT, "%d%% [%s%s]",
                Math.round(clamped * 100),
                "=".repeat(filled),
                ".".repeat(PROGRESS_BAR_WIDTH - filled));
    }

    private static String outcomeHeadline(ScenarioOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> "🏆 Well done!";
            case REPORT -> "🛡️ Safe, but there is more you could do.";
            case FAIL -> "💥 You were scammed.";
        };
    }

    private static String medal(int rank) {
        return switch (rank) {
            case 1 -> "🥇";
            case 2 -> "🥈";
            case 3 -> "🥉";
            default -> rank + ".";
        };
    }

    private static String periodLabel(String code) {
        return switch (code) {
            case "weekly" -> "This week";
            case "monthly" -> "This month";
            default -> "All time";
        };
    }

    private static List<Button> backRow() {
        return List.of(Button.of("⬅️ Back", ActionId.BACK), Button.of("🏠 Home", ActionId.MAIN_MENU));
    }
}
