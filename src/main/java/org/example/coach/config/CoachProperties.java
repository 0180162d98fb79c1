package org.example.coach.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "coach")
public class CoachProperties {

    private static final Logger log = LoggerFactory.getLogger(CoachProperties.class);

    private Quiz quiz = new Quiz();
    private Referral referral = new Referral();
    private Shop shop = new Shop();
    private Session session = new Session();
    private Content content = new Content();
    private Leaderboard leaderboard = new Leaderboard();
    private List<Long> adminIds = new ArrayList<>();

    public Quiz getQuiz() {
        return quiz;
    }

    public void setQuiz(Quiz quiz) {
        this.quiz = quiz == null ? new Quiz() : quiz;
    }

    public Referral getReferral() {
        return referral;
    }

    public void setReferral(Referral referral) {
        this.referral = referral == null ? new Referral() : referral;
    }

    public Shop getShop() {
        return shop;
    }

    public void setShop(Shop shop) {
        this.shop = shop == null ? new Shop() : shop;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session == null ? new Session() : session;
    }

    public Content getContent() {
        return content;
    }

    public void setContent(Content content) {
        this.content = content == null ? new Content() : content;
    }

    public Leaderboard getLeaderboard() {
        return leaderboard;
    }

    public void setLeaderboard(Leaderboard leaderboard) {
        this.leaderboard = leaderboard == null ? new Leaderboard() : leaderboard;
    }

    public List<Long> getAdminIds() {
        return adminIds;
    }

    public void setAdminIds(List<Long> adminIds) {
        this.adminIds = adminIds == null ? new ArrayList<>() : adminIds;
    }

    public boolean isAdmin(long userId) {
        return adminIds.contains(userId);
    }

    public static class Quiz {
        public static final int DEFAULT_PASS_THRESHOLD = 3;

        private int passThreshold = DEFAULT_PASS_THRESHOLD;
        private int maxLevel = 3;
        private int baseReward = 10;
        private int perfectBonus = 5;

        public int getPassThreshold() {
            return passThreshold;
        }

        public void setPassThreshold(int passThreshold) {
            if (passThreshold < 1) {
                log.warn("coach.quiz.pass-threshold must be >= 1, using default: {}", DEFAULT_PASS_THRESHOLD);
                this.passThreshold = DEFAULT_PASS_THRESHOLD;
                return;
            }
            this.passThreshold = passThreshold;
        }

        public int getMaxLevel() {
            return maxLevel;
        }

        public void setMaxLevel(int maxLevel) {
            this.maxLevel = Math.max(1, maxLevel);
        }

        public int getBaseReward() {
            return baseReward;
        }

        public void setBaseReward(int baseReward) {
            this.baseReward = baseReward;
        }

        public int getPerfectBonus() {
            return perfectBonus;
        }

        public void setPerfectBonus(int perfectBonus) {
            this.perfectBonus = perfectBonus;
        }
    }

    public static class Referral {
        private int signupBonus = 20;
        private int milestoneBonus = 50;
        private int milestoneEvery = 3;

        public int getSignupBonus() {
            return signupBonus;
        }

        public void setSignupBonus(int signupBonus) {
            this.signupBonus = signupBonus;
        }

        public int getMilestoneBonus() {
            return milestoneBonus;
        }

        public void setMilestoneBonus(int milestoneBonus) {
            this.milestoneBonus = milestoneBonus;
        }

        public int getMilestoneEvery() {
            return milestoneEvery;
        }

        public void setMilestoneEvery(int milestoneEvery) {
            this.milestoneEvery = Math.max(1, milestoneEvery);
        }
    }

    public static class Shop {
        private int hintCost = 20;

        public int getHintCost() {
            return hintCost;
        }

        public void setHintCost(int hintCost) {
            this.hintCost = hintCost;
        }
    }

    public static class Session {
        private Duration idleTimeout = Duration.ofHours(24);
        private int maxSessions = 50000;

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout == null ? Duration.ofHours(24) : idleTimeout;
        }

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }
    }

    public static class Content {
        private String defaultLanguage = "en";
        private List<String> languages = new ArrayList<>(List.of("ru", "kk", "en"));
        private String quizLocation = "classpath:content/quizzes.json";
        private String scenarioLocation = "classpath:content/scenarios.json";

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }

        public List<String> getLanguages() {
            return languages;
        }

        public void setLanguages(List<String> languages) {
            this.languages = languages == null ? new ArrayList<>() : languages;
        }

        public String getQuizLocation() {
            return quizLocation;
        }

        public void setQuizLocation(String quizLocation) {
            this.quizLocation = quizLocation;
        }

        public String getScenarioLocation() {
            return scenarioLocation;
        }

        public void setScenarioLocation(String scenarioLocation) {
            this.scenarioLocation = scenarioLocation;
        }
    }

    public static class Leaderboard {
        private int defaultLimit = 10;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }
    }
}
