package org.example.coach.service.conversation;

import org.example.coach.service.quiz.QuizSession;
import org.example.coach.service.scenario.ScenarioState;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ephemeral per-user conversation state. Guarded by {@link #lock()}; never persisted.
 */
public class SessionState {

    private final long userId;
    private final ReentrantLock lock = new ReentrantLock();
    private NavigationStack navigation = new NavigationStack();
    private String language;
    private QuizSession quiz;
    private ScenarioState scenario;
    private volatile Instant lastSeen;
    private Snapshot checkpoint;

    public SessionState(long userId, Instant createdAt) {
        this.userId = userId;
        this.lastSeen = createdAt;
    }

    public long getUserId() {
        return userId;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public NavigationStack getNavigation() {
        return navigation;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public QuizSession getQuiz() {
        return quiz;
    }

    public void setQuiz(QuizSession quiz) {
        this.quiz = quiz;
    }

    public ScenarioState getScenario() {
        return scenario;
    }

    public void setScenario(ScenarioState scenario) {
        this.scenario = scenario;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }

    public Snapshot snapshot() {
        return new Snapshot(navigation.copy(), language, quiz, scenario);
    }

    public void restore(Snapshot snapshot) {
        this.navigation = snapshot.navigation().copy();
        this.language = snapshot.language();
        this.quiz = snapshot.quiz();
        this.scenario = snapshot.scenario();
    }

    /**
     * Marks the current state as the one a failed event rolls back to. Called when an event
     * starts and again once a ledger write for it has committed.
     */
    public void checkpoint() {
        this.checkpoint = snapshot();
    }

    public void rollback() {
        if (checkpoint != null) {
            restore(checkpoint);
        }
    }

    public record Snapshot(
            NavigationStack navigation,
            String language,
            QuizSession quiz,
            ScenarioState scenario
    ) {
    }
}
