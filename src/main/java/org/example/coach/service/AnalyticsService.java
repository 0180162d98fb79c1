package org.example.coach.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.coach.entity.DailyAnalyticsEntity;
import org.example.coach.entity.UserEventEntity;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.AnalyticsSummary;
import org.example.coach.repository.DailyAnalyticsRepository;
import org.example.coach.repository.LearnerRepository;
import org.example.coach.repository.UserEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User event trail and the daily roll-up built from it.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);
    private static final int TOP_SCENARIOS = 5;

    private final UserEventRepository userEventRepository;
    private final DailyAnalyticsRepository dailyAnalyticsRepository;
    private final LearnerRepository learnerRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnalyticsService(
            UserEventRepository userEventRepository,
            DailyAnalyticsRepository dailyAnalyticsRepository,
            LearnerRepository learnerRepository,
            ObjectMapper objectMapper,
            Clock clock) {
        this.userEventRepository = userEventRepository;
        this.dailyAnalyticsRepository = dailyAnalyticsRepository;
        this.learnerRepository = learnerRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Records an event in its own transaction. A failed write is logged and does not
     * affect the caller's transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void track(long userId, UserEventType type, Map<String, ?> data) {
        try {
            String payload = data == null || data.isEmpty() ? null : objectMapper.writeValueAsString(data);
            userEventRepository.save(new UserEventEntity(userId, type.code(), payload, LocalDateTime.now(clock)));
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Failed to track {} for user {}: {}", type.code(), userId, e.getMessage());
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void track(long userId, UserEventType type) {
        track(userId, type, null);
    }

    /**
     * Rolls up the given UTC day. A day that already has a row is left untouched.
     *
     * @return true if a new row was written
     */
    @Transactional
    public boolean aggregateDailyMetrics(LocalDate day) {
        if (dailyAnalyticsRepository.existsByDate(day)) {
            log.info("Daily analytics for {} already aggregated", day);
            return false;
        }
        LocalDateTime from = day.atStartOfDay();
        LocalDateTime to = day.plusDays(1).atStartOfDay();
        long dau = userEventRepository.countDistinctUsersBetween(from, to);
        long newUsers = learnerRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(from, to);
        long quizCompletions = userEventRepository.countByEventTypeAndOccurredAtGreaterThanEqualAndOccurredAtLessThan(
                UserEventType.QUIZ_COMPLETE.code(), from, to);
        long scenarioCompletions = userEventRepository.countByEventTypeAndOccurredAtGreaterThanEqualAndOccurredAtLessThan(
                UserEventType.SCENARIO_COMPLETE.code(), from, to);
        dailyAnalyticsRepository.save(new DailyAnalyticsEntity(day, dau, newUsers, quizCompletions, scenarioCompletions));
        log.info("Aggregated daily analytics for {}: dau={}, newUsers={}, quizzes={}, scenarios={}",
                day, dau, newUsers, quizCompletions, scenarioCompletions);
        return true;
    }

    /**
     * Rolls up the most recent complete UTC day.
     */
    @Transactional
    public boolean aggregateDailyMetrics() {
        return aggregateDailyMetrics(LocalDate.now(clock).minusDays(1));
    }

    @Transactional(readOnly = true)
    public AnalyticsSummary getSummary(int days) {
        int window = Math.max(1, days);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusDays(window);

        long totalUsers = learnerRepository.count();
        long active7d = userEventRepository.countDistinctUsersBetween(now.minusDays(7), now.plusSeconds(1));
        long quizStarts = userEventRepository.countByEventTypeAndOccurredAtGreaterThanEqual(
                UserEventType.QUIZ_START.code(), cutoff);
        long quizCompletes = userEventRepository.countByEventTypeAndOccurredAtGreaterThanEqual(
                UserEventType.QUIZ_COMPLETE.code(), cutoff);
        double completionRate = quizStarts > 0 ? quizCompletes * 100.0 / quizStarts : 0.0;

        Map<String, Long> scenarioCounts = new LinkedHashMap<>();
        for (UserEventEntity event : userEventRepository.findByTypeSince(UserEventType.SCENARIO_START.code(), cutoff)) {
            scenarioCounts.merge(scenarioIdOf(event), 1L, Long::sum);
        }
        List<AnalyticsSummary.ScenarioPopularity> topScenarios = scenarioCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_SCENARIOS)
                .map(entry -> new AnalyticsSummary.ScenarioPopularity(entry.getKey(), entry.getValue()))
                .toList();

        List<AnalyticsSummary.DailyMetrics> daily = dailyAnalyticsRepository
                .findByDateGreaterThanEqualOrderByDateAsc(cutoff.toLocalDate())
                .stream()
                .map(row -> new AnalyticsSummary.DailyMetrics(
                        row.getDate().toString(),
                        row.getDailyActiveUsers(),
                        row.getNewUsers(),
                        row.getQuizCompletions(),
                        row.getScenarioCompletions()))
                .toList();

        return new AnalyticsSummary(window, totalUsers, active7d, quizStarts, quizCompletes,
                completionRate, topScenarios, daily);
    }

    private String scenarioIdOf(UserEventEntity event) {
        if (event.getEventData() == null) {
            return "unknown";
        }
        try {
            JsonNode data = objectMapper.readTree(event.getEventData());
            return data.path("scenario_id").asText("unknown");
        } catch (IOException e) {
            log.debug("Unreadable event payload on event {}", event.getId());
            return "unknown";
        }
    }
}
