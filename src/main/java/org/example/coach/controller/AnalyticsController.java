package org.example.coach.controller;

import org.example.coach.config.CoachProperties;
import org.example.coach.model.AnalyticsSummary;
import org.example.coach.service.AnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final AnalyticsService analyticsService;
    private final CoachProperties properties;

    public AnalyticsController(AnalyticsService analyticsService, CoachProperties properties) {
        this.analyticsService = analyticsService;
        this.properties = properties;
    }

    @GetMapping("/summary")
    public ResponseEntity<AnalyticsSummary> getSummary(
            @RequestParam long userId,
            @RequestParam(defaultValue = "30") int days) {
        if (!properties.isAdmin(userId)) {
            log.warn("Analytics summary denied for user {}", userId);
            return ResponseEntity.status(403).build();
        }
        if (days < 1 || days > 365) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(analyticsService.getSummary(days));
    }
}
