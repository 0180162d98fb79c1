package org.example.coach.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.coach.config.RequestCorrelation;
import org.example.coach.service.ConversationMetricsService;
import org.example.coach.service.conversation.SessionStore;
import org.example.coach.service.gateway.MessagingGateway;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private final ConversationMetricsService metricsService;
    private final SessionStore sessionStore;
    private final MessagingGateway messagingGateway;

    public HealthController(
            ConversationMetricsService metricsService,
            SessionStore sessionStore,
            MessagingGateway messagingGateway) {
        this.metricsService = metricsService;
        this.sessionStore = sessionStore;
        this.messagingGateway = messagingGateway;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        return new HealthDetails(
                "ok",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                messagingGateway.getGatewayName(),
                sessionStore.size(),
                metricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            String gateway,
            int activeSessions,
            Map<String, Object> conversationMetrics
    ) {
    }
}
