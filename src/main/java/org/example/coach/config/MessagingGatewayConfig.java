package org.example.coach.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.coach.service.gateway.LoggingMessagingGateway;
import org.example.coach.service.gateway.MessagingGateway;
import org.example.coach.service.gateway.TelegramMessagingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the outbound chat transport.
 */
@Configuration
public class MessagingGatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(MessagingGatewayConfig.class);

    @Value("${telegram.enabled:false}")
    private boolean telegramEnabled;

    @Value("${telegram.bot-token:}")
    private String botToken;

    @Value("${telegram.api-base-url:https://api.telegram.org}")
    private String apiBaseUrl;

    @Value("${telegram.timeout-seconds:10}")
    private int timeoutSeconds;

    @Bean
    public MessagingGateway messagingGateway(ObjectMapper objectMapper) {
        if (!telegramEnabled) {
            log.info("Telegram disabled; replies are logged only");
            return new LoggingMessagingGateway();
        }
        if (botToken == null || botToken.isBlank()) {
            log.warn("telegram.enabled=true but telegram.bot-token is empty, falling back to logging gateway");
            return new LoggingMessagingGateway();
        }
        return new TelegramMessagingGateway(apiBaseUrl, botToken, timeoutSeconds, objectMapper);
    }
}
