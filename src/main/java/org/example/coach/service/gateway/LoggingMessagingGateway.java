package org.example.coach.service.gateway;

import org.example.coach.service.conversation.OutboundView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway used when no chat transport is configured. Views are written to the log only.
 */
public class LoggingMessagingGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessagingGateway.class);

    @Override
    public void sendView(long userId, OutboundView view) {
        log.info("[send -> {}] {}: {}", userId, view.view(), view.text());
    }

    @Override
    public void editCurrentView(long userId, OutboundView view) {
        log.info("[edit -> {}] {}: {}", userId, view.view(), view.text());
    }

    @Override
    public void acknowledgeButton(String callbackId) {
        log.debug("[ack] {}", callbackId);
    }

    @Override
    public String getGatewayName() {
        return "logging";
    }
}
