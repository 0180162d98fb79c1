package org.example.coach.service.gateway;

import org.example.coach.service.ConversationMetricsService;
import org.example.coach.service.conversation.ConversationReply;
import org.example.coach.service.conversation.OutboundView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes a {@link ConversationReply} through the configured gateway.
 */
@Component
public class ReplyDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReplyDispatcher.class);

    private final MessagingGateway gateway;
    private final ConversationMetricsService metricsService;

    public ReplyDispatcher(MessagingGateway gateway, ConversationMetricsService metricsService) {
        this.gateway = gateway;
        this.metricsService = metricsService;
    }

    /**
     * A failed acknowledgement only leaves the client's spinner running, so it is logged and dropped.
     */
    public void acknowledge(String callbackId) {
        try {
            gateway.acknowledgeButton(callbackId);
        } catch (MessagingGatewayException e) {
            metricsService.recordGatewayFailure();
            log.warn("Acknowledging callback {} via {} failed: {}", callbackId, gateway.getGatewayName(), e.getMessage());
        }
    }

    /**
     * @return false if any part of the reply could not be delivered
     */
    public boolean deliver(ConversationReply reply) {
        try {
            if (reply.notice() != null && !reply.notice().isBlank()) {
                gateway.sendView(reply.userId(), OutboundView.notice(reply.notice()));
            }
            List<OutboundView> views = reply.views();
            for (int i = 0; i < views.size(); i++) {
                if (i == 0 && reply.editCurrent()) {
                    gateway.editCurrentView(reply.userId(), views.get(i));
                } else {
                    gateway.sendView(reply.userId(), views.get(i));
                }
            }
            return true;
        } catch (MessagingGatewayException e) {
            metricsService.recordGatewayFailure();
            log.warn("Delivery via {} to user {} failed: {}", gateway.getGatewayName(), reply.userId(), e.getMessage());
            return false;
        }
    }
}
