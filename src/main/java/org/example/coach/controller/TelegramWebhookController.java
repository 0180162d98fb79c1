package org.example.coach.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.coach.service.conversation.ConversationEngine;
import org.example.coach.service.conversation.ConversationReply;
import org.example.coach.service.conversation.InboundEvent;
import org.example.coach.service.gateway.ReplyDispatcher;
import org.example.coach.service.gateway.TelegramUpdateMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/telegram")
public class TelegramWebhookController {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    @Value("${telegram.webhook-secret:}")
    private String webhookSecret;

    private final TelegramUpdateMapper updateMapper;
    private final ConversationEngine conversationEngine;
    private final ReplyDispatcher replyDispatcher;

    public TelegramWebhookController(
            TelegramUpdateMapper updateMapper,
            ConversationEngine conversationEngine,
            ReplyDispatcher replyDispatcher) {
        this.updateMapper = updateMapper;
        this.conversationEngine = conversationEngine;
        this.replyDispatcher = replyDispatcher;
    }

    /**
     * Always answers 200 for accepted updates so Telegram does not redeliver them.
     */
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> onUpdate(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody JsonNode update) {
        if (webhookSecret != null && !webhookSecret.isBlank() && !webhookSecret.equals(secret)) {
            log.warn("Rejected webhook call with missing or wrong secret token");
            return ResponseEntity.status(403).build();
        }
        Optional<InboundEvent> event = updateMapper.map(update);
        if (event.isEmpty()) {
            log.debug("Ignoring update {}", update.path("update_id").asText("?"));
            return ResponseEntity.ok(Map.of("ok", true, "handled", false));
        }
        updateMapper.callbackQueryId(update).ifPresent(replyDispatcher::acknowledge);
        ConversationReply reply = conversationEngine.handle(event.get());
        boolean delivered = replyDispatcher.deliver(reply);
        return ResponseEntity.ok(Map.of("ok", true, "handled", true, "delivered", delivered));
    }
}
