package org.example.coach.controller;

import org.example.coach.model.SenderProfile;
import org.example.coach.service.conversation.ConversationEngine;
import org.example.coach.service.conversation.ConversationReply;
import org.example.coach.service.conversation.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Transport-neutral entry point: a gateway adapter posts events and renders the returned views itself.
 */
@RestController
@RequestMapping("/api/conversation")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationEngine conversationEngine;

    public ConversationController(ConversationEngine conversationEngine) {
        this.conversationEngine = conversationEngine;
    }

    @PostMapping("/events")
    public ResponseEntity<ConversationReply> handleEvent(@RequestBody EventRequest request) {
        if (request == null || request.userId() == null || request.kind() == null) {
            return ResponseEntity.badRequest().build();
        }
        SenderProfile sender = new SenderProfile(request.username(), request.firstName(), request.lastName());
        String payload = request.payload() == null ? "" : request.payload();
        String kind = request.kind().trim().toUpperCase(Locale.ROOT);
        InboundEvent event;
        if ("BUTTON_PRESS".equals(kind)) {
            event = new InboundEvent.ButtonPress(request.userId(), payload, sender);
        } else if ("TEXT".equals(kind)) {
            event = new InboundEvent.TextMessage(request.userId(), payload, sender);
        } else {
            log.warn("Rejected conversation event with unknown kind '{}'", request.kind());
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(conversationEngine.handle(event));
    }

    public record EventRequest(
            Long userId,
            String kind,
            String payload,
            String username,
            String firstName,
            String lastName
    ) {
    }
}
