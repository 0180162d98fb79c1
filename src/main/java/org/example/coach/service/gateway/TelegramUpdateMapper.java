package org.example.coach.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.coach.model.SenderProfile;
import org.example.coach.service.conversation.InboundEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a raw Telegram {@code Update} to an {@link InboundEvent}. Updates that carry neither a
 * callback query nor a text message are ignored.
 */
@Component
public class TelegramUpdateMapper {

    public Optional<InboundEvent> map(JsonNode update) {
        if (update == null || update.isMissingNode() || update.isNull()) {
            return Optional.empty();
        }
        JsonNode callback = update.path("callback_query");
        if (callback.isObject()) {
            JsonNode from = callback.path("from");
            if (!from.path("id").canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(new InboundEvent.ButtonPress(
                    from.path("id").asLong(), callback.path("data").asText(""), sender(from)));
        }
        JsonNode message = update.path("message");
        if (message.isObject() && message.path("text").isTextual()) {
            JsonNode from = message.path("from");
            if (!from.path("id").canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(new InboundEvent.TextMessage(
                    from.path("id").asLong(), message.path("text").asText(), sender(from)));
        }
        return Optional.empty();
    }

    /**
     * Id Telegram expects back in {@code answerCallbackQuery}, present only on button presses.
     */
    public Optional<String> callbackQueryId(JsonNode update) {
        if (update == null) {
            return Optional.empty();
        }
        JsonNode id = update.path("callback_query").path("id");
        return id.isTextual() && !id.asText().isBlank() ? Optional.of(id.asText()) : Optional.empty();
    }

    private static SenderProfile sender(JsonNode from) {
        return new SenderProfile(text(from, "username"), text(from, "first_name"), text(from, "last_name"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
