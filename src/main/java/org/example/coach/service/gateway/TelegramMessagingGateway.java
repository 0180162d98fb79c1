package org.example.coach.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.coach.service.conversation.Button;
import org.example.coach.service.conversation.OutboundView;
import org.example.coach.service.conversation.ViewId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram Bot API gateway. Private chats share the user's id, so user id doubles as chat id.
 * The id of the last message sent to each chat is kept so the next view can edit it in place.
 * Notices are never edited over.
 */
public class TelegramMessagingGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramMessagingGateway.class);

    private final WebClient webClient;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;
    private final Map<Long, Long> lastMessageIds = new ConcurrentHashMap<>();

    public TelegramMessagingGateway(String apiBaseUrl, String botToken, int timeoutSeconds, ObjectMapper objectMapper) {
        this(WebClient.builder().baseUrl(apiBaseUrl + "/bot" + botToken).build(), timeoutSeconds, objectMapper);
        log.info("Telegram messaging gateway initialized: baseUrl={}", apiBaseUrl);
    }

    TelegramMessagingGateway(WebClient webClient, int timeoutSeconds, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.timeoutSeconds = timeoutSeconds;
        this.objectMapper = objectMapper;
    }

    @Override
    public void sendView(long userId, OutboundView view) {
        Map<String, Object> body = baseBody(userId, view);
        JsonNode response = post("/sendMessage", body);
        JsonNode messageId = response.path("result").path("message_id");
        if (messageId.isNumber() && view.view() != ViewId.NOTICE) {
            lastMessageIds.put(userId, messageId.asLong());
        }
    }

    @Override
    public void editCurrentView(long userId, OutboundView view) {
        Long messageId = lastMessageIds.get(userId);
        if (messageId == null) {
            sendView(userId, view);
            return;
        }
        Map<String, Object> body = baseBody(userId, view);
        body.put("message_id", messageId);
        try {
            post("/editMessageText", body);
        } catch (MessagingGatewayException e) {
            if (e.getCause() instanceof WebClientResponseException response
                    && response.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()) {
                log.debug("Edit refused for chat {} ({}); sending a new message", userId, response.getResponseBodyAsString());
                sendView(userId, view);
                return;
            }
            throw e;
        }
    }

    @Override
    public void acknowledgeButton(String callbackId) {
        post("/answerCallbackQuery", Map.of("callback_query_id", callbackId));
    }

    @Override
    public String getGatewayName() {
        return "telegram";
    }

    void rememberMessage(long userId, long messageId) {
        lastMessageIds.put(userId, messageId);
    }

    private Map<String, Object> baseBody(long userId, OutboundView view) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", userId);
        body.put("text", view.text());
        if (!view.keyboard().isEmpty()) {
            body.put("reply_markup", Map.of("inline_keyboard", toInlineKeyboard(view.keyboard())));
        }
        return body;
    }

    private List<List<Map<String, String>>> toInlineKeyboard(List<List<Button>> keyboard) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        for (List<Button> row : keyboard) {
            List<Map<String, String>> buttons = new ArrayList<>();
            for (Button button : row) {
                buttons.add(Map.of("text", button.label(), "callback_data", button.data()));
            }
            rows.add(buttons);
        }
        return rows;
    }

    private JsonNode post(String method, Map<String, Object> body) {
        try {
            String response = webClient.post()
                    .uri(method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            JsonNode node = objectMapper.readTree(response == null ? "{}" : response);
            if (!node.path("ok").asBoolean(false)) {
                throw new MessagingGatewayException("Telegram " + method + " returned ok=false: "
                        + node.path("description").asText(""));
            }
            return node;
        } catch (WebClientResponseException e) {
            log.warn("Telegram API error on {}: {} - {}", method, e.getStatusCode(), e.getResponseBodyAsString());
            throw new MessagingGatewayException("Telegram API error: " + e.getStatusCode(), e);
        } catch (MessagingGatewayException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to call Telegram {}", method, e);
            throw new MessagingGatewayException("Failed to call Telegram " + method, e);
        }
    }
}
