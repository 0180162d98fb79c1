package org.example.coach.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

/**
 * Logging context for one inbound call: the request id and channel are bound by
 * {@link RequestCorrelationFilter}, the learner and event kind by the conversation engine.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String CHANNEL_KEY = "channel";
    public static final String USER_ID_KEY = "userId";
    public static final String EVENT_KEY = "event";
    public static final String UNKNOWN = "unknown";

    static final String TELEGRAM_CHANNEL = "telegram";
    static final String CONVERSATION_CHANNEL = "api";
    static final String READ_CHANNEL = "http";

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        Object requestId = request.getAttribute(ATTRIBUTE_NAME);
        if (requestId instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    /**
     * Which way a call reached the service: the Telegram webhook, the generic event endpoint,
     * or one of the read endpoints.
     */
    public static String channelOf(String requestUri) {
        if (requestUri == null) {
            return READ_CHANNEL;
        }
        if (requestUri.startsWith("/api/telegram/")) {
            return TELEGRAM_CHANNEL;
        }
        if (requestUri.startsWith("/api/conversation/")) {
            return CONVERSATION_CHANNEL;
        }
        return READ_CHANNEL;
    }

    public static void bindEvent(long userId, String eventKind) {
        MDC.put(USER_ID_KEY, String.valueOf(userId));
        MDC.put(EVENT_KEY, eventKind);
    }

    public static void clearEvent() {
        MDC.remove(USER_ID_KEY);
        MDC.remove(EVENT_KEY);
    }
}
