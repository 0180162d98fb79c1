package org.example.coach.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Binds the request id and channel for the duration of a call. Webhook calls from Telegram
 * never carry a request id, so theirs is generated with a {@code tg-} prefix to tell them
 * apart in the logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final int MAX_REQUEST_ID_LENGTH = 80;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String channel = RequestCorrelation.channelOf(request.getRequestURI());
        String requestId = incomingRequestId(request.getHeader(RequestCorrelation.HEADER_NAME));
        if (requestId == null) {
            requestId = newRequestId(channel);
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        MDC.put(RequestCorrelation.CHANNEL_KEY, channel);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
            MDC.remove(RequestCorrelation.CHANNEL_KEY);
            RequestCorrelation.clearEvent();
        }
    }

    static String newRequestId(String channel) {
        String id = UUID.randomUUID().toString();
        return RequestCorrelation.TELEGRAM_CHANNEL.equals(channel) ? "tg-" + id : id;
    }

    private static String incomingRequestId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
