package org.example.coach.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();
    private final Map<String, String> seenInChain = new HashMap<>();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void doFilter_webhookCall_getsTelegramIdAndChannel() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/telegram/webhook");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, recordingChain());

        String requestId = response.getHeader(RequestCorrelation.HEADER_NAME);
        assertTrue(requestId.startsWith("tg-"));
        assertEquals(requestId, request.getAttribute(RequestCorrelation.ATTRIBUTE_NAME));
        assertEquals(requestId, seenInChain.get(RequestCorrelation.ATTRIBUTE_NAME));
        assertEquals("telegram", seenInChain.get(RequestCorrelation.CHANNEL_KEY));
    }

    @Test
    void doFilter_incomingId_isTrimmedCappedAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/conversation/events");
        request.addHeader(RequestCorrelation.HEADER_NAME, "  " + "r".repeat(100) + " ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, recordingChain());

        assertEquals("r".repeat(80), response.getHeader(RequestCorrelation.HEADER_NAME));
        assertEquals("api", seenInChain.get(RequestCorrelation.CHANNEL_KEY));
    }

    @Test
    void doFilter_readEndpoint_generatesPlainId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/leaderboard/weekly");
        request.addHeader(RequestCorrelation.HEADER_NAME, "   ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, recordingChain());

        assertFalse(response.getHeader(RequestCorrelation.HEADER_NAME).startsWith("tg-"));
        assertEquals("http", seenInChain.get(RequestCorrelation.CHANNEL_KEY));
    }

    @Test
    void doFilter_clearsEngineContextAfterTheCall() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/conversation/events");
        FilterChain chain = (req, res) -> RequestCorrelation.bindEvent(42L, "button:quiz");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNull(MDC.get(RequestCorrelation.ATTRIBUTE_NAME));
        assertNull(MDC.get(RequestCorrelation.CHANNEL_KEY));
        assertNull(MDC.get(RequestCorrelation.USER_ID_KEY));
        assertNull(MDC.get(RequestCorrelation.EVENT_KEY));
    }

    @Test
    void bindEvent_putsLearnerAndEventKind() {
        RequestCorrelation.bindEvent(7L, "text");

        assertEquals("7", MDC.get(RequestCorrelation.USER_ID_KEY));
        assertEquals("text", MDC.get(RequestCorrelation.EVENT_KEY));

        RequestCorrelation.clearEvent();
        assertNull(MDC.get(RequestCorrelation.USER_ID_KEY));
    }

    private FilterChain recordingChain() {
        return (req, res) -> {
            seenInChain.put(RequestCorrelation.ATTRIBUTE_NAME, MDC.get(RequestCorrelation.ATTRIBUTE_NAME));
            seenInChain.put(RequestCorrelation.CHANNEL_KEY, MDC.get(RequestCorrelation.CHANNEL_KEY));
        };
    }
}
