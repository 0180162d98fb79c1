package org.example.coach.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.coach.service.conversation.InboundEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramUpdateMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TelegramUpdateMapper mapper = new TelegramUpdateMapper();

    @Test
    void map_callbackQuery_becomesButtonPress() throws Exception {
        JsonNode update = objectMapper.readTree("""
                {"update_id": 1,
                 "callback_query": {"id": "abc", "data": "quiz_level|2",
                   "from": {"id": 777, "username": "alice", "first_name": "Alice"}}}
                """);

        InboundEvent.ButtonPress press = assertInstanceOf(InboundEvent.ButtonPress.class, mapper.map(update).orElseThrow());

        assertEquals(777L, press.userId());
        assertEquals("quiz_level|2", press.data());
        assertEquals("alice", press.sender().username());
        assertEquals("Alice", press.sender().firstName());
        assertNull(press.sender().lastName());
    }

    @Test
    void map_textMessage_becomesTextMessage() throws Exception {
        JsonNode update = objectMapper.readTree("""
                {"update_id": 2,
                 "message": {"message_id": 5, "text": "/start ABCD1234",
                   "from": {"id": 888, "first_name": "Bob", "last_name": "Stone"}}}
                """);

        InboundEvent.TextMessage text = assertInstanceOf(InboundEvent.TextMessage.class, mapper.map(update).orElseThrow());

        assertEquals(888L, text.userId());
        assertEquals("/start ABCD1234", text.body());
        assertNull(text.sender().username());
        assertEquals("Stone", text.sender().lastName());
    }

    @Test
    void callbackQueryId_presentOnlyForButtonPresses() throws Exception {
        assertEquals("abc", mapper.callbackQueryId(objectMapper.readTree(
                "{\"callback_query\": {\"id\": \"abc\", \"data\": \"back\", \"from\": {\"id\": 1}}}")).orElseThrow());
        assertTrue(mapper.callbackQueryId(objectMapper.readTree(
                "{\"message\": {\"text\": \"/menu\", \"from\": {\"id\": 1}}}")).isEmpty());
        assertTrue(mapper.callbackQueryId(null).isEmpty());
    }

    @Test
    void map_unsupportedUpdates_areIgnored() throws Exception {
        assertTrue(mapper.map(objectMapper.readTree("{\"update_id\": 3, \"edited_message\": {}}")).isEmpty());
        assertTrue(mapper.map(objectMapper.readTree(
                "{\"message\": {\"sticker\": {}, \"from\": {\"id\": 1}}}")).isEmpty());
        assertTrue(mapper.map(objectMapper.readTree(
                "{\"callback_query\": {\"data\": \"back\", \"from\": {}}}")).isEmpty());
        assertTrue(mapper.map(null).isEmpty());
    }
}
