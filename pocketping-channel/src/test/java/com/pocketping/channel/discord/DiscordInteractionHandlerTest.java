package com.pocketping.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.channel.inbound.OperatorEvents;
import com.pocketping.channel.inbound.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiscordInteractionHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordingSink sink;
    private DiscordInteractionHandler handler;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        handler = new DiscordInteractionHandler(sink, thread -> "T1".equals(thread) ? "s1" : thread);
    }

    @Test
    void ping_answersPong() throws Exception {
        assertEquals(Map.of("type", 1), handler.handle(json("{\"type\":1}")));
        assertEquals(0, sink.total());
    }

    @Test
    void replyCommand_inThread_sendsOperatorMessage() throws Exception {
        Map<String, Object> response = handler.handle(json("""
                {"type":2,"id":"I1","channel_id":"T1",
                 "member":{"user":{"id":"42","username":"bob","global_name":"Bob B"}},
                 "data":{"name":"reply","options":[{"name":"message","value":"We ship on Monday"}]}}
                """));

        assertEquals(4, response.get("type"));
        assertEquals(Map.of("content", "✅ Message sent to visitor"), response.get("data"));
        OperatorEvents.OperatorMessage message = sink.messages.get(0);
        assertEquals("discord", message.getSourceBridge());
        assertEquals("s1", message.getSessionId());
        assertEquals("I1", message.getBridgeMessageId());
        assertEquals("We ship on Monday", message.getContent());
        assertEquals("Bob B", message.getOperatorName());
    }

    @Test
    void otherCommand_isAcknowledgedWithPong() throws Exception {
        Map<String, Object> response = handler.handle(json("""
                {"type":2,"channel_id":"T1","data":{"name":"close","options":[]}}
                """));

        assertEquals(Map.of("type", 1), response);
        assertEquals(0, sink.total());
    }

    @Test
    void replyWithoutMessageOption_isIgnored() throws Exception {
        handler.handle(json("{\"type\":2,\"channel_id\":\"T1\",\"data\":{\"name\":\"reply\"}}"));

        assertEquals(0, sink.total());
    }

    @Test
    void operatorName_fallsBackToUsernameThenOperator() throws Exception {
        assertEquals("bob", DiscordInteractionHandler.operatorName(json("{\"username\":\"bob\"}")));
        assertEquals("Operator", DiscordInteractionHandler.operatorName(json("{}")));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }
}
