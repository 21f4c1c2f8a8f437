package com.pocketping.gateway.router;

import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.SenderType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventDecoderTest {

    private final EventDecoder decoder = new EventDecoder();

    private InboundEvent decode(String json) {
        return decoder.decode(decoder.parse(json));
    }

    @Test
    void parse_notJson_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class, () -> decoder.parse("{nope"));
        assertEquals("Invalid JSON", e.getMessage());
    }

    @Test
    void parse_jsonArray_rejected() {
        assertThrows(InvalidEventException.class, () -> decoder.parse("[1,2]"));
    }

    @Test
    void decode_unknownType_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class,
                () -> decode("{\"type\":\"teleport\"}"));
        assertEquals("Unknown event type", e.getMessage());
    }

    @Test
    void decode_missingType_rejected() {
        assertThrows(InvalidEventException.class, () -> decode("{\"session\":{\"id\":\"s1\"}}"));
    }

    @Test
    void decode_newSession() {
        InboundEvent event = decode("{\"type\":\"new_session\",\"session\":{\"id\":\"s1\",\"visitorId\":\"v1\","
                + "\"metadata\":{\"url\":\"https://shop.test\"}}}");

        InboundEvent.NewSession newSession = assertInstanceOf(InboundEvent.NewSession.class, event);
        assertEquals("s1", newSession.session().getId());
        assertEquals("https://shop.test", newSession.session().getMetadata().getUrl());
    }

    @Test
    void decode_newSessionWithoutSession_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class, () -> decode("{\"type\":\"new_session\"}"));
        assertEquals("session is required", e.getMessage());
    }

    @Test
    void decode_sessionWithoutId_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class,
                () -> decode("{\"type\":\"new_session\",\"session\":{\"visitorId\":\"v1\"}}"));
        assertEquals("session.id is required", e.getMessage());
    }

    @Test
    void decode_visitorMessage_defaultsSenderAndTimestamp() {
        InboundEvent event = decode("{\"type\":\"visitor_message\",\"message\":{\"id\":\"m1\",\"content\":\"hi\"},"
                + "\"session\":{\"id\":\"s1\"}}");

        InboundEvent.VisitorMessage message = assertInstanceOf(InboundEvent.VisitorMessage.class, event);
        assertEquals(SenderType.VISITOR, message.message().getSender());
        assertEquals("s1", message.message().getSessionId());
        assertNotNull(message.message().getTimestamp());
    }

    @Test
    void decode_visitorMessageWithoutId_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class,
                () -> decode("{\"type\":\"visitor_message\",\"message\":{\"content\":\"hi\"},\"session\":{\"id\":\"s1\"}}"));
        assertEquals("message.id is required", e.getMessage());
    }

    @Test
    void decode_aliases() {
        assertInstanceOf(InboundEvent.VisitorMessageEdited.class,
                decode("{\"type\":\"message_edited\",\"messageId\":\"m1\",\"content\":\"x\"}"));
        assertInstanceOf(InboundEvent.VisitorMessageDeleted.class,
                decode("{\"type\":\"message_deleted\",\"messageId\":\"m1\"}"));
        assertInstanceOf(InboundEvent.VisitorDisconnect.class,
                decode("{\"type\":\"disconnect\",\"session\":{\"id\":\"s1\"},\"duration\":30}"));
    }

    @Test
    void decode_editWithoutMessageId_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class,
                () -> decode("{\"type\":\"visitor_message_edited\",\"content\":\"x\"}"));
        assertEquals("messageId is required", e.getMessage());
    }

    @Test
    void decode_messageRead_defaultsToRead() {
        InboundEvent.MessageRead read = assertInstanceOf(InboundEvent.MessageRead.class,
                decode("{\"type\":\"message_read\",\"sessionId\":\"s1\",\"messageIds\":[\"a\",\"b\"]}"));

        assertEquals(MessageStatus.READ, read.status());
        assertEquals(2, read.messageIds().size());
    }

    @Test
    void decode_customEvent_takesSessionFromEvent() {
        InboundEvent.CustomEventReceived custom = assertInstanceOf(InboundEvent.CustomEventReceived.class,
                decode("{\"type\":\"custom_event\",\"event\":{\"name\":\"clicked_pricing\",\"sessionId\":\"s1\"}}"));

        assertEquals("s1", custom.session().getId());
        assertEquals("clicked_pricing", custom.event().getName());
    }

    @Test
    void decode_customEventWithoutName_rejected() {
        InvalidEventException e = assertThrows(InvalidEventException.class,
                () -> decode("{\"type\":\"custom_event\",\"event\":{},\"session\":{\"id\":\"s1\"}}"));
        assertEquals("event.name is required", e.getMessage());
    }

    @Test
    void decode_disconnect_negativeDurationClamped() {
        InboundEvent.VisitorDisconnect disconnect = assertInstanceOf(InboundEvent.VisitorDisconnect.class,
                decode("{\"type\":\"visitor_disconnect\",\"session\":{\"id\":\"s1\"},\"duration\":-5}"));

        assertEquals(0, disconnect.durationSeconds());
    }
}
