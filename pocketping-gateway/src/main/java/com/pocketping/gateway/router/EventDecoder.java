package com.pocketping.gateway.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.SenderType;
import com.pocketping.common.model.Session;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code {type, ...}} envelopes and convenience-route bodies into
 * {@link InboundEvent} variants. Anything unusable is rejected with
 * {@link InvalidEventException} before it can reach an adapter.
 */
public class EventDecoder {

    private final ObjectMapper mapper;

    public EventDecoder() {
        this(JsonSupport.newMapper());
    }

    public EventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Parse a request body into a JSON object. */
    public JsonNode parse(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new InvalidEventException("Invalid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidEventException("Invalid JSON");
        }
        return node;
    }

    /** Decode a discriminated envelope. */
    public InboundEvent decode(JsonNode envelope) {
        IncomingEventType type = IncomingEventType.fromWire(envelope.path("type").asText(null))
                .orElseThrow(() -> new InvalidEventException("Unknown event type"));
        return decode(type, envelope);
    }

    /**
     * Decode a payload of a known type. Convenience routes call this with the
     * type their path implies.
     */
    public InboundEvent decode(IncomingEventType type, JsonNode payload) {
        return switch (type) {
            case NEW_SESSION -> new InboundEvent.NewSession(requireSession(payload.path("session")));
            case VISITOR_MESSAGE -> visitorMessage(payload);
            case AI_TAKEOVER -> new InboundEvent.AiTakeover(requireSession(payload.path("session")),
                    text(payload, "reason"));
            case OPERATOR_STATUS -> new InboundEvent.OperatorStatus(payload.path("online").asBoolean(false));
            case MESSAGE_READ -> messageRead(payload);
            case CUSTOM_EVENT -> customEvent(payload);
            case IDENTITY_UPDATE -> new InboundEvent.IdentityUpdate(requireSession(payload.path("session")));
            case VISITOR_MESSAGE_EDITED -> new InboundEvent.VisitorMessageEdited(
                    text(payload, "sessionId"),
                    requireText(payload, "messageId"),
                    payload.path("content").asText(""),
                    instantOrNow(payload.path("editedAt")));
            case VISITOR_MESSAGE_DELETED -> new InboundEvent.VisitorMessageDeleted(
                    text(payload, "sessionId"),
                    requireText(payload, "messageId"),
                    instantOrNow(payload.path("deletedAt")));
            case VISITOR_DISCONNECT -> new InboundEvent.VisitorDisconnect(
                    requireSession(payload.path("session")),
                    Math.max(0, payload.path("duration").asLong(0)),
                    text(payload, "reason"));
        };
    }

    /** {@code POST /api/sessions}: the body is the session itself. */
    public InboundEvent.NewSession newSession(JsonNode body) {
        return new InboundEvent.NewSession(requireSession(body));
    }

    // --- Per-type payloads ---

    private InboundEvent visitorMessage(JsonNode payload) {
        JsonNode messageNode = payload.path("message");
        if (!messageNode.isObject()) {
            throw new InvalidEventException("message is required");
        }
        Message message = convert(messageNode, Message.class, "message");
        if (message.getId() == null || message.getId().isBlank()) {
            throw new InvalidEventException("message.id is required");
        }

        Session session = payload.path("session").isObject()
                ? convert(payload.path("session"), Session.class, "session")
                : null;
        if (message.getSessionId() == null && session != null) {
            message.setSessionId(session.getId());
        }
        if (session == null || session.getId() == null) {
            if (message.getSessionId() == null) {
                throw new InvalidEventException("session is required");
            }
            session = Session.ofId(message.getSessionId());
        }
        if (message.getSender() == null) {
            message.setSender(SenderType.VISITOR);
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        }
        return new InboundEvent.VisitorMessage(message, session);
    }

    private InboundEvent messageRead(JsonNode payload) {
        List<String> ids = new ArrayList<>();
        for (JsonNode id : payload.path("messageIds")) {
            if (id.isTextual()) {
                ids.add(id.asText());
            }
        }
        MessageStatus status = MessageStatus.fromWire(payload.path("status").asText(null));
        return new InboundEvent.MessageRead(text(payload, "sessionId"), ids,
                status != null ? status : MessageStatus.READ);
    }

    private InboundEvent customEvent(JsonNode payload) {
        JsonNode eventNode = payload.path("event");
        if (!eventNode.isObject()) {
            throw new InvalidEventException("event is required");
        }
        CustomEvent event = convert(eventNode, CustomEvent.class, "event");
        if (event.getName() == null || event.getName().isBlank()) {
            throw new InvalidEventException("event.name is required");
        }
        Session session = payload.path("session").isObject()
                ? convert(payload.path("session"), Session.class, "session")
                : null;
        if (session == null && event.getSessionId() != null) {
            session = Session.ofId(event.getSessionId());
        }
        if (session == null || session.getId() == null) {
            throw new InvalidEventException("session is required");
        }
        if (event.getSessionId() == null) {
            event.setSessionId(session.getId());
        }
        return new InboundEvent.CustomEventReceived(event, session);
    }

    // --- Helpers ---

    private Session requireSession(JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidEventException("session is required");
        }
        Session session = convert(node, Session.class, "session");
        if (session.getId() == null || session.getId().isBlank()) {
            throw new InvalidEventException("session.id is required");
        }
        return session;
    }

    private <T> T convert(JsonNode node, Class<T> type, String field) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException("Invalid " + field, e);
        }
    }

    private static String text(JsonNode payload, String field) {
        JsonNode value = payload.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String requireText(JsonNode payload, String field) {
        String value = text(payload, field);
        if (value == null || value.isBlank()) {
            throw new InvalidEventException(field + " is required");
        }
        return value;
    }

    private static Instant instantOrNow(JsonNode value) {
        if (value.isTextual()) {
            try {
                return Instant.parse(value.asText());
            } catch (DateTimeParseException e) {
                return Instant.now();
            }
        }
        return Instant.now();
    }
}
