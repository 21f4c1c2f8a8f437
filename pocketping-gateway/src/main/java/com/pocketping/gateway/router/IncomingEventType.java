package com.pocketping.gateway.router;

import java.util.List;
import java.util.Optional;

/**
 * Event types accepted on {@code POST /api/events}.
 */
public enum IncomingEventType {
    NEW_SESSION("new_session"),
    VISITOR_MESSAGE("visitor_message"),
    AI_TAKEOVER("ai_takeover"),
    OPERATOR_STATUS("operator_status"),
    MESSAGE_READ("message_read"),
    CUSTOM_EVENT("custom_event"),
    IDENTITY_UPDATE("identity_update"),
    VISITOR_MESSAGE_EDITED("visitor_message_edited", "message_edited"),
    VISITOR_MESSAGE_DELETED("visitor_message_deleted", "message_deleted"),
    VISITOR_DISCONNECT("visitor_disconnect", "disconnect");

    private final String wireName;
    private final List<String> aliases;

    IncomingEventType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<IncomingEventType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (IncomingEventType type : values()) {
            if (type.wireName.equals(normalized) || type.aliases.contains(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
