package com.pocketping.gateway.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types published to SSE subscribers and the backend webhook.
 */
public enum OutgoingEventType {
    NEW_SESSION("new_session"),
    VISITOR_MESSAGE("visitor_message"),
    OPERATOR_MESSAGE("operator_message"),
    OPERATOR_MESSAGE_EDITED("operator_message_edited"),
    OPERATOR_MESSAGE_DELETED("operator_message_deleted"),
    MESSAGE_EDITED("message_edited"),
    MESSAGE_DELETED("message_deleted"),
    MESSAGE_READ("message_read"),
    CUSTOM_EVENT("custom_event"),
    OPERATOR_STATUS("operator_status"),
    AI_TAKEOVER("ai_takeover"),
    IDENTITY_UPDATE("identity_update"),
    DISCONNECT("disconnect");

    private final String wireName;

    OutgoingEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
