package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery status of a message.
 */
public enum MessageStatus {
    SENDING, SENT, DELIVERED, READ;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (MessageStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
