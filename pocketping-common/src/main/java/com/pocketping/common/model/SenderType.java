package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who authored a message.
 */
public enum SenderType {
    VISITOR("visitor", "Visitor"),
    OPERATOR("operator", "Support"),
    AI("ai", "AI");

    private final String wireName;
    private final String label;

    SenderType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Label shown in reply previews. */
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static SenderType fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (SenderType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
