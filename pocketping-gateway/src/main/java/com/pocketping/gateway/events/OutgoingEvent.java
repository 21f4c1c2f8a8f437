package com.pocketping.gateway.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State change published by the router: a type plus flat fields, serialized
 * as {@code {"type": "...", ...fields}}. Null fields are left out.
 */
public final class OutgoingEvent {

    private final OutgoingEventType type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private OutgoingEvent(OutgoingEventType type) {
        this.type = type;
    }

    public static OutgoingEvent of(OutgoingEventType type) {
        return new OutgoingEvent(type);
    }

    public OutgoingEvent with(String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
        return this;
    }

    public OutgoingEventType getType() {
        return type;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", type.getWireName());
        json.putAll(fields);
        return json;
    }

    @Override
    public String toString() {
        return "OutgoingEvent{" + type.getWireName() + ", " + fields.keySet() + "}";
    }
}
