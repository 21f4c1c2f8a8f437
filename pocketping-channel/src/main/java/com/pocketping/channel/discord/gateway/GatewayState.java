package com.pocketping.channel.discord.gateway;

import java.util.EnumSet;
import java.util.Set;

/**
 * Connection states of the Discord gateway client.
 * {@code DISCONNECTED} is only re-entered on a manual stop, a fatal close code
 * or reconnect exhaustion.
 */
public enum GatewayState {
    DISCONNECTED,
    CONNECTING,
    IDENTIFYING,
    CONNECTED,
    RECONNECTING;

    /** Whether moving from this state to {@code next} is a legal transition. */
    public boolean canTransitionTo(GatewayState next) {
        return allowedNext().contains(next);
    }

    private Set<GatewayState> allowedNext() {
        return switch (this) {
            case DISCONNECTED -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(IDENTIFYING, RECONNECTING, DISCONNECTED);
            case IDENTIFYING -> EnumSet.of(CONNECTED, RECONNECTING, DISCONNECTED);
            case CONNECTED -> EnumSet.of(RECONNECTING, DISCONNECTED);
            case RECONNECTING -> EnumSet.of(CONNECTING, DISCONNECTED);
        };
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
