package com.pocketping.gateway.registry;

import java.util.Optional;

/**
 * Internal ids of operator-origin messages: {@code sourceBridge:bridgeMessageId}.
 */
public final class CompositeIds {

    private CompositeIds() {
    }

    public record Parts(String sourceBridge, String bridgeMessageId) {
    }

    /** {@code build("telegram", "482910")} is {@code "telegram:482910"}. */
    public static String build(String sourceBridge, String bridgeMessageId) {
        return sourceBridge + ":" + bridgeMessageId;
    }

    /**
     * Split a composite id at its first colon. Slack timestamps contain dots
     * but no colons, so the remainder is the platform id as-is.
     */
    public static Optional<Parts> parse(String compositeId) {
        if (compositeId == null) {
            return Optional.empty();
        }
        int colon = compositeId.indexOf(':');
        if (colon <= 0 || colon == compositeId.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new Parts(compositeId.substring(0, colon), compositeId.substring(colon + 1)));
    }
}
