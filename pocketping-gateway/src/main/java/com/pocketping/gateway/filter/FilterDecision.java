package com.pocketping.gateway.filter;

/**
 * Outcome of a request filter.
 *
 * @param allowed        whether the request may proceed
 * @param reason         why (see {@link Reason})
 * @param matchedPattern the list entry that decided, if any
 */
public record FilterDecision(boolean allowed, Reason reason, String matchedPattern) {

    public enum Reason {
        DISABLED, DEFAULT, ALLOWLIST, BLOCKLIST, DEFAULT_BOT, NOT_IN_ALLOWLIST;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static FilterDecision allow(Reason reason) {
        return new FilterDecision(true, reason, null);
    }

    public static FilterDecision allow(Reason reason, String matched) {
        return new FilterDecision(true, reason, matched);
    }

    public static FilterDecision block(Reason reason, String matched) {
        return new FilterDecision(false, reason, matched);
    }
}
