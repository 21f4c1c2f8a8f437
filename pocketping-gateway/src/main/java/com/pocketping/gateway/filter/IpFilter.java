package com.pocketping.gateway.filter;

import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.config.BridgeConfig.FilterMode;

import java.util.List;
import java.util.function.Function;

/**
 * IPv4 allow/block decisions against addresses and CIDR ranges, with the
 * same three modes as the User-Agent filter.
 */
public class IpFilter {

    private final boolean enabled;
    private final FilterMode mode;
    private final List<String> allowlist;
    private final List<String> blocklist;
    private final boolean logBlocked;
    private final int blockedStatusCode;
    private final String blockedMessage;

    public IpFilter(BridgeConfig.IpFilterConfig config) {
        this.enabled = config != null && config.isEnabled();
        this.mode = config != null && config.getMode() != null ? config.getMode() : FilterMode.BLOCKLIST;
        this.allowlist = config != null ? List.copyOf(config.getAllowlist()) : List.of();
        this.blocklist = config != null ? List.copyOf(config.getBlocklist()) : List.of();
        this.logBlocked = config == null || config.isLogBlocked();
        this.blockedStatusCode = config != null && config.getBlockedStatusCode() > 0 ? config.getBlockedStatusCode() : 403;
        this.blockedMessage = config != null && config.getBlockedMessage() != null
                && !config.getBlockedMessage().isBlank() ? config.getBlockedMessage() : "Forbidden";
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isLogBlocked() {
        return logBlocked;
    }

    public int getBlockedStatusCode() {
        return blockedStatusCode;
    }

    public String getBlockedMessage() {
        return blockedMessage;
    }

    public FilterDecision check(String ip) {
        if (!enabled) {
            return FilterDecision.allow(FilterDecision.Reason.DISABLED);
        }
        switch (mode) {
            case ALLOWLIST: {
                String matched = matchesAny(ip, allowlist);
                return matched != null
                        ? FilterDecision.allow(FilterDecision.Reason.ALLOWLIST, matched)
                        : FilterDecision.block(FilterDecision.Reason.NOT_IN_ALLOWLIST, null);
            }
            case BOTH: {
                String allowed = matchesAny(ip, allowlist);
                if (allowed != null) {
                    return FilterDecision.allow(FilterDecision.Reason.ALLOWLIST, allowed);
                }
                String blocked = matchesAny(ip, blocklist);
                return blocked != null
                        ? FilterDecision.block(FilterDecision.Reason.BLOCKLIST, blocked)
                        : FilterDecision.allow(FilterDecision.Reason.DEFAULT);
            }
            case BLOCKLIST:
            default: {
                String blocked = matchesAny(ip, blocklist);
                return blocked != null
                        ? FilterDecision.block(FilterDecision.Reason.BLOCKLIST, blocked)
                        : FilterDecision.allow(FilterDecision.Reason.DEFAULT);
            }
        }
    }

    // =========================================================================
    // Client address
    // =========================================================================

    /**
     * Client address from proxy headers: {@code CF-Connecting-IP}, the first
     * {@code X-Forwarded-For} hop, {@code X-Real-IP}, else the socket address.
     */
    public static String clientIp(Function<String, String> headers, String remoteAddr) {
        String cf = headers.apply("CF-Connecting-IP");
        if (cf != null && !cf.isBlank()) {
            return cf.trim();
        }
        String forwarded = headers.apply("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = headers.apply("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return normalizeMapped(remoteAddr != null ? remoteAddr : "");
    }

    private static String normalizeMapped(String ip) {
        return ip.startsWith("::ffff:") ? ip.substring("::ffff:".length()) : ip;
    }

    // =========================================================================
    // CIDR matching
    // =========================================================================

    static String matchesAny(String ip, List<String> entries) {
        for (String entry : entries) {
            if (matchesCidr(ip, entry)) {
                return entry;
            }
        }
        return null;
    }

    /** An entry without a prefix length is a single address (/32). */
    static boolean matchesCidr(String ip, String cidr) {
        if (ip == null || cidr == null) {
            return false;
        }
        String network = cidr.trim();
        int bits = 32;
        int slash = network.indexOf('/');
        if (slash >= 0) {
            try {
                bits = Integer.parseInt(network.substring(slash + 1));
            } catch (NumberFormatException e) {
                return false;
            }
            if (bits < 0 || bits > 32) {
                return false;
            }
            network = network.substring(0, slash);
        }
        long networkNum = ipToNumber(network);
        long ipNum = ipToNumber(ip.trim());
        if (networkNum < 0 || ipNum < 0) {
            return false;
        }
        long mask = bits == 0 ? 0 : (0xFFFFFFFFL << (32 - bits)) & 0xFFFFFFFFL;
        return (ipNum & mask) == (networkNum & mask);
    }

    /** Unsigned 32-bit value of a dotted IPv4 address, or -1. */
    static long ipToNumber(String ip) {
        String[] parts = ip.split("\\.", -1);
        if (parts.length != 4) {
            return -1;
        }
        long result = 0;
        for (String part : parts) {
            int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return -1;
            }
            if (octet < 0 || octet > 255) {
                return -1;
            }
            result = (result << 8) | octet;
        }
        return result;
    }
}
