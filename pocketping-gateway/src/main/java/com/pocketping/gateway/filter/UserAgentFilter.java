package com.pocketping.gateway.filter;

import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.config.BridgeConfig.FilterMode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * User-Agent allow/block decisions for visitor-originating routes.
 * <p>
 * A pattern wrapped in slashes ({@code /bot-\d+/}) is a case-insensitive
 * regular expression, anything else a case-insensitive substring. In
 * {@code both} mode an allowlist match wins over any blocklist match.
 */
@Slf4j
public class UserAgentFilter {

    private static final Map<String, Pattern> REGEX_CACHE = new ConcurrentHashMap<>();

    private final boolean enabled;
    private final FilterMode mode;
    private final List<String> allowlist;
    private final List<String> customBlocklist;
    private final List<String> blocklist;
    private final boolean logBlocked;

    public UserAgentFilter(BridgeConfig.UserAgentFilterConfig config) {
        this.enabled = config != null && config.isEnabled();
        this.mode = config != null && config.getMode() != null ? config.getMode() : FilterMode.BLOCKLIST;
        this.allowlist = config != null ? List.copyOf(config.getAllowlist()) : List.of();
        this.customBlocklist = config != null ? List.copyOf(config.getBlocklist()) : List.of();
        List<String> combined = new ArrayList<>(customBlocklist);
        if (config == null || config.isUseDefaultBots()) {
            combined.addAll(BotPatterns.DEFAULTS);
        }
        this.blocklist = List.copyOf(combined);
        this.logBlocked = config == null || config.isLogBlocked();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isLogBlocked() {
        return logBlocked;
    }

    /**
     * Decide for one request. A missing User-Agent is allowed (internal
     * callers often send none).
     */
    public FilterDecision check(String userAgent) {
        if (!enabled) {
            return FilterDecision.allow(FilterDecision.Reason.DISABLED);
        }
        if (userAgent == null || userAgent.isEmpty()) {
            return FilterDecision.allow(FilterDecision.Reason.DEFAULT);
        }

        switch (mode) {
            case ALLOWLIST: {
                String matched = firstMatch(userAgent, allowlist);
                return matched != null
                        ? FilterDecision.allow(FilterDecision.Reason.ALLOWLIST, matched)
                        : FilterDecision.block(FilterDecision.Reason.NOT_IN_ALLOWLIST, null);
            }
            case BOTH: {
                String allowed = firstMatch(userAgent, allowlist);
                if (allowed != null) {
                    return FilterDecision.allow(FilterDecision.Reason.ALLOWLIST, allowed);
                }
                return checkBlocklist(userAgent);
            }
            case BLOCKLIST:
            default:
                return checkBlocklist(userAgent);
        }
    }

    private FilterDecision checkBlocklist(String userAgent) {
        String matched = firstMatch(userAgent, blocklist);
        if (matched == null) {
            return FilterDecision.allow(FilterDecision.Reason.DEFAULT);
        }
        boolean custom = firstMatch(userAgent, customBlocklist) != null;
        return FilterDecision.block(custom ? FilterDecision.Reason.BLOCKLIST : FilterDecision.Reason.DEFAULT_BOT,
                matched);
    }

    /**
     * First pattern matching the User-Agent, or null.
     */
    static String firstMatch(String userAgent, List<String> patterns) {
        if (userAgent == null) {
            return null;
        }
        String lower = userAgent.toLowerCase();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isEmpty()) {
                continue;
            }
            if (isRegex(pattern)) {
                Pattern regex = compile(pattern);
                if (regex != null && regex.matcher(lower).find()) {
                    return pattern;
                }
            } else if (lower.contains(pattern.toLowerCase())) {
                return pattern;
            }
        }
        return null;
    }

    static boolean isRegex(String pattern) {
        return pattern.length() > 2 && pattern.startsWith("/") && pattern.endsWith("/");
    }

    private static Pattern compile(String pattern) {
        Pattern cached = REGEX_CACHE.get(pattern);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern compiled = Pattern.compile(pattern.substring(1, pattern.length() - 1), Pattern.CASE_INSENSITIVE);
            REGEX_CACHE.put(pattern, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid User-Agent pattern {}: {}", pattern, e.getDescription());
            return null;
        }
    }
}
