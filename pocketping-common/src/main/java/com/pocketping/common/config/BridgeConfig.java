package com.pocketping.common.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration of the bridge server.
 * Every field can come from the JSON config file or from its environment
 * variable (see {@link ConfigService}).
 */
@Data
public class BridgeConfig {

    public static final int DEFAULT_PORT = 3001;

    /** HTTP port. */
    private int port = DEFAULT_PORT;

    /** Bearer token required on /api routes; empty disables auth. */
    private String apiKey;

    /** Backend endpoint receiving operator-origin events. */
    private String backendWebhookUrl;

    /** Endpoint receiving custom events. */
    private String eventsWebhookUrl;

    /** HMAC-SHA256 secret used to sign custom-event deliveries. */
    private String eventsWebhookSecret;

    /** Bot author ids let through the bot filter (test harnesses). */
    private List<String> testBotIds = new ArrayList<>();

    private TelegramConfig telegram;
    private DiscordConfig discord;
    private SlackConfig slack;
    private UserAgentFilterConfig uaFilter;
    private IpFilterConfig ipFilter;
    private RegistryConfig registry;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // --- Nested config types ---

    @Data
    public static class TelegramConfig {
        private String botToken;
        /** Forum supergroup receiving one topic per session. */
        private String chatId;

        public boolean isEnabled() {
            return notBlank(botToken) && notBlank(chatId);
        }
    }

    @Data
    public static class DiscordConfig {
        private String botToken;
        /** Channel whose threads hold the sessions (bot mode). */
        private String channelId;
        /** Incoming webhook URL (webhook mode). */
        private String webhookUrl;
        private String username;
        private String avatarUrl;
        /** Open the real-time gateway connection to receive operator replies. */
        private boolean enableGateway;

        public boolean isBotMode() {
            return notBlank(botToken) && notBlank(channelId);
        }

        public boolean isEnabled() {
            return isBotMode() || notBlank(webhookUrl);
        }
    }

    @Data
    public static class SlackConfig {
        private String botToken;
        private String channelId;
        private String webhookUrl;
        private String username;
        private String iconEmoji;

        public boolean isBotMode() {
            return notBlank(botToken) && notBlank(channelId);
        }

        public boolean isEnabled() {
            return isBotMode() || notBlank(webhookUrl);
        }
    }

    public enum FilterMode {
        BLOCKLIST, ALLOWLIST, BOTH;

        @JsonCreator
        public static FilterMode fromJson(String value) {
            return parse(value, BLOCKLIST);
        }

        public static FilterMode parse(String value, FilterMode fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            for (FilterMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
            return fallback;
        }
    }

    @Data
    public static class UserAgentFilterConfig {
        private boolean enabled;
        private FilterMode mode = FilterMode.BLOCKLIST;
        private List<String> allowlist = new ArrayList<>();
        private List<String> blocklist = new ArrayList<>();
        /** Append the built-in bot patterns to the blocklist. */
        private boolean useDefaultBots = true;
        private boolean logBlocked = true;
    }

    @Data
    public static class IpFilterConfig {
        private boolean enabled;
        private FilterMode mode = FilterMode.BLOCKLIST;
        private List<String> allowlist = new ArrayList<>();
        private List<String> blocklist = new ArrayList<>();
        private boolean logBlocked = true;
        private int blockedStatusCode = 403;
        private String blockedMessage = "Forbidden";
    }

    @Data
    public static class RegistryConfig {
        /** Idle time after which a message's identity record is evicted. */
        private long ttlHours = 168;
        private long maxEntries = 100_000;
    }

    static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
