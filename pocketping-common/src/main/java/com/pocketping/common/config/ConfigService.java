package com.pocketping.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pocketping.common.infra.EnvUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bridge configuration.
 * <p>
 * The optional JSON file is read first (with {@code ${VAR}} and
 * {@code ${VAR:-default}} substitution), then every field the file leaves
 * blank is filled from its environment variable.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BridgeConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, System.getenv(), DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Map<String, String> env) {
        this(configPath, env, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Map<String, String> env, Duration cacheTtl) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public BridgeConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BridgeConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private BridgeConfig doLoadConfig() {
        BridgeConfig config;
        if (!Files.exists(configPath)) {
            log.info("Config file not found: {}, using environment only", configPath);
            config = new BridgeConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, BridgeConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new BridgeConfig();
            }
        }
        config = applyDefaults(config);
        applyEnvFallbacks(config);
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    BridgeConfig applyDefaults(BridgeConfig config) {
        if (config.getTelegram() == null) {
            config.setTelegram(new BridgeConfig.TelegramConfig());
        }
        if (config.getDiscord() == null) {
            config.setDiscord(new BridgeConfig.DiscordConfig());
        }
        if (config.getSlack() == null) {
            config.setSlack(new BridgeConfig.SlackConfig());
        }
        if (config.getUaFilter() == null) {
            config.setUaFilter(new BridgeConfig.UserAgentFilterConfig());
        }
        if (config.getIpFilter() == null) {
            config.setIpFilter(new BridgeConfig.IpFilterConfig());
        }
        if (config.getRegistry() == null) {
            config.setRegistry(new BridgeConfig.RegistryConfig());
        }
        if (config.getPort() <= 0 || config.getPort() > 65535) {
            config.setPort(BridgeConfig.DEFAULT_PORT);
        }
        return config;
    }

    /**
     * Fill blank fields from the environment.
     */
    void applyEnvFallbacks(BridgeConfig config) {
        if (env.containsKey("PORT")) {
            config.setPort(EnvUtils.getInt(env, "PORT", BridgeConfig.DEFAULT_PORT, 1, 65535));
        }
        fill(config.getApiKey(), "API_KEY", config::setApiKey);
        fill(config.getBackendWebhookUrl(), "BACKEND_WEBHOOK_URL", config::setBackendWebhookUrl);
        fill(config.getEventsWebhookUrl(), "EVENTS_WEBHOOK_URL", config::setEventsWebhookUrl);
        fill(config.getEventsWebhookSecret(), "EVENTS_WEBHOOK_SECRET", config::setEventsWebhookSecret);
        if (config.getTestBotIds() == null || config.getTestBotIds().isEmpty()) {
            config.setTestBotIds(new ArrayList<>(EnvUtils.getList(env, "BRIDGE_TEST_BOT_IDS")));
        }

        BridgeConfig.TelegramConfig tg = config.getTelegram();
        fill(tg.getBotToken(), "TELEGRAM_BOT_TOKEN", tg::setBotToken);
        fill(tg.getChatId(), "TELEGRAM_CHAT_ID", tg::setChatId);

        BridgeConfig.DiscordConfig dc = config.getDiscord();
        fill(dc.getBotToken(), "DISCORD_BOT_TOKEN", dc::setBotToken);
        fill(dc.getChannelId(), "DISCORD_CHANNEL_ID", dc::setChannelId);
        fill(dc.getWebhookUrl(), "DISCORD_WEBHOOK_URL", dc::setWebhookUrl);
        fill(dc.getUsername(), "DISCORD_USERNAME", dc::setUsername);
        fill(dc.getAvatarUrl(), "DISCORD_AVATAR_URL", dc::setAvatarUrl);
        if (!dc.isEnableGateway()) {
            dc.setEnableGateway(EnvUtils.isTruthy(env.get("DISCORD_ENABLE_GATEWAY")));
        }

        BridgeConfig.SlackConfig sl = config.getSlack();
        fill(sl.getBotToken(), "SLACK_BOT_TOKEN", sl::setBotToken);
        fill(sl.getChannelId(), "SLACK_CHANNEL_ID", sl::setChannelId);
        fill(sl.getWebhookUrl(), "SLACK_WEBHOOK_URL", sl::setWebhookUrl);
        fill(sl.getUsername(), "SLACK_USERNAME", sl::setUsername);
        fill(sl.getIconEmoji(), "SLACK_ICON_EMOJI", sl::setIconEmoji);

        BridgeConfig.UserAgentFilterConfig ua = config.getUaFilter();
        if (!ua.isEnabled() && EnvUtils.isTruthy(env.get("UA_FILTER_ENABLED"))) {
            ua.setEnabled(true);
            ua.setMode(BridgeConfig.FilterMode.parse(env.get("UA_FILTER_MODE"), ua.getMode()));
            ua.setUseDefaultBots(EnvUtils.getBoolean(env, "UA_FILTER_USE_DEFAULT_BOTS", ua.isUseDefaultBots()));
            ua.setLogBlocked(EnvUtils.getBoolean(env, "UA_FILTER_LOG_BLOCKED", ua.isLogBlocked()));
        }
        fillList(ua.getBlocklist(), "UA_FILTER_BLOCKLIST", ua::setBlocklist);
        fillList(ua.getAllowlist(), "UA_FILTER_ALLOWLIST", ua::setAllowlist);

        BridgeConfig.IpFilterConfig ip = config.getIpFilter();
        if (!ip.isEnabled() && EnvUtils.isTruthy(env.get("IP_FILTER_ENABLED"))) {
            ip.setEnabled(true);
            ip.setMode(BridgeConfig.FilterMode.parse(env.get("IP_FILTER_MODE"), ip.getMode()));
            ip.setLogBlocked(EnvUtils.getBoolean(env, "IP_FILTER_LOG_BLOCKED", ip.isLogBlocked()));
            ip.setBlockedStatusCode(EnvUtils.getInt(env, "IP_FILTER_BLOCKED_STATUS_CODE",
                    ip.getBlockedStatusCode(), 400, 599));
            fill(null, "IP_FILTER_BLOCKED_MESSAGE", ip::setBlockedMessage);
        }
        fillList(ip.getBlocklist(), "IP_FILTER_BLOCKLIST", ip::setBlocklist);
        fillList(ip.getAllowlist(), "IP_FILTER_ALLOWLIST", ip::setAllowlist);

        BridgeConfig.RegistryConfig reg = config.getRegistry();
        reg.setTtlHours(EnvUtils.getInt(env, "REGISTRY_TTL_HOURS", (int) reg.getTtlHours(), 1, 24 * 365));
        reg.setMaxEntries(EnvUtils.getInt(env, "REGISTRY_MAX_ENTRIES", (int) reg.getMaxEntries(), 1,
                Integer.MAX_VALUE));
    }

    private void fill(String current, String envKey, Consumer<String> setter) {
        if (current != null && !current.isBlank()) {
            return;
        }
        String value = EnvUtils.get(env, envKey);
        if (value != null) {
            setter.accept(value);
        }
    }

    private void fillList(List<String> current, String envKey, Consumer<List<String>> setter) {
        if (current != null && !current.isEmpty()) {
            return;
        }
        List<String> values = EnvUtils.getList(env, envKey);
        if (!values.isEmpty()) {
            setter.accept(new ArrayList<>(values));
        }
    }
}
