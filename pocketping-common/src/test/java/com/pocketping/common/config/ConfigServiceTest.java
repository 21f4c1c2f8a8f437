package com.pocketping.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;
    private Map<String, String> env;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("bridge.json");
        env = new HashMap<>();
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "port": 4000,
                  "apiKey": "${BRIDGE_KEY:-from-default}",
                  "telegram": { "botToken": "123:abc", "chatId": "-100200" },
                  "uaFilter": { "enabled": true, "mode": "both" }
                }
                """;
        Files.writeString(configPath, json);

        BridgeConfig config = new ConfigService(configPath, env).loadConfig();

        assertEquals(4000, config.getPort());
        assertEquals("from-default", config.getApiKey());
        assertTrue(config.getTelegram().isEnabled());
        assertEquals(BridgeConfig.FilterMode.BOTH, config.getUaFilter().getMode());
        assertFalse(config.getSlack().isEnabled());
    }

    @Test
    void loadConfig_missingFile_readsEnvironment() {
        env.put("PORT", "8080");
        env.put("API_KEY", "secret");
        env.put("DISCORD_WEBHOOK_URL", "https://discord.example/webhook");
        env.put("DISCORD_ENABLE_GATEWAY", "1");
        env.put("BRIDGE_TEST_BOT_IDS", "111, 222 ,");
        env.put("UA_FILTER_ENABLED", "true");
        env.put("UA_FILTER_MODE", "allowlist");
        env.put("UA_FILTER_ALLOWLIST", "Mozilla,/chrome\\/\\d+/");

        BridgeConfig config = new ConfigService(tempDir.resolve("missing.json"), env).loadConfig();

        assertEquals(8080, config.getPort());
        assertEquals("secret", config.getApiKey());
        assertTrue(config.getDiscord().isEnabled());
        assertFalse(config.getDiscord().isBotMode());
        assertTrue(config.getDiscord().isEnableGateway());
        assertEquals(List.of("111", "222"), config.getTestBotIds());
        assertTrue(config.getUaFilter().isEnabled());
        assertEquals(BridgeConfig.FilterMode.ALLOWLIST, config.getUaFilter().getMode());
        assertEquals(2, config.getUaFilter().getAllowlist().size());
        assertTrue(config.getUaFilter().isUseDefaultBots());
    }

    @Test
    void loadConfig_invalidPort_fallsBackToDefault() {
        env.put("PORT", "not-a-port");
        BridgeConfig config = new ConfigService(configPath, env).loadConfig();
        assertEquals(BridgeConfig.DEFAULT_PORT, config.getPort());

        env.put("PORT", "70000");
        assertEquals(BridgeConfig.DEFAULT_PORT, new ConfigService(configPath, env).loadConfig().getPort());
    }

    @Test
    void loadConfig_fileValuesWinOverEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "slack": { "botToken": "xoxb-file", "channelId": "C1" } }
                """);
        env.put("SLACK_BOT_TOKEN", "xoxb-env");
        env.put("SLACK_USERNAME", "PocketPing");

        BridgeConfig config = new ConfigService(configPath, env).loadConfig();

        assertEquals("xoxb-file", config.getSlack().getBotToken());
        assertEquals("PocketPing", config.getSlack().getUsername());
        assertTrue(config.getSlack().isBotMode());
    }

    @Test
    void loadConfig_malformedFile_usesDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");
        BridgeConfig config = new ConfigService(configPath, env).loadConfig();
        assertNotNull(config.getTelegram());
        assertEquals(BridgeConfig.DEFAULT_PORT, config.getPort());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath, env);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_presentVariable_replaced() {
        env.put("TOKEN", "abc");
        ConfigService service = new ConfigService(configPath, env);
        assertEquals("t=abc", service.substituteEnvVars("t=${TOKEN:-zzz}"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"port\": 5000 }");

        ConfigService service = new ConfigService(configPath, env);
        BridgeConfig first = service.loadConfig();
        BridgeConfig second = service.loadConfig();

        assertSame(first, second);
        assertNotSame(first, service.reloadConfig());
    }
}
