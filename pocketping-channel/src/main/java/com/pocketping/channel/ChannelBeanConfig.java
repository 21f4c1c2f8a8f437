package com.pocketping.channel;

import com.pocketping.channel.discord.DiscordBridgeAdapter;
import com.pocketping.channel.discord.DiscordInteractionHandler;
import com.pocketping.channel.discord.gateway.DiscordGatewayClient;
import com.pocketping.channel.discord.gateway.GatewayState;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.registry.BridgeRegistry;
import com.pocketping.channel.slack.SlackBridgeAdapter;
import com.pocketping.channel.slack.SlackEventsHandler;
import com.pocketping.channel.telegram.TelegramBridgeAdapter;
import com.pocketping.channel.telegram.TelegramWebhookHandler;
import com.pocketping.common.config.BridgeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

/**
 * Spring configuration for platform adapters, their webhook handlers and the
 * Discord gateway connection.
 */
@Slf4j
@Configuration
public class ChannelBeanConfig {

    private final BridgeConfig config;

    public ChannelBeanConfig(BridgeConfig config) {
        this.config = config;
    }

    @Bean
    public BridgeRegistry bridgeRegistry() {
        BridgeRegistry registry = new BridgeRegistry();

        if (config.getTelegram() != null && config.getTelegram().isEnabled()) {
            registry.register(new TelegramBridgeAdapter(config.getTelegram()));
        }
        if (config.getDiscord() != null && config.getDiscord().isEnabled()) {
            registry.register(new DiscordBridgeAdapter(config.getDiscord()));
        }
        if (config.getSlack() != null && config.getSlack().isEnabled()) {
            registry.register(new SlackBridgeAdapter(config.getSlack()));
        }

        if (registry.isEmpty()) {
            log.warn("No bridge configured; set TELEGRAM_*, DISCORD_* or SLACK_* to relay sessions");
        }
        return registry;
    }

    @Bean
    public InboundHandlers inboundHandlers(BridgeRegistry registry, OperatorEventSink sink) {
        TelegramWebhookHandler telegram = registry
                .get(TelegramBridgeAdapter.NAME, TelegramBridgeAdapter.class)
                .map(adapter -> new TelegramWebhookHandler(adapter, sink))
                .orElse(null);
        SlackEventsHandler slack = registry
                .get(SlackBridgeAdapter.NAME, SlackBridgeAdapter.class)
                .map(adapter -> new SlackEventsHandler(adapter, sink, config.getTestBotIds()))
                .orElse(null);
        DiscordInteractionHandler discord = registry
                .get(DiscordBridgeAdapter.NAME, DiscordBridgeAdapter.class)
                .map(adapter -> new DiscordInteractionHandler(adapter, sink))
                .orElse(null);
        return new InboundHandlers(telegram, slack, discord);
    }

    /**
     * Start the Discord gateway when enabled, and release adapters and the
     * gateway socket when the application stops.
     */
    @Bean
    public BridgeLifecycle bridgeLifecycle(BridgeRegistry registry, OperatorEventSink sink) {
        DiscordGatewayClient gateway = null;
        BridgeConfig.DiscordConfig discord = config.getDiscord();
        if (discord != null && discord.isEnableGateway()) {
            Optional<DiscordBridgeAdapter> adapter = registry.get(DiscordBridgeAdapter.NAME,
                    DiscordBridgeAdapter.class);
            if (adapter.isPresent() && adapter.get().isBotMode()) {
                try {
                    gateway = DiscordGatewayClient.forAdapter(adapter.get(), discord.getBotToken(), sink,
                            config.getTestBotIds());
                    gateway.start();
                } catch (RuntimeException e) {
                    log.warn("Failed to start Discord gateway: {}", e.getMessage());
                }
            } else {
                log.warn("Discord gateway needs bot mode (DISCORD_BOT_TOKEN and DISCORD_CHANNEL_ID)");
            }
        }
        return new BridgeLifecycle(registry, gateway);
    }

    /**
     * Owns the long-lived resources of the channel layer, ensuring clean shutdown.
     */
    public static class BridgeLifecycle implements DisposableBean {
        private final BridgeRegistry registry;
        private final DiscordGatewayClient gateway;

        public BridgeLifecycle(BridgeRegistry registry, DiscordGatewayClient gateway) {
            this.registry = registry;
            this.gateway = gateway;
        }

        /** Gateway state, empty when no gateway runs. */
        public Optional<GatewayState> gatewayState() {
            return Optional.ofNullable(gateway).map(DiscordGatewayClient::getState);
        }

        public boolean isGatewayExhausted() {
            return gateway != null && gateway.isExhausted();
        }

        @Override
        public void destroy() {
            if (gateway != null) {
                gateway.close();
            }
            registry.closeAll();
        }
    }
}
