package com.pocketping.gateway;

import com.pocketping.channel.registry.BridgeRegistry;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.config.ConfigService;
import com.pocketping.gateway.events.SseBroadcaster;
import com.pocketping.gateway.filter.IpFilter;
import com.pocketping.gateway.filter.UserAgentFilter;
import com.pocketping.gateway.registry.IdentityRegistry;
import com.pocketping.gateway.relay.OperatorEventRelay;
import com.pocketping.gateway.router.EventRouter;
import com.pocketping.gateway.webhook.OutboundWebhookClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the gateway core: configuration, identity
 * registry, event router, operator relay, SSE fan-out and request filters.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${pocketping.config.path:~/.pocketping/bridge.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        // ConfigService expands a leading ~
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public BridgeConfig bridgeConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public IdentityRegistry identityRegistry(BridgeConfig config) {
        return new IdentityRegistry(config.getRegistry());
    }

    @Bean
    public SseBroadcaster sseBroadcaster() {
        return new SseBroadcaster();
    }

    @Bean(destroyMethod = "close")
    public OutboundWebhookClient outboundWebhookClient(BridgeConfig config) {
        return new OutboundWebhookClient(config);
    }

    @Bean
    public EventRouter eventRouter(BridgeRegistry bridgeRegistry, IdentityRegistry identityRegistry,
            SseBroadcaster sseBroadcaster, OutboundWebhookClient outboundWebhookClient) {
        return new EventRouter(bridgeRegistry, identityRegistry, sseBroadcaster, outboundWebhookClient);
    }

    @Bean
    public OperatorEventRelay operatorEventRelay(BridgeRegistry bridgeRegistry, IdentityRegistry identityRegistry,
            SseBroadcaster sseBroadcaster, OutboundWebhookClient outboundWebhookClient) {
        return new OperatorEventRelay(bridgeRegistry, identityRegistry, sseBroadcaster, outboundWebhookClient);
    }

    @Bean
    public UserAgentFilter userAgentFilter(BridgeConfig config) {
        return new UserAgentFilter(config.getUaFilter());
    }

    @Bean
    public IpFilter ipFilter(BridgeConfig config) {
        return new IpFilter(config.getIpFilter());
    }
}
