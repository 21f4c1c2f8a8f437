package com.pocketping.app.health;

import com.pocketping.channel.ChannelBeanConfig.BridgeLifecycle;
import com.pocketping.channel.discord.gateway.GatewayState;
import com.pocketping.channel.registry.BridgeRegistry;
import com.pocketping.gateway.events.SseBroadcaster;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness probe listing the enabled bridges and the Discord gateway state.
 */
@RestController
public class HealthEndpoint {

    private final BridgeRegistry bridges;
    private final BridgeLifecycle lifecycle;
    private final SseBroadcaster broadcaster;

    public HealthEndpoint(BridgeRegistry bridges, BridgeLifecycle lifecycle, SseBroadcaster broadcaster) {
        this.bridges = bridges;
        this.lifecycle = lifecycle;
        this.broadcaster = broadcaster;
    }

    /**
     * Always 200 while the process runs; a gateway that gave up reconnecting
     * shows as {@code disconnected} with {@code gatewayExhausted}.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("bridges", bridges.names());
        Optional<GatewayState> gateway = lifecycle.gatewayState();
        gateway.ifPresent(state -> body.put("gateway", state.wireName()));
        if (lifecycle.isGatewayExhausted()) {
            body.put("gatewayExhausted", true);
        }
        body.put("sseSubscribers", broadcaster.subscriberCount());
        return body;
    }
}
