package com.pocketping.app.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.channel.InboundHandlers;
import com.pocketping.common.infra.JsonSupport;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Inbound platform webhooks at {@code /webhooks/{telegram,slack,discord}}.
 * <p>
 * Registered as functional endpoints so they stay outside the {@code /api}
 * filters. A platform that is not configured answers 404; a payload that
 * cannot be parsed is acknowledged and dropped so the platform does not retry.
 */
@Slf4j
@Configuration
public class WebhookRouterConfig {

    private static final Map<String, Object> OK = Map.of("ok", true);

    private final ObjectMapper mapper = JsonSupport.newMapper();

    @Bean
    public RouterFunction<ServerResponse> platformWebhookRoutes(InboundHandlers handlers) {
        return RouterFunctions.route()
                .POST("/webhooks/telegram", request -> handle("telegram", request,
                        handlers.telegram().map(h -> (Function<JsonNode, Map<String, Object>>) h::handle)))
                .POST("/webhooks/slack", request -> handle("slack", request,
                        handlers.slack().map(h -> (Function<JsonNode, Map<String, Object>>) h::handle)))
                .POST("/webhooks/discord", request -> handle("discord", request,
                        handlers.discord().map(h -> (Function<JsonNode, Map<String, Object>>) h::handle)))
                .build();
    }

    private ServerResponse handle(String platform, ServerRequest request,
            Optional<Function<JsonNode, Map<String, Object>>> handler) {
        if (handler.isEmpty()) {
            return ServerResponse.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", platform + " not configured"));
        }

        JsonNode payload;
        try {
            String body = request.body(String.class);
            payload = body != null ? mapper.readTree(body) : null;
        } catch (IOException | ServletException e) {
            log.debug("[{}] unreadable webhook body: {}", platform, e.getMessage());
            return ok(OK);
        }
        if (payload == null || !payload.isObject()) {
            log.debug("[{}] ignoring non-object webhook body", platform);
            return ok(OK);
        }

        try {
            return ok(handler.get().apply(payload));
        } catch (RuntimeException e) {
            log.warn("[{}] webhook handling failed: {}", platform, e.getMessage(), e);
            return ok(OK);
        }
    }

    private static ServerResponse ok(Map<String, Object> body) {
        return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
