package com.pocketping.gateway.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Session;
import com.pocketping.gateway.events.OutgoingEvent;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget delivery of events to the host backend: custom events to
 * {@code EVENTS_WEBHOOK_URL} (HMAC signed when a secret is set) and
 * operator-origin events to {@code BACKEND_WEBHOOK_URL} (bearer API key).
 * <p>
 * Failures and non-2xx answers are logged and dropped, never retried. The
 * returned futures always complete normally, with the HTTP status or
 * {@code -1} when nothing was delivered.
 */
@Slf4j
public class OutboundWebhookClient implements AutoCloseable {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final BridgeConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = JsonSupport.newMapper();

    public OutboundWebhookClient(BridgeConfig config) {
        this(config, new OkHttpClient.Builder().callTimeout(TIMEOUT).build());
    }

    public OutboundWebhookClient(BridgeConfig config, OkHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    public boolean hasEventsWebhook() {
        return notBlank(config.getEventsWebhookUrl());
    }

    public boolean hasBackendWebhook() {
        return notBlank(config.getBackendWebhookUrl());
    }

    /**
     * POST {@code {event, session, sentAt}} to the events webhook.
     */
    public CompletableFuture<Integer> sendCustomEvent(CustomEvent event, Session session) {
        if (!hasEventsWebhook()) {
            return CompletableFuture.completedFuture(-1);
        }
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(customEventPayload(event, session, Instant.now()));
        } catch (JsonProcessingException e) {
            log.warn("Events webhook: cannot serialize {}: {}", event.getName(), e.getMessage());
            return CompletableFuture.completedFuture(-1);
        }

        Request.Builder request = new Request.Builder()
                .url(config.getEventsWebhookUrl())
                .post(RequestBody.create(body, JSON));
        if (notBlank(config.getEventsWebhookSecret())) {
            request.header(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(config.getEventsWebhookSecret(), body));
        }
        return deliver("events webhook", request.build());
    }

    /**
     * POST an outgoing event to the backend webhook.
     */
    public CompletableFuture<Integer> forwardToBackend(OutgoingEvent event) {
        if (!hasBackendWebhook()) {
            return CompletableFuture.completedFuture(-1);
        }
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            log.warn("Backend webhook: cannot serialize {}: {}", event.getType().getWireName(), e.getMessage());
            return CompletableFuture.completedFuture(-1);
        }

        Request.Builder request = new Request.Builder()
                .url(config.getBackendWebhookUrl())
                .post(RequestBody.create(body, JSON));
        if (config.hasApiKey()) {
            request.header("Authorization", "Bearer " + config.getApiKey());
        }
        return deliver("backend webhook", request.build());
    }

    static Map<String, Object> customEventPayload(CustomEvent event, Session session, Instant sentAt) {
        Map<String, Object> eventJson = new LinkedHashMap<>();
        eventJson.put("name", event.getName());
        eventJson.put("data", event.getData());
        eventJson.put("timestamp", event.getTimestamp());
        eventJson.put("sessionId", event.getSessionId());

        Map<String, Object> sessionJson = new LinkedHashMap<>();
        sessionJson.put("id", session != null ? session.getId() : event.getSessionId());
        sessionJson.put("visitorId", session != null ? session.getVisitorId() : null);
        sessionJson.put("metadata", session != null ? session.getMetadata() : null);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventJson);
        payload.put("session", sessionJson);
        payload.put("sentAt", sentAt.truncatedTo(ChronoUnit.SECONDS).toString());
        return payload;
    }

    private CompletableFuture<Integer> deliver(String target, Request request) {
        CompletableFuture<Integer> result = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("{} delivery failed: {}", target, e.getMessage());
                result.complete(-1);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("{} returned {}", target, response.code());
                    } else {
                        log.debug("{} delivered ({})", target, response.code());
                    }
                    result.complete(response.code());
                }
            }
        });
        return result;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
