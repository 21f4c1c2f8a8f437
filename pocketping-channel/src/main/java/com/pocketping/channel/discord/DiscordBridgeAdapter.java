package com.pocketping.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.adapter.AbstractBridgeAdapter;
import com.pocketping.channel.adapter.BridgeHttp;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Discord adapter.
 * <p>
 * Bot mode (token + channel) opens one public thread per session and can
 * reply, edit and delete natively. Webhook mode posts everything into the
 * webhook's channel; edits and deletes go through the webhook message routes.
 */
@Slf4j
public class DiscordBridgeAdapter extends AbstractBridgeAdapter {

    public static final String NAME = BridgeMessageIds.DISCORD;
    public static final String API_BASE = "https://discord.com/api/v10";

    static final int PUBLIC_THREAD = 11;
    static final int AUTO_ARCHIVE_MINUTES = 1440;

    private final BridgeConfig.DiscordConfig config;
    private final String apiBase;
    private final BridgeHttp http;

    public DiscordBridgeAdapter(BridgeConfig.DiscordConfig config) {
        this(config, BridgeHttp.defaultClient(), API_BASE);
    }

    DiscordBridgeAdapter(BridgeConfig.DiscordConfig config, OkHttpClient httpClient, String apiBase) {
        this.config = config;
        this.apiBase = apiBase;
        this.http = new BridgeHttp(NAME, httpClient, JsonSupport.newMapper());
    }

    @Override
    public String getName() {
        return NAME;
    }

    public boolean isBotMode() {
        return config.isBotMode();
    }

    @Override
    protected boolean supportsThreads() {
        return config.isBotMode();
    }

    @Override
    protected CompletableFuture<String> createThread(Session session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", DiscordFormat.threadName(session, visitorName(session)));
        body.put("type", PUBLIC_THREAD);
        body.put("auto_archive_duration", AUTO_ARCHIVE_MINUTES);
        return http.post(apiBase + "/channels/" + config.getChannelId() + "/threads", botHeaders(), body)
                .thenApply(response -> response.path("id").asText(null));
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        if (hasThread(session.getId())) {
            return done(null);
        }
        Map<String, Object> embed = DiscordFormat.newSessionEmbed(session, visitorName(session));
        return ensureThread(session)
                .thenCompose(thread -> send(thread, null, List.of(embed), null))
                .thenApply(id -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session, ReplyContext reply) {
        String replyTo = reply != null && reply.getBridgeIds() != null
                ? reply.getBridgeIds().idFor(NAME)
                : null;
        // native replies only exist in bot mode; webhooks fall back to a quote
        boolean nativeReply = replyTo != null && isBotMode();
        String quote = !nativeReply && reply != null ? reply.getQuote() : null;
        String content = DiscordFormat.visitorMessage(message, visitorName(session), quote);
        return ensureThread(session)
                .thenCompose(thread -> send(thread, content, null, nativeReply ? replyTo : null))
                .thenApply(id -> id != null ? BridgeMessageIds.discord(id) : new BridgeMessageIds());
    }

    @Override
    protected CompletableFuture<Void> sendOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        String content = DiscordFormat.operatorMessage(orDefault(operatorName, "Operator"), sourceBridge,
                withAttachmentLinks(message.getContent(), message.getAttachments()));
        return postToSession(session, content, null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        String discordId = bridgeIds != null ? bridgeIds.idFor(NAME) : null;
        if (discordId == null) {
            return done(new BridgeMessageIds());
        }
        Map<String, Object> body = Map.of("content", DiscordFormat.edited(content));
        return http.patch(messageUrl(sessionId, discordId), botHeaders(), body)
                .thenApply(response -> BridgeMessageIds.discord(discordId));
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        String discordId = bridgeIds != null ? bridgeIds.idFor(NAME) : null;
        if (discordId == null) {
            return done(null);
        }
        return http.delete(messageUrl(sessionId, discordId), botHeaders()).thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return postToSession(session, null, DiscordFormat.customEventEmbed(event, http.getObjectMapper()));
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        if (session.getIdentity() == null) {
            return done(null);
        }
        return postToSession(session, null, DiscordFormat.identityEmbed(session));
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return postToSession(session, null, DiscordFormat.aiTakeoverEmbed(reason));
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        if (isBotMode()) {
            String thread = knownThread(session.getId());
            if (thread == null) {
                return done(null);
            }
            return send(thread, message, null, null).thenApply(id -> null);
        }
        return send(null, message, null, null).thenApply(id -> null);
    }

    @Override
    public void close() {
        http.close();
    }

    /** Gateway entry URL from GET /gateway/bot (bot mode only). */
    public CompletableFuture<String> fetchGatewayUrl() {
        if (!isBotMode()) {
            return CompletableFuture.failedFuture(new IllegalStateException("gateway requires bot mode"));
        }
        return http.get(apiBase + "/gateway/bot", botHeaders())
                .thenApply(response -> response.path("url").asText(null));
    }

    private CompletableFuture<Void> postToSession(Session session, String content, Map<String, Object> embed) {
        List<Map<String, Object>> embeds = embed != null ? List.of(embed) : null;
        return ensureThread(session)
                .thenCompose(thread -> send(thread, content, embeds, null))
                .thenApply(id -> null);
    }

    /**
     * Post a message; returns the created message id, or null when the
     * platform did not report one.
     */
    private CompletableFuture<String> send(String threadId, String content, List<Map<String, Object>> embeds,
            String replyTo) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (content != null && !content.isEmpty()) {
            body.put("content", content);
        }
        if (embeds != null && !embeds.isEmpty()) {
            body.put("embeds", embeds);
        }
        if (replyTo != null) {
            body.put("message_reference", Map.of("message_id", replyTo));
        }

        String url;
        if (isBotMode()) {
            url = apiBase + "/channels/" + (threadId != null ? threadId : config.getChannelId()) + "/messages";
        } else {
            if (config.getUsername() != null && !config.getUsername().isBlank()) {
                body.put("username", config.getUsername());
            }
            if (config.getAvatarUrl() != null && !config.getAvatarUrl().isBlank()) {
                body.put("avatar_url", config.getAvatarUrl());
            }
            url = config.getWebhookUrl() + "?wait=true";
        }
        return http.post(url, botHeaders(), body).thenApply(DiscordBridgeAdapter::messageId);
    }

    private String messageUrl(String sessionId, String discordMessageId) {
        if (isBotMode()) {
            String thread = knownThread(sessionId);
            String channel = thread != null ? thread : config.getChannelId();
            return apiBase + "/channels/" + channel + "/messages/" + discordMessageId;
        }
        return config.getWebhookUrl() + "/messages/" + discordMessageId;
    }

    private Map<String, String> botHeaders() {
        if (!isBotMode()) {
            return Map.of();
        }
        return Map.of("Authorization", "Bot " + config.getBotToken());
    }

    private static String messageId(JsonNode response) {
        String id = response.path("id").asText(null);
        return id != null && !id.isEmpty() ? id : null;
    }
}
