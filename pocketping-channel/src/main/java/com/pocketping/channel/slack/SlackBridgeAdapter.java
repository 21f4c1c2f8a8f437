package com.pocketping.channel.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.adapter.AbstractBridgeAdapter;
import com.pocketping.channel.adapter.BridgeApiException;
import com.pocketping.channel.adapter.BridgeHttp;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.infra.JsonSupport;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Slack adapter.
 * <p>
 * In bot mode the "New Chat Session" post is the thread parent and every
 * later message of the session is posted with its {@code thread_ts}. Incoming
 * webhooks cannot thread, edit or delete; they answer a plain {@code ok}.
 */
@Slf4j
public class SlackBridgeAdapter extends AbstractBridgeAdapter {

    public static final String NAME = BridgeMessageIds.SLACK;
    public static final String API_BASE = "https://slack.com/api";

    private final BridgeConfig.SlackConfig config;
    private final String apiBase;
    private final BridgeHttp http;

    public SlackBridgeAdapter(BridgeConfig.SlackConfig config) {
        this(config, BridgeHttp.defaultClient(), API_BASE);
    }

    SlackBridgeAdapter(BridgeConfig.SlackConfig config, OkHttpClient httpClient, String apiBase) {
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
        String name = visitorName(session);
        return post(null, SlackFormat.newSessionText(name), SlackFormat.newSessionBlocks(session, name));
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        if (!isBotMode()) {
            String name = visitorName(session);
            return post(null, SlackFormat.newSessionText(name), SlackFormat.newSessionBlocks(session, name))
                    .thenApply(ts -> null);
        }
        // the announcement is the thread parent
        return ensureThread(session).thenApply(ts -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session, ReplyContext reply) {
        String quote = reply != null ? reply.getQuote() : null;
        String text = SlackFormat.visitorMessage(message, visitorName(session), quote);
        return ensureThread(session)
                .thenCompose(thread -> post(thread, text, null))
                .thenApply(ts -> ts != null ? BridgeMessageIds.slack(ts) : new BridgeMessageIds());
    }

    @Override
    protected CompletableFuture<Void> sendOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        String text = SlackFormat.operatorMessage(orDefault(operatorName, "Operator"), sourceBridge,
                withAttachmentLinks(message.getContent(), message.getAttachments()));
        return ensureThread(session)
                .thenCompose(thread -> post(thread, text, null))
                .thenApply(ts -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        String ts = bridgeIds != null ? bridgeIds.idFor(NAME) : null;
        if (!isBotMode() || ts == null) {
            return done(new BridgeMessageIds());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", config.getChannelId());
        body.put("ts", ts);
        body.put("text", SlackFormat.edited(content));
        return callApi("chat.update", body).thenApply(response -> BridgeMessageIds.slack(ts));
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        String ts = bridgeIds != null ? bridgeIds.idFor(NAME) : null;
        if (!isBotMode() || ts == null) {
            return done(null);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", config.getChannelId());
        body.put("ts", ts);
        return callApi("chat.delete", body).thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return postToSession(session, "Event: " + event.getName(),
                SlackFormat.customEventBlocks(event, http.getObjectMapper()));
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        if (session.getIdentity() == null) {
            return done(null);
        }
        return postToSession(session, "User identified: " + session.getIdentity().getId(),
                SlackFormat.identityBlocks(session));
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return postToSession(session, "AI Takeover: " + reason, SlackFormat.aiTakeoverBlocks(reason));
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        if (isBotMode()) {
            String thread = knownThread(session.getId());
            if (thread == null) {
                return done(null);
            }
            return post(thread, SlackFormat.escape(message), null).thenApply(ts -> null);
        }
        return post(null, SlackFormat.escape(message), null).thenApply(ts -> null);
    }

    @Override
    public void close() {
        http.close();
    }

    /**
     * Display name of a workspace member via users.info: real name, else
     * name, else "Operator".
     */
    public CompletableFuture<String> lookupUserName(String userId) {
        if (!isBotMode() || userId == null || userId.isBlank()) {
            return done("Operator");
        }
        Map<String, String> headers = Map.of("Authorization", "Bearer " + config.getBotToken());
        String url = HttpUrl.get(apiBase + "/users.info").newBuilder()
                .addQueryParameter("user", userId)
                .build()
                .toString();
        return http.get(url, headers).thenApply(response -> {
            JsonNode user = response.path("user");
            String realName = user.path("real_name").asText("");
            if (realName.isBlank()) {
                realName = user.path("profile").path("real_name").asText("");
            }
            if (!realName.isBlank()) {
                return realName;
            }
            String name = user.path("name").asText("");
            return name.isBlank() ? "Operator" : name;
        });
    }

    private CompletableFuture<Void> postToSession(Session session, String fallbackText,
            List<Map<String, Object>> blocks) {
        return ensureThread(session)
                .thenCompose(thread -> post(thread, fallbackText, blocks))
                .thenApply(ts -> null);
    }

    /**
     * Post a message. Bot mode returns its {@code ts}; webhook mode returns null.
     */
    private CompletableFuture<String> post(String threadTs, String text, List<Map<String, Object>> blocks) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        if (blocks != null && !blocks.isEmpty()) {
            body.put("blocks", blocks);
        }
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            body.put("username", config.getUsername());
        }
        if (config.getIconEmoji() != null && !config.getIconEmoji().isBlank()) {
            body.put("icon_emoji", config.getIconEmoji());
        }

        if (!isBotMode()) {
            return http.postForText(config.getWebhookUrl(), Map.of(), body).thenApply(reply -> {
                if (!"ok".equals(reply.trim())) {
                    throw new BridgeApiException(NAME, 0, "webhook error: " + reply);
                }
                return null;
            });
        }

        body.put("channel", config.getChannelId());
        if (threadTs != null) {
            body.put("thread_ts", threadTs);
        }
        return callApi("chat.postMessage", body).thenApply(response -> {
            String ts = response.path("ts").asText(null);
            return ts != null && !ts.isEmpty() ? ts : null;
        });
    }

    private CompletableFuture<JsonNode> callApi(String method, Map<String, Object> body) {
        Map<String, String> headers = Map.of("Authorization", "Bearer " + config.getBotToken());
        return http.post(apiBase + "/" + method, headers, body).thenApply(response -> {
            if (!response.path("ok").asBoolean(false)) {
                throw new BridgeApiException(NAME, 0,
                        response.path("error").asText("unknown error") + " (" + method + ")");
            }
            return response;
        });
    }
}
