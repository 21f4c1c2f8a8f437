package com.pocketping.channel.telegram;

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
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram Bot API adapter. Each session gets a forum topic in the configured
 * supergroup; visitor messages are posted into that topic.
 */
@Slf4j
public class TelegramBridgeAdapter extends AbstractBridgeAdapter {

    public static final String NAME = BridgeMessageIds.TELEGRAM;
    static final String DEFAULT_API_BASE = "https://api.telegram.org";

    private final String botToken;
    private final String chatId;
    private final String apiBase;
    private final BridgeHttp http;

    public TelegramBridgeAdapter(BridgeConfig.TelegramConfig config) {
        this(config, BridgeHttp.defaultClient(), DEFAULT_API_BASE);
    }

    TelegramBridgeAdapter(BridgeConfig.TelegramConfig config, OkHttpClient httpClient, String apiBase) {
        this.botToken = config.getBotToken();
        this.chatId = config.getChatId();
        this.apiBase = apiBase;
        this.http = new BridgeHttp(NAME, httpClient, JsonSupport.newMapper());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean supportsThreads() {
        return true;
    }

    @Override
    protected CompletableFuture<String> createThread(Session session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("name", TelegramFormat.topicName(session));
        body.put("icon_color", TelegramFormat.TOPIC_ICON_COLOR);
        return callApi("createForumTopic", body)
                .thenApply(result -> result.path("message_thread_id").asText(null));
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        if (hasThread(session.getId())) {
            log.debug("[telegram] topic already exists for session {}", session.getId());
            return done(null);
        }
        return ensureThread(session)
                .thenCompose(thread -> sendMessage(thread, TelegramFormat.newSession(session, visitorName(session)),
                        null))
                .thenApply(id -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session, ReplyContext reply) {
        Long replyTo = reply != null && reply.getBridgeIds() != null && reply.getBridgeIds().hasTelegram()
                ? reply.getBridgeIds().getTelegramMessageId()
                : null;
        String quote = replyTo == null && reply != null ? reply.getQuote() : null;
        String text = TelegramFormat.visitorMessage(message, visitorName(session), quote);
        return ensureThread(session)
                .thenCompose(thread -> sendMessage(thread, text, replyTo))
                .thenApply(BridgeMessageIds::telegram);
    }

    @Override
    protected CompletableFuture<Void> sendOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        String content = withAttachmentLinks(message.getContent(), message.getAttachments());
        String text = TelegramFormat.operatorMessage(orDefault(operatorName, "Operator"), sourceBridge, content);
        return ensureThread(session)
                .thenCompose(thread -> sendMessage(thread, text, null))
                .thenApply(id -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        if (bridgeIds == null || !bridgeIds.hasTelegram()) {
            return done(new BridgeMessageIds());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("message_id", bridgeIds.getTelegramMessageId());
        body.put("text", TelegramFormat.edited(content));
        body.put("parse_mode", "HTML");
        return callApi("editMessageText", body)
                .thenApply(result -> BridgeMessageIds.telegram(bridgeIds.getTelegramMessageId()));
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        if (bridgeIds == null || !bridgeIds.hasTelegram()) {
            return done(null);
        }
        return deleteMessage(bridgeIds.getTelegramMessageId());
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return postToSession(session, TelegramFormat.customEvent(event, http.getObjectMapper()));
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        if (session.getIdentity() == null) {
            return done(null);
        }
        return postToSession(session, TelegramFormat.identity(session));
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return postToSession(session, TelegramFormat.aiTakeover(reason));
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        // only sessions that already have a topic get the notice
        String thread = knownThread(session.getId());
        if (thread == null) {
            return done(null);
        }
        return sendMessage(thread, TelegramFormat.escapeHtml(message), null).thenApply(id -> null);
    }

    @Override
    public void close() {
        http.close();
    }

    /** Delete a message from the chat (used for /delete command cleanup too). */
    public CompletableFuture<Void> deleteMessage(long messageId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("message_id", messageId);
        return callApi("deleteMessage", body).thenApply(result -> null);
    }

    /**
     * Resolve a file id into a downloadable URL through getFile.
     */
    public CompletableFuture<String> resolveFileUrl(String fileId) {
        return callApi("getFile", Map.of("file_id", fileId))
                .thenApply(result -> {
                    String path = result.path("file_path").asText(null);
                    return path == null ? null : apiBase + "/file/bot" + botToken + "/" + path;
                });
    }

    private CompletableFuture<Void> postToSession(Session session, String text) {
        return ensureThread(session)
                .thenCompose(thread -> sendMessage(thread, text, null))
                .thenApply(id -> null);
    }

    private CompletableFuture<Long> sendMessage(String threadId, String text, Long replyTo) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "HTML");
        if (threadId != null) {
            body.put("message_thread_id", Long.parseLong(threadId));
        }
        if (replyTo != null) {
            body.put("reply_to_message_id", replyTo);
        }
        return callApi("sendMessage", body)
                .thenApply(result -> result.path("message_id").asLong());
    }

    private CompletableFuture<JsonNode> callApi(String method, Map<String, Object> body) {
        String url = apiBase + "/bot" + botToken + "/" + method;
        return http.post(url, null, body).thenApply(response -> {
            if (!response.path("ok").asBoolean(false)) {
                throw new BridgeApiException(NAME, 0,
                        response.path("description").asText("unknown error") + " (" + method + ")");
            }
            return response.path("result");
        });
    }
}
