package com.pocketping.app;

import com.pocketping.channel.adapter.BridgeAdapter;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter double counting calls per operation.
 */
class CountingAdapter implements BridgeAdapter {

    private final String name;
    private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

    CountingAdapter(String name) {
        this.name = name;
    }

    int count(String operation) {
        AtomicInteger count = counts.get(operation);
        return count != null ? count.get() : 0;
    }

    private <T> CompletableFuture<T> hit(String operation, T value) {
        counts.computeIfAbsent(operation, key -> new AtomicInteger()).incrementAndGet();
        return CompletableFuture.completedFuture(value);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        return hit("onNewSession", null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session,
            ReplyContext reply) {
        return hit("onVisitorMessage", BridgeMessageIds.telegram((message.getId().hashCode() & 0x7fffffff) + 1L));
    }

    @Override
    public CompletableFuture<Void> onOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        return hit("onOperatorMessage", null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        return hit("onVisitorMessageEdited", null);
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        return hit("onVisitorMessageDeleted", null);
    }

    @Override
    public CompletableFuture<Void> onMessageRead(String sessionId, List<String> messageIds, MessageStatus status) {
        return hit("onMessageRead", null);
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return hit("onCustomEvent", null);
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        return hit("onIdentityUpdate", null);
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return hit("onAiTakeover", null);
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        return hit("onVisitorDisconnect", null);
    }
}
