package com.pocketping.gateway.router;

import com.pocketping.channel.adapter.BridgeAdapter;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Adapter double that records every call as {@code "operation:detail"} and
 * answers visitor messages and edits with preset platform ids.
 */
public class RecordingAdapter implements BridgeAdapter {

    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final List<ReplyContext> replies = new CopyOnWriteArrayList<>();
    public final List<BridgeMessageIds> editIds = new CopyOnWriteArrayList<>();
    public final List<BridgeMessageIds> deleteIds = new CopyOnWriteArrayList<>();
    public final List<String> disconnectTexts = new CopyOnWriteArrayList<>();

    private final String name;
    public volatile BridgeMessageIds sendResult = new BridgeMessageIds();
    public volatile BridgeMessageIds editResult = new BridgeMessageIds();
    /** When set, every call completes exceptionally with it. */
    public volatile RuntimeException failure;
    /** When set, every call throws it synchronously. */
    public volatile RuntimeException thrown;
    public volatile boolean closed;

    public RecordingAdapter(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    private <T> CompletableFuture<T> record(String call, T value) {
        if (thrown != null) {
            throw thrown;
        }
        calls.add(call);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(value);
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        return record("onNewSession:" + session.getId(), null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session,
            ReplyContext reply) {
        replies.add(reply != null ? reply : new ReplyContext());
        return record("onVisitorMessage:" + message.getId(), sendResult);
    }

    @Override
    public CompletableFuture<Void> onOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        return record("onOperatorMessage:" + message.getId() + "<" + sourceBridge, null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        editIds.add(bridgeIds != null ? bridgeIds : new BridgeMessageIds());
        return record("onVisitorMessageEdited:" + messageId + "=" + content, editResult);
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        deleteIds.add(bridgeIds != null ? bridgeIds : new BridgeMessageIds());
        return record("onVisitorMessageDeleted:" + messageId, null);
    }

    @Override
    public CompletableFuture<Void> onMessageRead(String sessionId, List<String> messageIds, MessageStatus status) {
        return record("onMessageRead:" + messageIds + "=" + status, null);
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return record("onCustomEvent:" + event.getName(), null);
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        return record("onIdentityUpdate:" + session.getId(), null);
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return record("onAiTakeover:" + reason, null);
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        disconnectTexts.add(message);
        return record("onVisitorDisconnect:" + session.getId(), null);
    }

    @Override
    public void close() {
        closed = true;
    }

    public long count(String operation) {
        return calls.stream().filter(c -> c.startsWith(operation + ":")).count();
    }
}
