package com.pocketping.channel.adapter;

import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter whose thread creation is controlled by the test.
 */
public class StubBridgeAdapter extends AbstractBridgeAdapter {

    private final String name;
    public final AtomicInteger threadRequests = new AtomicInteger();
    public final List<CompletableFuture<String>> pendingThreads = new CopyOnWriteArrayList<>();
    public final List<String> operatorMessages = new CopyOnWriteArrayList<>();
    public volatile boolean closed;

    public StubBridgeAdapter(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    protected CompletableFuture<String> createThread(Session session) {
        threadRequests.incrementAndGet();
        CompletableFuture<String> future = new CompletableFuture<>();
        pendingThreads.add(future);
        return future;
    }

    @Override
    protected boolean supportsThreads() {
        return true;
    }

    @Override
    protected CompletableFuture<Void> sendOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        operatorMessages.add(operatorName + ": " + message.getContent());
        return done(null);
    }

    @Override
    public CompletableFuture<Void> onNewSession(Session session) {
        return ensureThread(session).thenApply(thread -> null);
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session, ReplyContext reply) {
        return done(new BridgeMessageIds());
    }

    @Override
    public CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId,
            String content, BridgeMessageIds bridgeIds) {
        return done(new BridgeMessageIds());
    }

    @Override
    public CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId,
            BridgeMessageIds bridgeIds) {
        return done(null);
    }

    @Override
    public CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session) {
        return done(null);
    }

    @Override
    public CompletableFuture<Void> onIdentityUpdate(Session session) {
        return done(null);
    }

    @Override
    public CompletableFuture<Void> onAiTakeover(Session session, String reason) {
        return done(null);
    }

    @Override
    public CompletableFuture<Void> onVisitorDisconnect(Session session, String message) {
        return done(null);
    }

    @Override
    public void close() {
        closed = true;
    }

    public CompletableFuture<String> thread(Session session) {
        return ensureThread(session);
    }

    public String known(String sessionId) {
        return knownThread(sessionId);
    }
}
