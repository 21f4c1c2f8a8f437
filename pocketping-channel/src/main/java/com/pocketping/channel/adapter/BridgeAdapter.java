package com.pocketping.channel.adapter;

import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform contract every chat platform implements.
 * <p>
 * Every call is independently fallible: a failed platform request completes
 * the returned future exceptionally and never affects other adapters.
 * Implementations must not share mutable state with each other.
 */
public interface BridgeAdapter {

    /** Platform name ("telegram", "discord", "slack"). */
    String getName();

    /** Create the platform-side thread/topic for a session and announce it. */
    CompletableFuture<Void> onNewSession(Session session);

    /**
     * Post a visitor message.
     *
     * @return the platform ids created, or an empty record when the platform
     *         returns none (webhook modes)
     */
    CompletableFuture<BridgeMessageIds> onVisitorMessage(Message message, Session session, ReplyContext reply);

    /** Mirror an operator message written on another platform. No-op for its own platform. */
    CompletableFuture<Void> onOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName);

    CompletableFuture<BridgeMessageIds> onVisitorMessageEdited(String sessionId, String messageId, String content,
            BridgeMessageIds bridgeIds);

    CompletableFuture<Void> onVisitorMessageDeleted(String sessionId, String messageId, BridgeMessageIds bridgeIds);

    CompletableFuture<Void> onMessageRead(String sessionId, List<String> messageIds, MessageStatus status);

    CompletableFuture<Void> onCustomEvent(CustomEvent event, Session session);

    CompletableFuture<Void> onIdentityUpdate(Session session);

    CompletableFuture<Void> onAiTakeover(Session session, String reason);

    CompletableFuture<Void> onVisitorDisconnect(Session session, String message);

    /**
     * Map a platform thread/topic id back to the session it belongs to.
     * Unknown threads resolve to themselves.
     */
    default String resolveSessionId(String threadId) {
        return threadId;
    }

    /** Release HTTP resources. */
    default void close() {
    }

    // --- Supporting types ---

    /**
     * Quoted preview of the message a visitor replies to.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ReplyContext {
        /** Platform ids of the quoted message, for native replies. */
        private BridgeMessageIds bridgeIds;
        /** Rendered preview, for platforms that cannot reply natively. */
        private String quote;
    }
}
