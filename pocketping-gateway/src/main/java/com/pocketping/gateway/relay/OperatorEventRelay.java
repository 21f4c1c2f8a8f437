package com.pocketping.gateway.relay;

import com.pocketping.channel.adapter.BridgeAdapter;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.inbound.OperatorEvents;
import com.pocketping.channel.registry.BridgeRegistry;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.SenderType;
import com.pocketping.common.model.Session;
import com.pocketping.gateway.events.OutgoingEvent;
import com.pocketping.gateway.events.OutgoingEventType;
import com.pocketping.gateway.events.SseBroadcaster;
import com.pocketping.gateway.registry.CompositeIds;
import com.pocketping.gateway.registry.IdentityRegistry;
import com.pocketping.gateway.webhook.OutboundWebhookClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Records operator actions coming from platform webhooks and the Discord
 * gateway, publishes them, forwards them to the backend and mirrors new
 * operator messages to the other platforms.
 * <p>
 * Operator messages get the internal id {@code source:platformId}. Edits and
 * deletes first try the reverse platform index, so an action on a mirrored
 * visitor message resolves to that message's own id.
 */
@Slf4j
public class OperatorEventRelay implements OperatorEventSink {

    private final BridgeRegistry bridges;
    private final IdentityRegistry identities;
    private final SseBroadcaster broadcaster;
    private final OutboundWebhookClient webhooks;

    public OperatorEventRelay(BridgeRegistry bridges, IdentityRegistry identities, SseBroadcaster broadcaster,
            OutboundWebhookClient webhooks) {
        this.bridges = bridges;
        this.identities = identities;
        this.broadcaster = broadcaster;
        this.webhooks = webhooks;
    }

    @Override
    public void onOperatorMessage(OperatorEvents.OperatorMessage event) {
        String source = event.getSourceBridge();
        String messageId = CompositeIds.build(source, event.getBridgeMessageId());
        String replyTo = resolveMessageId(source, event.getReplyToBridgeMessageId());

        Message message = Message.builder()
                .id(messageId)
                .sessionId(event.getSessionId())
                .content(event.getContent() != null ? event.getContent() : "")
                .sender(SenderType.OPERATOR)
                .timestamp(Instant.now())
                .replyTo(replyTo)
                .attachments(event.getAttachments() != null && !event.getAttachments().isEmpty()
                        ? event.getAttachments() : null)
                .status(MessageStatus.SENT)
                .build();
        identities.cacheMessage(message);
        identities.merge(messageId, BridgeMessageIds.forPlatform(source, event.getBridgeMessageId()));
        log.info("[{}] operator message {} for session {}", source, messageId, event.getSessionId());

        publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_MESSAGE)
                .with("sessionId", event.getSessionId())
                .with("messageId", messageId)
                .with("content", message.getContent())
                .with("sourceBridge", source)
                .with("operatorName", event.getOperatorName())
                .with("attachments", message.getAttachments())
                .with("replyTo", replyTo));

        crossSync(message, source, event.getOperatorName());
    }

    @Override
    public void onOperatorMessageEdited(OperatorEvents.OperatorEdit event) {
        String messageId = resolveMessageId(event.getSourceBridge(), event.getBridgeMessageId());
        Instant editedAt = event.getEditedAt() != null ? event.getEditedAt() : Instant.now();
        Message updated = identities.updateMessage(messageId, message -> {
            message.setContent(event.getContent());
            message.setEditedAt(editedAt);
        }).orElse(null);

        publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_MESSAGE_EDITED)
                .with("sessionId", sessionOf(event.getSessionId(), updated))
                .with("messageId", messageId)
                .with("content", event.getContent())
                .with("editedAt", editedAt)
                .with("sourceBridge", event.getSourceBridge()));
    }

    @Override
    public void onOperatorMessageDeleted(OperatorEvents.OperatorDelete event) {
        String messageId = resolveMessageId(event.getSourceBridge(), event.getBridgeMessageId());
        Instant deletedAt = event.getDeletedAt() != null ? event.getDeletedAt() : Instant.now();
        Message updated = identities.updateMessage(messageId, message -> message.setDeletedAt(deletedAt))
                .orElse(null);

        publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_MESSAGE_DELETED)
                .with("sessionId", sessionOf(event.getSessionId(), updated))
                .with("messageId", messageId)
                .with("deletedAt", deletedAt)
                .with("sourceBridge", event.getSourceBridge()));
    }

    /**
     * Internal id of a platform message: the message it was merged into when
     * known, else its composite id.
     */
    String resolveMessageId(String source, String platformId) {
        if (platformId == null || platformId.isBlank()) {
            return null;
        }
        return identities.findByPlatformId(source, platformId)
                .orElse(CompositeIds.build(source, platformId));
    }

    private void publish(OutgoingEvent event) {
        broadcaster.publish(event);
        webhooks.forwardToBackend(event);
    }

    /**
     * Mirror to every adapter without waiting; the source adapter drops its
     * own echo.
     */
    private void crossSync(Message message, String source, String operatorName) {
        Session session = identities.getSession(message.getSessionId())
                .orElseGet(() -> Session.ofId(message.getSessionId()));
        List<BridgeAdapter> adapters = bridges.listAll();
        for (BridgeAdapter adapter : adapters) {
            CompletableFuture<Void> future;
            try {
                future = adapter.onOperatorMessage(message, session, source, operatorName);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            future.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("[{}] cross-sync of {} failed: {}", adapter.getName(), message.getId(),
                            error.getMessage());
                }
            });
        }
    }

    private static String sessionOf(String sessionId, Message cached) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId;
        }
        return cached != null ? cached.getSessionId() : null;
    }
}
