package com.pocketping.gateway.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.adapter.BridgeAdapter;
import com.pocketping.channel.registry.BridgeRegistry;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;
import com.pocketping.gateway.events.OutgoingEvent;
import com.pocketping.gateway.events.OutgoingEventType;
import com.pocketping.gateway.events.SseBroadcaster;
import com.pocketping.gateway.registry.IdentityRegistry;
import com.pocketping.gateway.webhook.OutboundWebhookClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Dispatches inbound events to every enabled adapter, keeps the identity
 * registry current and publishes the resulting state changes.
 * <p>
 * Adapters are called concurrently and awaited together; a failing adapter
 * is logged and skipped, and dispatch itself never fails once an event has
 * been decoded.
 */
@Slf4j
public class EventRouter {

    public static final Duration DEFAULT_ADAPTER_TIMEOUT = Duration.ofSeconds(30);

    private final BridgeRegistry bridges;
    private final IdentityRegistry identities;
    private final SseBroadcaster broadcaster;
    private final OutboundWebhookClient webhooks;
    private final EventDecoder decoder;
    private final Duration adapterTimeout;

    public EventRouter(BridgeRegistry bridges, IdentityRegistry identities, SseBroadcaster broadcaster,
            OutboundWebhookClient webhooks) {
        this(bridges, identities, broadcaster, webhooks, new EventDecoder(), DEFAULT_ADAPTER_TIMEOUT);
    }

    public EventRouter(BridgeRegistry bridges, IdentityRegistry identities, SseBroadcaster broadcaster,
            OutboundWebhookClient webhooks, EventDecoder decoder, Duration adapterTimeout) {
        this.bridges = bridges;
        this.identities = identities;
        this.broadcaster = broadcaster;
        this.webhooks = webhooks;
        this.decoder = decoder;
        this.adapterTimeout = adapterTimeout;
    }

    public EventDecoder getDecoder() {
        return decoder;
    }

    /**
     * Decode and dispatch a {@code {type, ...}} envelope.
     *
     * @throws InvalidEventException when the envelope cannot be decoded
     */
    public void dispatch(JsonNode envelope) {
        dispatch(decoder.decode(envelope));
    }

    public void dispatch(InboundEvent event) {
        log.debug("Dispatching {}", event.type().getWireName());
        try {
            if (event instanceof InboundEvent.NewSession e) {
                onNewSession(e);
            } else if (event instanceof InboundEvent.VisitorMessage e) {
                onVisitorMessage(e);
            } else if (event instanceof InboundEvent.AiTakeover e) {
                onAiTakeover(e);
            } else if (event instanceof InboundEvent.OperatorStatus e) {
                broadcaster.publish(OutgoingEvent.of(OutgoingEventType.OPERATOR_STATUS).with("online", e.online()));
            } else if (event instanceof InboundEvent.MessageRead e) {
                onMessageRead(e);
            } else if (event instanceof InboundEvent.CustomEventReceived e) {
                onCustomEvent(e);
            } else if (event instanceof InboundEvent.IdentityUpdate e) {
                onIdentityUpdate(e);
            } else if (event instanceof InboundEvent.VisitorMessageEdited e) {
                onVisitorMessageEdited(e);
            } else if (event instanceof InboundEvent.VisitorMessageDeleted e) {
                onVisitorMessageDeleted(e);
            } else if (event instanceof InboundEvent.VisitorDisconnect e) {
                onVisitorDisconnect(e);
            }
        } catch (RuntimeException e) {
            log.error("Failed to process {}: {}", event.type().getWireName(), e.getMessage(), e);
        }
    }

    // =========================================================================
    // Handlers
    // =========================================================================

    private void onNewSession(InboundEvent.NewSession event) {
        Session session = identities.rememberSession(event.session());
        fanOut("onNewSession", adapter -> adapter.onNewSession(session), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.NEW_SESSION).with("session", session));
    }

    private void onVisitorMessage(InboundEvent.VisitorMessage event) {
        Message message = event.message();
        Session session = identities.rememberSession(event.session());
        identities.cacheMessage(message);

        BridgeAdapter.ReplyContext reply = replyContext(message.getReplyTo());
        fanOut("onVisitorMessage", adapter -> adapter.onVisitorMessage(message, session, reply),
                (adapter, ids) -> {
                    if (ids != null && !ids.isEmpty()) {
                        identities.merge(message.getId(), ids);
                    }
                });

        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.VISITOR_MESSAGE)
                .with("sessionId", session.getId())
                .with("message", message));
    }

    /**
     * Quote and platform ids of the replied-to message, or null when neither
     * is known.
     */
    BridgeAdapter.ReplyContext replyContext(String replyTo) {
        if (replyTo == null || replyTo.isBlank()) {
            return null;
        }
        BridgeMessageIds ids = identities.get(replyTo).orElse(null);
        String quote = ReplyQuotes.buildReplyQuote(identities.getMessage(replyTo).orElse(null));
        if (ids == null && quote.isEmpty()) {
            return null;
        }
        return BridgeAdapter.ReplyContext.builder()
                .bridgeIds(ids)
                .quote(quote.isEmpty() ? null : quote)
                .build();
    }

    private void onAiTakeover(InboundEvent.AiTakeover event) {
        Session session = identities.rememberSession(event.session());
        fanOut("onAiTakeover", adapter -> adapter.onAiTakeover(session, event.reason()), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.AI_TAKEOVER)
                .with("sessionId", session.getId())
                .with("reason", event.reason()));
    }

    private void onMessageRead(InboundEvent.MessageRead event) {
        Instant now = Instant.now();
        for (String messageId : event.messageIds()) {
            identities.updateMessage(messageId, message -> {
                message.setStatus(event.status());
                if (event.status() == MessageStatus.DELIVERED) {
                    message.setDeliveredAt(now);
                } else if (event.status() == MessageStatus.READ) {
                    message.setReadAt(now);
                }
            });
        }
        fanOut("onMessageRead", adapter -> adapter.onMessageRead(event.sessionId(), event.messageIds(),
                event.status()), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.MESSAGE_READ)
                .with("sessionId", event.sessionId())
                .with("messageIds", event.messageIds())
                .with("status", event.status()));
    }

    private void onCustomEvent(InboundEvent.CustomEventReceived event) {
        Session session = identities.rememberSession(event.session());
        fanOut("onCustomEvent", adapter -> adapter.onCustomEvent(event.event(), session), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.CUSTOM_EVENT)
                .with("sessionId", session.getId())
                .with("event", event.event()));
        // delivery runs on the HTTP client's threads
        webhooks.sendCustomEvent(event.event(), session);
    }

    private void onIdentityUpdate(InboundEvent.IdentityUpdate event) {
        Session session = identities.rememberSession(event.session());
        fanOut("onIdentityUpdate", adapter -> adapter.onIdentityUpdate(session), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.IDENTITY_UPDATE)
                .with("sessionId", session.getId())
                .with("identity", session.getIdentity()));
    }

    private void onVisitorMessageEdited(InboundEvent.VisitorMessageEdited event) {
        String messageId = event.messageId();
        BridgeMessageIds ids = identities.get(messageId).orElse(null);
        String sessionId = resolveSessionId(event.sessionId(), messageId);
        identities.updateMessage(messageId, message -> {
            message.setContent(event.content());
            message.setEditedAt(event.editedAt());
        });

        fanOut("onVisitorMessageEdited",
                adapter -> adapter.onVisitorMessageEdited(sessionId, messageId, event.content(), ids),
                (adapter, updated) -> {
                    if (updated != null && !updated.isEmpty()) {
                        identities.merge(messageId, updated);
                    }
                });

        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.MESSAGE_EDITED)
                .with("sessionId", sessionId)
                .with("messageId", messageId)
                .with("content", event.content())
                .with("editedAt", event.editedAt()));
    }

    private void onVisitorMessageDeleted(InboundEvent.VisitorMessageDeleted event) {
        String messageId = event.messageId();
        BridgeMessageIds ids = identities.get(messageId).orElse(null);
        String sessionId = resolveSessionId(event.sessionId(), messageId);
        identities.updateMessage(messageId, message -> message.setDeletedAt(event.deletedAt()));

        fanOut("onVisitorMessageDeleted",
                adapter -> adapter.onVisitorMessageDeleted(sessionId, messageId, ids), null);

        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.MESSAGE_DELETED)
                .with("sessionId", sessionId)
                .with("messageId", messageId)
                .with("deletedAt", event.deletedAt()));
    }

    private void onVisitorDisconnect(InboundEvent.VisitorDisconnect event) {
        Session session = identities.rememberSession(event.session());
        String text = DisconnectText.format(session, event.durationSeconds());
        fanOut("onVisitorDisconnect", adapter -> adapter.onVisitorDisconnect(session, text), null);
        broadcaster.publish(OutgoingEvent.of(OutgoingEventType.DISCONNECT)
                .with("sessionId", session.getId())
                .with("duration", event.durationSeconds())
                .with("reason", event.reason()));
    }

    private String resolveSessionId(String sessionId, String messageId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId;
        }
        return identities.getMessage(messageId).map(Message::getSessionId).orElse(null);
    }

    // =========================================================================
    // Fan-out
    // =========================================================================

    /**
     * Call every adapter concurrently and wait for all of them. Failures,
     * including synchronous throws, are logged per adapter; successes are
     * handed to {@code onResult} when given.
     */
    <T> void fanOut(String operation, Function<BridgeAdapter, CompletableFuture<T>> call,
            BiConsumer<BridgeAdapter, T> onResult) {
        List<BridgeAdapter> adapters = bridges.listAll();
        if (adapters.isEmpty()) {
            return;
        }
        List<CompletableFuture<?>> pending = new ArrayList<>(adapters.size());
        for (BridgeAdapter adapter : adapters) {
            CompletableFuture<T> future;
            try {
                future = call.apply(adapter);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            if (future == null) {
                continue;
            }
            pending.add(future.handle((result, error) -> {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    log.warn("[{}] {} failed: {}", adapter.getName(), operation, cause.getMessage());
                } else if (onResult != null) {
                    onResult.accept(adapter, result);
                }
                return null;
            }));
        }

        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(adapterTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} still running after {}ms on some adapters; not waiting further", operation,
                    adapterTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for adapters", operation);
        } catch (ExecutionException e) {
            log.error("{} fan-out failed: {}", operation, e.getCause().getMessage(), e.getCause());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
