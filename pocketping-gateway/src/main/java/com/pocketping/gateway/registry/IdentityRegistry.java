package com.pocketping.gateway.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pocketping.common.config.BridgeConfig;
import com.pocketping.common.model.BridgeMessageIds;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Cross-platform identity store: platform ids per internal message, the
 * message cache used for reply previews and edit/delete bookkeeping, the
 * session snapshots adapters need, and a reverse index from
 * {@code platform:id} back to the internal message id.
 * <p>
 * Entries expire after a period without access and the caches are size
 * bounded, so a platform id reused long after its message was evicted
 * cannot resolve to a stale message. Every mutation goes through
 * {@code asMap().compute*}, making merges and updates atomic per key.
 */
@Slf4j
public class IdentityRegistry {

    private final Cache<String, BridgeMessageIds> bridgeIds;
    private final Cache<String, Message> messages;
    private final Cache<String, Session> sessions;
    private final Cache<String, String> platformIndex;

    public IdentityRegistry(BridgeConfig.RegistryConfig config) {
        this(Duration.ofHours(config != null ? config.getTtlHours() : 168),
                config != null ? config.getMaxEntries() : 100_000);
    }

    public IdentityRegistry(Duration ttl, long maxEntries) {
        this.bridgeIds = newCache(ttl, maxEntries);
        this.messages = newCache(ttl, maxEntries);
        this.sessions = newCache(ttl, maxEntries);
        this.platformIndex = newCache(ttl, maxEntries * 3);
        log.debug("Identity registry: ttl={}, maxEntries={}", ttl, maxEntries);
    }

    private static <V> Cache<String, V> newCache(Duration ttl, long maxEntries) {
        return Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxEntries)
                .build();
    }

    // =========================================================================
    // Platform ids
    // =========================================================================

    /**
     * Merge platform ids into the record of a message. Non-empty incoming
     * fields win, empty ones never clear a stored value.
     *
     * @return the merged record
     */
    public BridgeMessageIds merge(String messageId, BridgeMessageIds partial) {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId is required");
        }
        BridgeMessageIds merged = bridgeIds.asMap().compute(messageId, (id, existing) ->
                (existing != null ? existing : new BridgeMessageIds()).merge(partial));
        index(messageId, partial);
        return merged.toBuilder().build();
    }

    public Optional<BridgeMessageIds> get(String messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bridgeIds.getIfPresent(messageId)).map(ids -> ids.toBuilder().build());
    }

    /** Internal message id of a platform message, if it was ever merged. */
    public Optional<String> findByPlatformId(String platform, String platformMessageId) {
        if (platform == null || platformMessageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(platformIndex.getIfPresent(platform + ":" + platformMessageId));
    }

    private void index(String messageId, BridgeMessageIds partial) {
        if (partial == null) {
            return;
        }
        for (String platform : List.of(BridgeMessageIds.TELEGRAM, BridgeMessageIds.DISCORD, BridgeMessageIds.SLACK)) {
            String platformId = partial.idFor(platform);
            if (platformId != null) {
                platformIndex.put(platform + ":" + platformId, messageId);
            }
        }
    }

    // =========================================================================
    // Messages
    // =========================================================================

    public void cacheMessage(Message message) {
        if (message == null || message.getId() == null) {
            return;
        }
        messages.put(message.getId(), message.copy());
    }

    public Optional<Message> getMessage(String messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.getIfPresent(messageId)).map(Message::copy);
    }

    /**
     * Apply a mutation to a cached message. Mutations of the same message are
     * serialized; an unknown id is a no-op.
     *
     * @return the updated message, if it was cached
     */
    public Optional<Message> updateMessage(String messageId, Consumer<Message> mutator) {
        if (messageId == null || mutator == null) {
            return Optional.empty();
        }
        Message updated = messages.asMap().computeIfPresent(messageId, (id, current) -> {
            Message copy = current.copy();
            mutator.accept(copy);
            return copy;
        });
        return Optional.ofNullable(updated).map(Message::copy);
    }

    // =========================================================================
    // Sessions
    // =========================================================================

    /**
     * Store a session snapshot, merged with the one already known.
     *
     * @return the merged snapshot
     */
    public Session rememberSession(Session session) {
        if (session == null || session.getId() == null) {
            return session;
        }
        return sessions.asMap().compute(session.getId(), (id, existing) ->
                existing != null ? existing.mergedWith(session) : session.toBuilder().build());
    }

    public Optional<Session> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public long messageCount() {
        return messages.estimatedSize();
    }
}
