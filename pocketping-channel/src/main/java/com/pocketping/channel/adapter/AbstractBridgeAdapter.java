package com.pocketping.channel.adapter;

import com.pocketping.common.model.Attachment;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared plumbing for platform adapters: per-session thread cache with
 * create-once semantics, reverse thread lookup, and echo suppression for
 * operator messages.
 */
@Slf4j
public abstract class AbstractBridgeAdapter implements BridgeAdapter {

    private final Map<String, CompletableFuture<String>> threadsBySession = new ConcurrentHashMap<>();
    private final Map<String, String> sessionsByThread = new ConcurrentHashMap<>();

    /**
     * Create the platform thread/topic for a session.
     *
     * @return the platform thread id
     */
    protected abstract CompletableFuture<String> createThread(Session session);

    /** Whether this adapter posts into per-session threads at all. */
    protected abstract boolean supportsThreads();

    /** Post an operator message that originated on another platform. */
    protected abstract CompletableFuture<Void> sendOperatorMessage(Message message, Session session,
            String sourceBridge, String operatorName);

    @Override
    public final CompletableFuture<Void> onOperatorMessage(Message message, Session session, String sourceBridge,
            String operatorName) {
        if (getName().equals(sourceBridge)) {
            log.debug("[{}] skipping echo of its own operator message {}", getName(), message.getId());
            return CompletableFuture.completedFuture(null);
        }
        return sendOperatorMessage(message, session, sourceBridge, operatorName);
    }

    @Override
    public CompletableFuture<Void> onMessageRead(String sessionId, List<String> messageIds, MessageStatus status) {
        // platforms have no read-receipt surface
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String resolveSessionId(String threadId) {
        if (threadId == null) {
            return null;
        }
        return sessionsByThread.getOrDefault(threadId, threadId);
    }

    /**
     * Return the thread of a session, creating it on first use. Concurrent
     * callers for the same session share one creation request; a failed
     * creation is forgotten so the next call retries.
     *
     * @return future of the thread id, or of {@code null} for thread-less modes
     */
    protected CompletableFuture<String> ensureThread(Session session) {
        if (!supportsThreads()) {
            return CompletableFuture.completedFuture(null);
        }
        String sessionId = session.getId();
        CompletableFuture<String> existing = threadsBySession.get(sessionId);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<String> pending = new CompletableFuture<>();
        existing = threadsBySession.putIfAbsent(sessionId, pending);
        if (existing != null) {
            return existing;
        }

        CompletableFuture<String> created;
        try {
            created = createThread(session);
        } catch (RuntimeException e) {
            created = CompletableFuture.failedFuture(e);
        }
        created.whenComplete((threadId, error) -> {
            if (error != null || threadId == null) {
                threadsBySession.remove(sessionId, pending);
                pending.completeExceptionally(error != null ? error
                        : new BridgeApiException(getName(), 0, "no thread id returned"));
                return;
            }
            sessionsByThread.put(threadId, sessionId);
            pending.complete(threadId);
            log.info("[{}] thread {} created for session {}", getName(), threadId, sessionId);
        });
        return pending;
    }

    /** True once a thread has been created (or is being created) for the session. */
    protected boolean hasThread(String sessionId) {
        return threadsBySession.containsKey(sessionId);
    }

    /** Seed a known session thread without calling the platform (for testing). */
    public void registerThread(String sessionId, String threadId) {
        threadsBySession.put(sessionId, CompletableFuture.completedFuture(threadId));
        sessionsByThread.put(threadId, sessionId);
    }

    /** Thread id of a session if already known, without creating one. */
    protected String knownThread(String sessionId) {
        CompletableFuture<String> future = threadsBySession.get(sessionId);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return null;
        }
        return future.join();
    }

    /**
     * Append one "📎 name: url" line per attachment ("🖼️" for images).
     */
    protected static String withAttachmentLinks(String content, List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return content != null ? content : "";
        }
        StringBuilder links = new StringBuilder();
        for (Attachment attachment : attachments) {
            if (attachment.getUrl() == null || attachment.getUrl().isBlank()) {
                continue;
            }
            links.append(links.length() == 0 ? "" : "\n")
                    .append(attachment.isImage() ? "🖼️ " : "📎 ")
                    .append(attachment.getFilename() != null ? attachment.getFilename() : "file")
                    .append(": ")
                    .append(attachment.getUrl());
        }
        StringBuilder sb = new StringBuilder(content != null ? content : "");
        if (links.length() > 0) {
            sb.append(sb.length() == 0 ? "" : "\n\n").append(links);
        }
        return sb.toString();
    }

    protected static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    /** Name shown for the visitor: identity name, else visitor id. */
    protected static String visitorName(Session session) {
        if (session == null) {
            return "Visitor";
        }
        if (session.getIdentity() != null && session.getIdentity().getName() != null
                && !session.getIdentity().getName().isBlank()) {
            return session.getIdentity().getName();
        }
        return orDefault(session.getVisitorId(), "Visitor");
    }

    protected static <T> CompletableFuture<T> done(T value) {
        return CompletableFuture.completedFuture(value);
    }
}
