package com.pocketping.channel.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.inbound.OperatorEvents;
import com.pocketping.common.model.Attachment;
import com.pocketping.common.model.BridgeMessageIds;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Turns Slack Events API callbacks into operator events. Only messages posted
 * inside a session thread are considered.
 */
@Slf4j
public class SlackEventsHandler {

    /** Message subtypes that still carry a human-written message. */
    private static final Set<String> PLAIN_SUBTYPES = Set.of("", "file_share", "thread_broadcast");

    private final OperatorEventSink sink;
    private final Function<String, String> sessionResolver;
    private final Function<String, CompletableFuture<String>> userNameResolver;
    private final Set<String> allowedBotIds;

    public SlackEventsHandler(SlackBridgeAdapter adapter, OperatorEventSink sink, Collection<String> allowedBotIds) {
        this(sink, adapter::resolveSessionId, adapter::lookupUserName, allowedBotIds);
    }

    SlackEventsHandler(OperatorEventSink sink, Function<String, String> sessionResolver,
            Function<String, CompletableFuture<String>> userNameResolver, Collection<String> allowedBotIds) {
        this.sink = sink;
        this.sessionResolver = sessionResolver;
        this.userNameResolver = userNameResolver;
        this.allowedBotIds = allowedBotIds != null ? Set.copyOf(allowedBotIds) : Set.of();
    }

    // --- Callback variants ---

    sealed interface Callback {
    }

    record UrlVerification(String challenge) implements Callback {
    }

    record ThreadMessage(JsonNode event) implements Callback {
    }

    record MessageChanged(JsonNode event) implements Callback {
    }

    record MessageDeleted(JsonNode event) implements Callback {
    }

    record Ignored(String why) implements Callback {
    }

    static Callback decode(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new Ignored("not an object");
        }
        String type = body.path("type").asText("");
        if ("url_verification".equals(type)) {
            return new UrlVerification(body.path("challenge").asText(""));
        }
        if (!"event_callback".equals(type)) {
            return new Ignored("type " + type);
        }
        JsonNode event = body.path("event");
        if (!"message".equals(event.path("type").asText())) {
            return new Ignored("event " + event.path("type").asText());
        }
        String subtype = event.path("subtype").asText("");
        if ("message_changed".equals(subtype)) {
            return new MessageChanged(event);
        }
        if ("message_deleted".equals(subtype)) {
            return new MessageDeleted(event);
        }
        if (!PLAIN_SUBTYPES.contains(subtype) && !"bot_message".equals(subtype)) {
            return new Ignored("subtype " + subtype);
        }
        String threadTs = event.path("thread_ts").asText("");
        if (threadTs.isEmpty() || threadTs.equals(event.path("ts").asText())) {
            return new Ignored("not a thread reply");
        }
        return new ThreadMessage(event);
    }

    public Map<String, Object> handle(JsonNode body) {
        Callback callback = decode(body);
        if (callback instanceof UrlVerification v) {
            return Map.of("challenge", v.challenge());
        }
        if (callback instanceof ThreadMessage m) {
            onMessage(m.event());
        } else if (callback instanceof MessageChanged c) {
            onChanged(c.event());
        } else if (callback instanceof MessageDeleted d) {
            onDeleted(d.event());
        } else if (callback instanceof Ignored i) {
            log.debug("[slack] ignoring callback: {}", i.why());
        }
        return Map.of("ok", true);
    }

    private void onMessage(JsonNode event) {
        String botId = event.path("bot_id").asText("");
        if (!botId.isEmpty() || "bot_message".equals(event.path("subtype").asText())) {
            if (!allowedBotIds.contains(botId)) {
                log.debug("[slack] skipping bot message from {}", botId);
                return;
            }
        }

        OperatorEvents.OperatorMessage.OperatorMessageBuilder message = OperatorEvents.OperatorMessage.builder()
                .sourceBridge(SlackBridgeAdapter.NAME)
                .sessionId(sessionResolver.apply(event.path("thread_ts").asText()))
                .bridgeMessageId(event.path("ts").asText())
                .content(event.path("text").asText(""))
                .attachments(attachments(event.path("files")));

        String userId = event.path("user").asText("");
        CompletableFuture<String> name;
        try {
            name = userNameResolver.apply(userId);
        } catch (RuntimeException e) {
            name = CompletableFuture.failedFuture(e);
        }
        name.whenComplete((operatorName, error) -> {
            if (error != null) {
                log.warn("[slack] users.info failed for {}: {}", userId, error.getMessage());
            }
            boolean named = error == null && operatorName != null && !operatorName.isBlank();
            sink.onOperatorMessage(message.operatorName(named ? operatorName : "Operator").build());
        });
    }

    private void onChanged(JsonNode event) {
        JsonNode changed = event.path("message");
        String threadTs = changed.path("thread_ts").asText("");
        double editedTs = changed.path("edited").path("ts").asDouble(0);
        sink.onOperatorMessageEdited(OperatorEvents.OperatorEdit.builder()
                .sourceBridge(SlackBridgeAdapter.NAME)
                .sessionId(threadTs.isEmpty() ? null : sessionResolver.apply(threadTs))
                .bridgeMessageId(changed.path("ts").asText())
                .content(changed.path("text").asText(""))
                .editedAt(editedTs > 0 ? Instant.ofEpochMilli((long) (editedTs * 1000)) : Instant.now())
                .build());
    }

    private void onDeleted(JsonNode event) {
        String threadTs = event.path("previous_message").path("thread_ts").asText("");
        sink.onOperatorMessageDeleted(OperatorEvents.OperatorDelete.builder()
                .sourceBridge(SlackBridgeAdapter.NAME)
                .sessionId(threadTs.isEmpty() ? null : sessionResolver.apply(threadTs))
                .bridgeMessageId(event.path("deleted_ts").asText())
                .deletedAt(Instant.now())
                .build());
    }

    private static List<Attachment> attachments(JsonNode files) {
        List<Attachment> attachments = new ArrayList<>();
        for (JsonNode file : files) {
            attachments.add(Attachment.builder()
                    .id(file.path("id").asText())
                    .filename(file.path("name").asText("file"))
                    .mimeType(file.path("mimetype").asText("application/octet-stream"))
                    .size(file.path("size").asLong(0))
                    .url(file.path("url_private").asText(null))
                    .thumbnailUrl(file.path("thumb_360").asText(null))
                    .status("ready")
                    .uploadedFrom(BridgeMessageIds.SLACK)
                    .bridgeFileId(file.path("id").asText())
                    .build());
        }
        return attachments;
    }
}
