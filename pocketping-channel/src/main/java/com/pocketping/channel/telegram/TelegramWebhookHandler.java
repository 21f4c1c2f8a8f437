package com.pocketping.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.inbound.OperatorEvents;
import com.pocketping.common.model.Attachment;
import com.pocketping.common.model.BridgeMessageIds;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.LongFunction;

/**
 * Turns Telegram webhook updates into operator events.
 * <p>
 * Handled shapes: a new message in a forum topic, an edited message, the
 * {@code /delete} command used as a reply, and a 🗑️ reaction. Anything else
 * is acknowledged and ignored.
 */
@Slf4j
public class TelegramWebhookHandler {

    static final String DELETE_COMMAND = "/delete";
    private static final List<String> TRASH_EMOJIS = List.of("🗑️", "🗑");

    private final OperatorEventSink sink;
    private final Function<String, String> sessionResolver;
    private final Function<String, CompletableFuture<String>> fileUrlResolver;
    private final LongFunction<CompletableFuture<Void>> messageDeleter;

    public TelegramWebhookHandler(TelegramBridgeAdapter adapter, OperatorEventSink sink) {
        this(sink, adapter::resolveSessionId, adapter::resolveFileUrl, adapter::deleteMessage);
    }

    TelegramWebhookHandler(OperatorEventSink sink, Function<String, String> sessionResolver,
            Function<String, CompletableFuture<String>> fileUrlResolver,
            LongFunction<CompletableFuture<Void>> messageDeleter) {
        this.sink = sink;
        this.sessionResolver = sessionResolver;
        this.fileUrlResolver = fileUrlResolver;
        this.messageDeleter = messageDeleter;
    }

    // --- Update variants ---

    sealed interface Update {
    }

    record NewMessage(JsonNode message) implements Update {
    }

    record EditedMessage(JsonNode message) implements Update {
    }

    record Reaction(JsonNode reaction) implements Update {
    }

    record Ignored(String why) implements Update {
    }

    static Update decode(JsonNode update) {
        if (update == null || !update.isObject()) {
            return new Ignored("not an object");
        }
        if (update.hasNonNull("message")) {
            return new NewMessage(update.get("message"));
        }
        if (update.hasNonNull("edited_message")) {
            return new EditedMessage(update.get("edited_message"));
        }
        if (update.hasNonNull("message_reaction")) {
            return new Reaction(update.get("message_reaction"));
        }
        return new Ignored("unsupported update");
    }

    /**
     * Handle one update. Always answers {@code {"ok": true}} so Telegram does
     * not redeliver.
     */
    public Map<String, Object> handle(JsonNode update) {
        Update decoded = decode(update);
        if (decoded instanceof NewMessage m) {
            onMessage(m.message());
        } else if (decoded instanceof EditedMessage e) {
            onEdited(e.message());
        } else if (decoded instanceof Reaction r) {
            onReaction(r.reaction());
        } else if (decoded instanceof Ignored i) {
            log.debug("[telegram] ignoring update: {}", i.why());
        }
        return Map.of("ok", true);
    }

    private void onMessage(JsonNode message) {
        String text = message.hasNonNull("text") ? message.get("text").asText()
                : message.path("caption").asText("");
        String replyTo = replyTarget(message);

        if (text.startsWith("/")) {
            if (isCommand(text, DELETE_COMMAND) && replyTo != null) {
                sink.onOperatorMessageDeleted(OperatorEvents.OperatorDelete.builder()
                        .sourceBridge(TelegramBridgeAdapter.NAME)
                        .sessionId(sessionOf(message))
                        .bridgeMessageId(replyTo)
                        .deletedAt(Instant.now())
                        .build());
                removeCommandMessage(message.path("message_id").asLong());
            } else {
                log.debug("[telegram] ignoring command {}", text.split("\\s+")[0]);
            }
            return;
        }

        String sessionId = sessionOf(message);
        if (sessionId == null) {
            log.debug("[telegram] message outside a forum topic ignored");
            return;
        }
        if (message.path("from").path("is_bot").asBoolean(false)) {
            return;
        }

        String operatorName = message.path("from").path("first_name").asText("");
        OperatorEvents.OperatorMessage.OperatorMessageBuilder event = OperatorEvents.OperatorMessage.builder()
                .sourceBridge(TelegramBridgeAdapter.NAME)
                .sessionId(sessionId)
                .bridgeMessageId(message.path("message_id").asText())
                .content(text)
                .operatorName(operatorName.isBlank() ? "Operator" : operatorName)
                .replyToBridgeMessageId(replyTo);

        List<FileRef> files = fileRefs(message);
        if (files.isEmpty()) {
            sink.onOperatorMessage(event.attachments(List.of()).build());
            return;
        }
        resolveAttachments(files).whenComplete((attachments, error) -> {
            if (error != null) {
                log.warn("[telegram] could not resolve attachments: {}", error.getMessage());
                sink.onOperatorMessage(event.attachments(List.of()).build());
            } else {
                sink.onOperatorMessage(event.attachments(attachments).build());
            }
        });
    }

    private void onEdited(JsonNode message) {
        String text = message.hasNonNull("text") ? message.get("text").asText()
                : message.path("caption").asText("");
        long editDate = message.path("edit_date").asLong(0);
        sink.onOperatorMessageEdited(OperatorEvents.OperatorEdit.builder()
                .sourceBridge(TelegramBridgeAdapter.NAME)
                .sessionId(sessionOf(message))
                .bridgeMessageId(message.path("message_id").asText())
                .content(text)
                .editedAt(editDate > 0 ? Instant.ofEpochSecond(editDate) : Instant.now())
                .build());
    }

    private void onReaction(JsonNode reaction) {
        if (!hasTrash(reaction.path("new_reaction")) || hasTrash(reaction.path("old_reaction"))) {
            return;
        }
        sink.onOperatorMessageDeleted(OperatorEvents.OperatorDelete.builder()
                .sourceBridge(TelegramBridgeAdapter.NAME)
                .bridgeMessageId(reaction.path("message_id").asText())
                .deletedAt(Instant.now())
                .build());
    }

    private void removeCommandMessage(long messageId) {
        if (messageId == 0) {
            return;
        }
        try {
            messageDeleter.apply(messageId).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.debug("[telegram] could not remove /delete command message: {}", error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.debug("[telegram] could not remove /delete command message: {}", e.getMessage());
        }
    }

    private String sessionOf(JsonNode message) {
        if (!message.hasNonNull("message_thread_id")) {
            return null;
        }
        return sessionResolver.apply(message.get("message_thread_id").asText());
    }

    /**
     * Id of the replied-to message. In forum topics every message implicitly
     * replies to the topic's service message, which does not count.
     */
    static String replyTarget(JsonNode message) {
        JsonNode reply = message.path("reply_to_message");
        if (reply.isMissingNode() || reply.isNull()) {
            return null;
        }
        if (reply.path("forum_topic_created").isObject()) {
            return null;
        }
        long replyId = reply.path("message_id").asLong(0);
        if (replyId == 0 || replyId == message.path("message_thread_id").asLong(-1)) {
            return null;
        }
        return String.valueOf(replyId);
    }

    static boolean isCommand(String text, String command) {
        String first = text.trim().split("\\s+")[0];
        // "/delete@MyBot" addresses the command to a specific bot
        int at = first.indexOf('@');
        return (at >= 0 ? first.substring(0, at) : first).equalsIgnoreCase(command);
    }

    private static boolean hasTrash(JsonNode reactions) {
        for (JsonNode reaction : reactions) {
            if ("emoji".equals(reaction.path("type").asText())
                    && TRASH_EMOJIS.contains(reaction.path("emoji").asText())) {
                return true;
            }
        }
        return false;
    }

    // --- Attachments ---

    record FileRef(String fileId, String filename, String mimeType, long size) {
    }

    static List<FileRef> fileRefs(JsonNode message) {
        List<FileRef> refs = new ArrayList<>();
        JsonNode photos = message.path("photo");
        if (photos.isArray() && photos.size() > 0) {
            // sizes are listed smallest first
            JsonNode largest = photos.get(photos.size() - 1);
            refs.add(new FileRef(largest.path("file_id").asText(), "photo.jpg", "image/jpeg",
                    largest.path("file_size").asLong(0)));
        }
        addFile(refs, message.path("document"), "document", "application/octet-stream");
        addFile(refs, message.path("audio"), "audio.mp3", "audio/mpeg");
        addFile(refs, message.path("video"), "video.mp4", "video/mp4");
        addFile(refs, message.path("voice"), "voice.ogg", "audio/ogg");
        return refs;
    }

    private static void addFile(List<FileRef> refs, JsonNode file, String defaultName, String defaultMime) {
        if (!file.isObject() || !file.hasNonNull("file_id")) {
            return;
        }
        refs.add(new FileRef(file.get("file_id").asText(),
                file.path("file_name").asText(defaultName),
                file.path("mime_type").asText(defaultMime),
                file.path("file_size").asLong(0)));
    }

    private CompletableFuture<List<Attachment>> resolveAttachments(List<FileRef> files) {
        List<CompletableFuture<Attachment>> futures = new ArrayList<>();
        for (FileRef file : files) {
            futures.add(fileUrlResolver.apply(file.fileId()).thenApply(url -> Attachment.builder()
                    .id(file.fileId())
                    .filename(file.filename())
                    .mimeType(file.mimeType())
                    .size(file.size())
                    .url(url)
                    .status("ready")
                    .uploadedFrom(BridgeMessageIds.TELEGRAM)
                    .bridgeFileId(file.fileId())
                    .build()));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).toList());
    }
}
