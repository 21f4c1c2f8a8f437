package com.pocketping.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketping.channel.inbound.OperatorEventSink;
import com.pocketping.channel.inbound.OperatorEvents;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Handles Discord interactions posted to the bridge: the PING handshake and
 * the {@code /reply message:<text>} slash command used inside a session thread.
 */
@Slf4j
public class DiscordInteractionHandler {

    static final int PING = 1;
    static final int APPLICATION_COMMAND = 2;
    static final int PONG = 1;
    static final int CHANNEL_MESSAGE_WITH_SOURCE = 4;

    static final String REPLY_COMMAND = "reply";
    static final String SENT_CONFIRMATION = "✅ Message sent to visitor";

    private final OperatorEventSink sink;
    private final Function<String, String> sessionResolver;

    public DiscordInteractionHandler(DiscordBridgeAdapter adapter, OperatorEventSink sink) {
        this(sink, adapter::resolveSessionId);
    }

    DiscordInteractionHandler(OperatorEventSink sink, Function<String, String> sessionResolver) {
        this.sink = sink;
        this.sessionResolver = sessionResolver;
    }

    public Map<String, Object> handle(JsonNode interaction) {
        int type = interaction != null ? interaction.path("type").asInt(0) : 0;
        if (type != APPLICATION_COMMAND) {
            if (type != PING) {
                log.debug("[discord] ignoring interaction type {}", type);
            }
            return Map.of("type", PONG);
        }

        JsonNode data = interaction.path("data");
        String channelId = interaction.path("channel_id").asText("");
        String content = optionValue(data, "message");
        if (!REPLY_COMMAND.equals(data.path("name").asText()) || channelId.isEmpty() || content == null) {
            log.debug("[discord] ignoring command {}", data.path("name").asText());
            return Map.of("type", PONG);
        }

        JsonNode user = interaction.path("member").path("user");
        if (user.isMissingNode()) {
            user = interaction.path("user");
        }
        sink.onOperatorMessage(OperatorEvents.OperatorMessage.builder()
                .sourceBridge(DiscordBridgeAdapter.NAME)
                .sessionId(sessionResolver.apply(channelId))
                .bridgeMessageId(interaction.path("id").asText())
                .content(content)
                .operatorName(operatorName(user))
                .attachments(List.of())
                .build());

        return Map.of("type", CHANNEL_MESSAGE_WITH_SOURCE, "data", Map.of("content", SENT_CONFIRMATION));
    }

    private static String optionValue(JsonNode data, String name) {
        for (JsonNode option : data.path("options")) {
            if (name.equals(option.path("name").asText())) {
                String value = option.path("value").asText("");
                return value.isBlank() ? null : value;
            }
        }
        return null;
    }

    static String operatorName(JsonNode user) {
        String globalName = user.path("global_name").asText("");
        if (!globalName.isBlank()) {
            return globalName;
        }
        String username = user.path("username").asText("");
        return username.isBlank() ? "Operator" : username;
    }
}
