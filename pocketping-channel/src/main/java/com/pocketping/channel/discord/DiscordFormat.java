package com.pocketping.channel.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Markdown texts and embeds posted to Discord.
 */
final class DiscordFormat {

    private DiscordFormat() {
    }

    static final int COLOR_SESSION = 0x00D4AA;
    static final int COLOR_EVENT = 0x5865F2;
    static final int COLOR_IDENTITY = 0x57F287;
    static final int COLOR_AI = 0xFEE75C;

    /** Discord caps thread names at 100 characters. */
    static final int MAX_THREAD_NAME = 100;

    static String threadName(Session session, String visitorName) {
        String id = session.getId() != null ? session.getId() : "session";
        String shortId = id.length() > 8 ? id.substring(0, 8) : id;
        String name = "💬 " + shortId + " • " + visitorName;
        return name.length() > MAX_THREAD_NAME ? name.substring(0, MAX_THREAD_NAME) : name;
    }

    static Map<String, Object> newSessionEmbed(Session session, String visitorName) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Visitor", visitorName, true));
        if (session.getMetadata() != null && notBlank(session.getMetadata().getUrl())) {
            fields.add(field("Page", session.getMetadata().getUrl(), false));
        }
        Map<String, Object> embed = embed("New Chat Session", "A new visitor has started a chat", COLOR_SESSION);
        embed.put("fields", fields);
        embed.put("timestamp", Instant.now().toString());
        return embed;
    }

    static String visitorMessage(Message message, String visitorName, String quote) {
        StringBuilder sb = new StringBuilder();
        if (notBlank(quote)) {
            sb.append("> ").append(quote.replace("\n", "\n> ")).append("\n");
        }
        sb.append("**").append(visitorName).append("**: ").append(nullToEmpty(message.getContent()));
        if (message.hasAttachments()) {
            sb.append(" _(+").append(message.getAttachments().size()).append(" attachment(s))_");
        }
        return sb.toString();
    }

    static String operatorMessage(String operatorName, String sourceBridge, String content) {
        return "**" + operatorName + "** (via " + sourceBridge + "): " + nullToEmpty(content);
    }

    static String edited(String content) {
        return "_(edited)_ " + nullToEmpty(content);
    }

    static Map<String, Object> customEventEmbed(CustomEvent event, ObjectMapper mapper) {
        Map<String, Object> embed = embed("Event: " + event.getName(), null, COLOR_EVENT);
        if (event.getData() != null) {
            String json;
            try {
                json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(event.getData());
            } catch (JsonProcessingException e) {
                json = String.valueOf(event.getData());
            }
            embed.put("description", "```json\n" + json + "\n```");
        }
        embed.put("timestamp", Instant.now().toString());
        return embed;
    }

    static Map<String, Object> identityEmbed(Session session) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("User ID", session.getIdentity().getId(), true));
        if (notBlank(session.getIdentity().getName())) {
            fields.add(field("Name", session.getIdentity().getName(), true));
        }
        if (notBlank(session.getIdentity().getEmail())) {
            fields.add(field("Email", session.getIdentity().getEmail(), true));
        }
        if (notBlank(session.getUserPhone())) {
            fields.add(field("Phone", session.getUserPhone(), true));
        }
        Map<String, Object> embed = embed("User Identified", null, COLOR_IDENTITY);
        embed.put("fields", fields);
        return embed;
    }

    static Map<String, Object> aiTakeoverEmbed(String reason) {
        return embed("AI Takeover", reason, COLOR_AI);
    }

    private static Map<String, Object> embed(String title, String description, int color) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", title);
        if (description != null) {
            embed.put("description", description);
        }
        embed.put("color", color);
        return embed;
    }

    private static Map<String, Object> field(String name, String value, boolean inline) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("value", notBlank(value) ? value : "-");
        field.put("inline", inline);
        return field;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
