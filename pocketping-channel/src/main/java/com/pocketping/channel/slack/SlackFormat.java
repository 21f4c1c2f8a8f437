package com.pocketping.channel.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * mrkdwn texts and Block Kit layouts posted to Slack.
 */
final class SlackFormat {

    private SlackFormat() {
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    static String newSessionText(String visitorName) {
        return "New chat session from " + visitorName;
    }

    static List<Map<String, Object>> newSessionBlocks(Session session, String visitorName) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header("New Chat Session"));
        blocks.add(fields(List.of("*Visitor:*\n" + escape(visitorName))));
        if (session.getMetadata() != null && notBlank(session.getMetadata().getUrl())) {
            blocks.add(section("*Page:* " + escape(session.getMetadata().getUrl())));
        }
        return blocks;
    }

    static String visitorMessage(Message message, String visitorName, String quote) {
        StringBuilder sb = new StringBuilder();
        if (notBlank(quote)) {
            sb.append("> ").append(escape(quote).replace("\n", "\n> ")).append("\n");
        }
        sb.append("*").append(escape(visitorName)).append("*: ").append(escape(message.getContent()));
        if (message.hasAttachments()) {
            sb.append(" _(+").append(message.getAttachments().size()).append(" attachment(s))_");
        }
        return sb.toString();
    }

    static String operatorMessage(String operatorName, String sourceBridge, String content) {
        return "*" + escape(operatorName) + "* (via " + escape(sourceBridge) + "): " + escape(content);
    }

    static String edited(String content) {
        return "_(edited)_ " + escape(content);
    }

    static List<Map<String, Object>> customEventBlocks(CustomEvent event, ObjectMapper mapper) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header("Event: " + event.getName()));
        if (event.getData() != null && !event.getData().isEmpty()) {
            String json;
            try {
                json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(event.getData());
            } catch (JsonProcessingException e) {
                json = String.valueOf(event.getData());
            }
            blocks.add(section("```" + json + "```"));
        }
        return blocks;
    }

    static List<Map<String, Object>> identityBlocks(Session session) {
        List<String> fieldTexts = new ArrayList<>();
        fieldTexts.add("*User ID:*\n" + escape(session.getIdentity().getId()));
        if (notBlank(session.getIdentity().getName())) {
            fieldTexts.add("*Name:*\n" + escape(session.getIdentity().getName()));
        }
        if (notBlank(session.getIdentity().getEmail())) {
            fieldTexts.add("*Email:*\n" + escape(session.getIdentity().getEmail()));
        }
        if (notBlank(session.getUserPhone())) {
            fieldTexts.add("*Phone:*\n" + escape(session.getUserPhone()));
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header("User Identified"));
        blocks.add(fields(fieldTexts));
        return blocks;
    }

    static List<Map<String, Object>> aiTakeoverBlocks(String reason) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header("AI Takeover"));
        blocks.add(section("*Reason:* " + escape(reason)));
        return blocks;
    }

    private static Map<String, Object> header(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "header");
        block.put("text", Map.of("type", "plain_text", "text", text));
        return block;
    }

    private static Map<String, Object> section(String mrkdwn) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "section");
        block.put("text", Map.of("type", "mrkdwn", "text", mrkdwn));
        return block;
    }

    private static Map<String, Object> fields(List<String> texts) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (String text : texts) {
            fields.add(Map.of("type", "mrkdwn", "text", text));
        }
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "section");
        block.put("fields", fields);
        return block;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
