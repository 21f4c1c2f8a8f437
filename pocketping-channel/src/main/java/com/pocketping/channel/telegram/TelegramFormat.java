package com.pocketping.channel.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.Session;
import com.pocketping.common.model.SessionMetadata;

/**
 * HTML texts posted to Telegram (parse_mode=HTML).
 */
final class TelegramFormat {

    private TelegramFormat() {
    }

    /** Topic icon color accepted by createForumTopic (light blue). */
    static final int TOPIC_ICON_COLOR = 0x6FB9F0;

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /** Topic title: "💬 <first 8 chars of session id> • <page or site>". */
    static String topicName(Session session) {
        String id = session.getId() != null ? session.getId() : "session";
        String shortId = id.length() > 8 ? id.substring(0, 8) : id;
        String page = pageLabel(session.getMetadata());
        String name = "💬 " + shortId + (page != null ? " • " + page : "");
        // Telegram caps topic names at 128 characters
        return name.length() > 128 ? name.substring(0, 128) : name;
    }

    private static String pageLabel(SessionMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        if (metadata.getPageTitle() != null && !metadata.getPageTitle().isBlank()) {
            return metadata.getPageTitle();
        }
        if (metadata.getUrl() != null && !metadata.getUrl().isBlank()) {
            return metadata.getUrl().replaceFirst("^https?://", "");
        }
        return null;
    }

    static String newSession(Session session, String visitorName) {
        StringBuilder sb = new StringBuilder("🆕 <b>New chat session</b>\n👤 Visitor: ")
                .append(escapeHtml(visitorName));
        SessionMetadata m = session.getMetadata();
        if (m != null) {
            if (notBlank(m.getCountry()) || notBlank(m.getCity())) {
                sb.append("\n🌍 ").append(escapeHtml(m.getCountry())).append(", ").append(escapeHtml(m.getCity()));
            }
            if (notBlank(m.getUrl())) {
                sb.append("\n📍 ").append(escapeHtml(m.getUrl()));
            }
        }
        return sb.toString();
    }

    static String visitorMessage(Message message, String visitorName, String quote) {
        StringBuilder sb = new StringBuilder();
        if (quote != null && !quote.isBlank()) {
            sb.append("<i>").append(escapeHtml(quote)).append("</i>\n");
        }
        sb.append("💬 <b>").append(escapeHtml(visitorName)).append("</b>:\n")
                .append(escapeHtml(message.getContent()));
        if (message.hasAttachments()) {
            sb.append("\n📎 ").append(message.getAttachments().size()).append(" attachment(s)");
        }
        return sb.toString();
    }

    static String operatorMessage(String operatorName, String sourceBridge, String content) {
        return "👤 <b>" + escapeHtml(operatorName) + "</b> (via " + escapeHtml(sourceBridge) + "):\n"
                + escapeHtml(content);
    }

    static String edited(String content) {
        return "✏️ (edited):\n" + escapeHtml(content);
    }

    static String customEvent(CustomEvent event, ObjectMapper mapper) {
        StringBuilder sb = new StringBuilder("⚡ <b>Event: ").append(escapeHtml(event.getName())).append("</b>");
        if (event.getData() != null && !event.getData().isEmpty()) {
            try {
                sb.append("\n<code>").append(escapeHtml(mapper.writeValueAsString(event.getData())))
                        .append("</code>");
            } catch (Exception e) {
                sb.append("\n<code>").append(escapeHtml(String.valueOf(event.getData()))).append("</code>");
            }
        }
        return sb.toString();
    }

    static String identity(Session session) {
        StringBuilder sb = new StringBuilder("🔑 <b>User identified</b>\nID: ")
                .append(escapeHtml(session.getIdentity().getId()));
        if (notBlank(session.getIdentity().getName())) {
            sb.append("\nName: ").append(escapeHtml(session.getIdentity().getName()));
        }
        if (notBlank(session.getIdentity().getEmail())) {
            sb.append("\nEmail: ").append(escapeHtml(session.getIdentity().getEmail()));
        }
        if (notBlank(session.getUserPhone())) {
            sb.append("\n📱 Phone: ").append(escapeHtml(session.getUserPhone()));
        }
        return sb.toString();
    }

    static String aiTakeover(String reason) {
        return "🤖 <b>AI Takeover</b>\nReason: " + escapeHtml(reason);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
