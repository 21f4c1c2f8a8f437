package com.pocketping.gateway.router;

import com.pocketping.common.model.Attachment;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.SenderType;

import java.util.ArrayList;
import java.util.List;

/**
 * Quoted previews of the message a visitor replies to.
 */
public final class ReplyQuotes {

    static final int MAX_PREVIEW = 140;

    private ReplyQuotes() {
    }

    /**
     * Render {@code > *Sender* [🖼️ 2 images, 📎 1 file] — preview}. Deleted
     * messages preview as "Message deleted"; previews longer than 140
     * characters are cut and end with "...".
     *
     * @return the quote, or an empty string when the message is unknown
     */
    public static String buildReplyQuote(Message message) {
        if (message == null) {
            return "";
        }
        SenderType sender = message.getSender() != null ? message.getSender() : SenderType.VISITOR;

        String preview = message.getContent() != null ? message.getContent() : "";
        if (message.isDeleted()) {
            preview = "Message deleted";
        } else if (preview.isEmpty() && message.hasAttachments()) {
            preview = "(attachment)";
        }
        preview = truncate(preview, MAX_PREVIEW);

        return "> *" + sender.getLabel() + "*" + attachmentSummary(message.getAttachments()) + " — " + preview;
    }

    static String attachmentSummary(List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return "";
        }
        int images = 0;
        int files = 0;
        for (Attachment attachment : attachments) {
            if (attachment.isImage()) {
                images++;
            } else {
                files++;
            }
        }
        List<String> parts = new ArrayList<>();
        if (images > 0) {
            parts.add("🖼️ " + images + (images == 1 ? " image" : " images"));
        }
        if (files > 0) {
            parts.add("📎 " + files + (files == 1 ? " file" : " files"));
        }
        return " [" + String.join(", ", parts) + "]";
    }

    /** Cut at a code point boundary. */
    static String truncate(String text, int max) {
        if (text.codePointCount(0, text.length()) <= max) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, max)) + "...";
    }
}
