package com.pocketping.channel.inbound;

import com.pocketping.common.model.Attachment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Operator actions observed on a platform, normalized so the gateway does
 * not need to know whether they came from a webhook or the Discord gateway.
 */
public final class OperatorEvents {

    private OperatorEvents() {
    }

    /** A new operator message written in a session thread. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorMessage {
        private String sourceBridge;
        private String sessionId;
        /** Platform-side id of the message (Telegram message id, Discord id, Slack ts). */
        private String bridgeMessageId;
        private String content;
        private String operatorName;
        private List<Attachment> attachments;
        /** Platform-side id of the message being replied to, when any. */
        private String replyToBridgeMessageId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorEdit {
        private String sourceBridge;
        /** May be null when the platform does not say which thread the message lives in. */
        private String sessionId;
        private String bridgeMessageId;
        private String content;
        private Instant editedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorDelete {
        private String sourceBridge;
        private String sessionId;
        private String bridgeMessageId;
        private Instant deletedAt;
    }
}
