package com.pocketping.gateway.router;

import com.pocketping.common.model.CustomEvent;
import com.pocketping.common.model.Message;
import com.pocketping.common.model.MessageStatus;
import com.pocketping.common.model.Session;

import java.time.Instant;
import java.util.List;

/**
 * Decoded inbound events, one variant per {@link IncomingEventType}.
 */
public sealed interface InboundEvent {

    IncomingEventType type();

    record NewSession(Session session) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.NEW_SESSION;
        }
    }

    record VisitorMessage(Message message, Session session) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.VISITOR_MESSAGE;
        }
    }

    record AiTakeover(Session session, String reason) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.AI_TAKEOVER;
        }
    }

    record OperatorStatus(boolean online) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.OPERATOR_STATUS;
        }
    }

    record MessageRead(String sessionId, List<String> messageIds, MessageStatus status) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.MESSAGE_READ;
        }
    }

    record CustomEventReceived(CustomEvent event, Session session) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.CUSTOM_EVENT;
        }
    }

    record IdentityUpdate(Session session) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.IDENTITY_UPDATE;
        }
    }

    record VisitorMessageEdited(String sessionId, String messageId, String content, Instant editedAt)
            implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.VISITOR_MESSAGE_EDITED;
        }
    }

    record VisitorMessageDeleted(String sessionId, String messageId, Instant deletedAt) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.VISITOR_MESSAGE_DELETED;
        }
    }

    record VisitorDisconnect(Session session, long durationSeconds, String reason) implements InboundEvent {
        public IncomingEventType type() {
            return IncomingEventType.VISITOR_DISCONNECT;
        }
    }
}
