package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One logical chat message. The id never changes; edits and deletes mutate
 * content and timestamps in place.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {
    private String id;
    private String sessionId;
    private String content;
    private SenderType sender;
    private Instant timestamp;
    private String replyTo;
    private List<Attachment> attachments;
    private MessageStatus status;
    private Instant deliveredAt;
    private Instant readAt;
    private Instant editedAt;
    private Instant deletedAt;

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }

    public Message copy() {
        Message copy = toBuilder().build();
        if (attachments != null) {
            copy.setAttachments(new ArrayList<>(attachments));
        }
        return copy;
    }
}
