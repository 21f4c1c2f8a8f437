package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * File attached to a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attachment {
    private String id;
    private String filename;
    private String mimeType;
    private long size;
    private String url;
    private String thumbnailUrl;
    private String status;
    /** Platform the file was uploaded from ("telegram", "slack", ...). */
    private String uploadedFrom;
    /** Platform-side file identifier, when the platform has one. */
    private String bridgeFileId;

    @JsonIgnore
    public boolean isImage() {
        return mimeType != null && mimeType.startsWith("image/");
    }
}
