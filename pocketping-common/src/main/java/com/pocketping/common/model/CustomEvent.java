package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Named event emitted by the widget or host site (e.g. "clicked_pricing").
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomEvent {
    private String name;
    private Map<String, Object> data;
    private String timestamp;
    private String sessionId;
}
