package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity attached to a session once the host site identifies the visitor.
 * Fields other than id, email and name are kept in {@link #customFields}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserIdentity {
    private String id;
    private String email;
    private String name;

    @Builder.Default
    private Map<String, Object> customFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void putCustomField(String key, Object value) {
        if (customFields == null) {
            customFields = new LinkedHashMap<>();
        }
        customFields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getCustomFields() {
        return customFields;
    }
}
