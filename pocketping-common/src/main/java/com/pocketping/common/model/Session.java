package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A visitor conversation. Owned by the host backend; the bridge only caches it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Session {
    private String id;
    private String visitorId;
    private Instant createdAt;
    private Instant lastActivity;
    /** Null when the snapshot does not carry it. */
    private Boolean operatorOnline;
    private Boolean aiActive;
    private SessionMetadata metadata;
    private UserIdentity identity;
    /** E.164 phone number, when collected. */
    private String userPhone;
    private String userPhoneCountry;

    public static Session ofId(String id) {
        return Session.builder().id(id).build();
    }

    /**
     * Fold a newer snapshot of the same session into a copy of this one.
     * Metadata is merged field by field, identity and flags are replaced when present.
     */
    public Session mergedWith(Session incoming) {
        if (incoming == null) {
            return this.toBuilder().build();
        }
        Session result = incoming.toBuilder().build();
        if (result.getVisitorId() == null) {
            result.setVisitorId(visitorId);
        }
        if (result.getCreatedAt() == null) {
            result.setCreatedAt(createdAt);
        }
        if (result.getLastActivity() == null) {
            result.setLastActivity(lastActivity);
        }
        if (result.getOperatorOnline() == null) {
            result.setOperatorOnline(operatorOnline);
        }
        if (result.getAiActive() == null) {
            result.setAiActive(aiActive);
        }
        if (metadata != null) {
            result.setMetadata(metadata.mergedWith(incoming.getMetadata()));
        }
        if (result.getIdentity() == null) {
            result.setIdentity(identity);
        }
        if (result.getUserPhone() == null) {
            result.setUserPhone(userPhone);
            result.setUserPhoneCountry(userPhoneCountry);
        }
        return result;
    }

    /**
     * Human readable visitor name: identity name, metadata name, the local part
     * of an email, else "Visitor".
     */
    public String displayName() {
        if (identity != null && notBlank(identity.getName())) {
            return identity.getName();
        }
        if (metadata != null && notBlank(metadata.getName())) {
            return metadata.getName();
        }
        String email = identity != null && notBlank(identity.getEmail()) ? identity.getEmail()
                : metadata != null ? metadata.getEmail() : null;
        if (notBlank(email)) {
            int at = email.indexOf('@');
            return at > 0 ? email.substring(0, at) : email;
        }
        return "Visitor";
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
