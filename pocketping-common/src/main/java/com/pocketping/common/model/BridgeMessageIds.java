package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Platform-side identifiers of one logical message.
 * <p>
 * Merging is append-only: a field is only replaced by a non-empty incoming
 * value, so copies posted by different platforms at different times can all be
 * found again for edits and deletes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BridgeMessageIds {

    public static final String TELEGRAM = "telegram";
    public static final String DISCORD = "discord";
    public static final String SLACK = "slack";

    private Long telegramMessageId;
    private String discordMessageId;
    private String slackMessageTs;

    public static BridgeMessageIds telegram(long messageId) {
        return BridgeMessageIds.builder().telegramMessageId(messageId).build();
    }

    public static BridgeMessageIds discord(String messageId) {
        return BridgeMessageIds.builder().discordMessageId(messageId).build();
    }

    public static BridgeMessageIds slack(String ts) {
        return BridgeMessageIds.builder().slackMessageTs(ts).build();
    }

    /**
     * Build the id record for one platform from its string form.
     * Returns an empty record when the platform is unknown or the id does not
     * parse (Telegram ids are numeric).
     */
    public static BridgeMessageIds forPlatform(String platform, String id) {
        if (platform == null || id == null || id.isBlank()) {
            return new BridgeMessageIds();
        }
        switch (platform) {
            case TELEGRAM:
                try {
                    return telegram(Long.parseLong(id.trim()));
                } catch (NumberFormatException e) {
                    return new BridgeMessageIds();
                }
            case DISCORD:
                return discord(id);
            case SLACK:
                return slack(id);
            default:
                return new BridgeMessageIds();
        }
    }

    /**
     * Return a new record holding this record's values overlaid with the
     * non-empty values of {@code other}.
     */
    public BridgeMessageIds merge(BridgeMessageIds other) {
        BridgeMessageIds result = toBuilder().build();
        if (other == null) {
            return result;
        }
        if (other.hasTelegram()) {
            result.telegramMessageId = other.telegramMessageId;
        }
        if (isPresent(other.discordMessageId)) {
            result.discordMessageId = other.discordMessageId;
        }
        if (isPresent(other.slackMessageTs)) {
            result.slackMessageTs = other.slackMessageTs;
        }
        return result;
    }

    /** Platform id as a string, or null when this record has none for it. */
    public String idFor(String platform) {
        if (platform == null) {
            return null;
        }
        switch (platform) {
            case TELEGRAM:
                return hasTelegram() ? String.valueOf(telegramMessageId) : null;
            case DISCORD:
                return isPresent(discordMessageId) ? discordMessageId : null;
            case SLACK:
                return isPresent(slackMessageTs) ? slackMessageTs : null;
            default:
                return null;
        }
    }

    @JsonIgnore
    public boolean hasTelegram() {
        return telegramMessageId != null && telegramMessageId != 0L;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasTelegram() && !isPresent(discordMessageId) && !isPresent(slackMessageTs);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
