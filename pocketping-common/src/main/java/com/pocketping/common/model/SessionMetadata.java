package com.pocketping.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Browser and network metadata collected for a session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionMetadata {
    private String url;
    private String referrer;
    private String pageTitle;
    private String userAgent;
    private String timezone;
    private String language;
    private String screenResolution;
    private String ip;
    private String country;
    private String city;
    private String deviceType;
    private String browser;
    private String os;
    /** Display name some widgets send before the visitor is identified. */
    private String name;
    private String email;

    /**
     * Merge a newer metadata snapshot into a copy of this one.
     * Non-blank incoming values win; blank incoming values never erase what is
     * already known (server-populated ip/country/city survive a reconnect whose
     * client payload leaves them empty).
     */
    public SessionMetadata mergedWith(SessionMetadata incoming) {
        SessionMetadata result = this.toBuilder().build();
        if (incoming == null) {
            return result;
        }
        take(incoming::getUrl, result::setUrl);
        take(incoming::getReferrer, result::setReferrer);
        take(incoming::getPageTitle, result::setPageTitle);
        take(incoming::getUserAgent, result::setUserAgent);
        take(incoming::getTimezone, result::setTimezone);
        take(incoming::getLanguage, result::setLanguage);
        take(incoming::getScreenResolution, result::setScreenResolution);
        take(incoming::getIp, result::setIp);
        take(incoming::getCountry, result::setCountry);
        take(incoming::getCity, result::setCity);
        take(incoming::getDeviceType, result::setDeviceType);
        take(incoming::getBrowser, result::setBrowser);
        take(incoming::getOs, result::setOs);
        take(incoming::getName, result::setName);
        take(incoming::getEmail, result::setEmail);
        return result;
    }

    private static void take(Supplier<String> source, Consumer<String> target) {
        String value = source.get();
        if (value != null && !value.isBlank()) {
            target.accept(value);
        }
    }
}
