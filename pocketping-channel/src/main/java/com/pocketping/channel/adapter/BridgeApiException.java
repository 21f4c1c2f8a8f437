package com.pocketping.channel.adapter;

/**
 * A platform API call failed: transport error, non-2xx status, or an
 * {@code ok:false} body.
 */
public class BridgeApiException extends RuntimeException {

    private final String platform;
    private final int status;

    public BridgeApiException(String platform, int status, String message) {
        super(platform + " API error" + (status > 0 ? " " + status : "") + ": " + message);
        this.platform = platform;
        this.status = status;
    }

    public BridgeApiException(String platform, String message, Throwable cause) {
        super(platform + " request failed: " + message, cause);
        this.platform = platform;
        this.status = 0;
    }

    public String getPlatform() {
        return platform;
    }

    /** HTTP status, or 0 for transport failures and platform-level errors on 200. */
    public int getStatus() {
        return status;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
