package com.pocketping.common.infra;

/**
 * Duration formatting for operator-facing text.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * Format a visit length in seconds: "45s", "3 min", "2h", "1h 15min".
     * Negative values are treated as zero.
     */
    public static String formatVisit(long seconds) {
        if (seconds < 0)
            seconds = 0;
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        if (minutes < 60) {
            return minutes + " min";
        }
        long hours = minutes / 60;
        long rest = minutes % 60;
        if (rest == 0) {
            return hours + "h";
        }
        return hours + "h " + rest + "min";
    }
}
