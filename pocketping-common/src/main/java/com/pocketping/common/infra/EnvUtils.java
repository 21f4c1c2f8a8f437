package com.pocketping.common.infra;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Environment variable parsing helpers. Every lookup takes the environment as
 * a map so callers can pass a fixed one in tests.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Set<String> TRUTHY_VALUES = Set.of("1", "true", "yes", "on");
    private static final Set<String> FALSY_VALUES = Set.of("0", "false", "no", "off");

    /**
     * Check if an environment variable value is truthy.
     */
    public static boolean isTruthy(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return TRUTHY_VALUES.contains(value.trim().toLowerCase());
    }

    /**
     * Parse a boolean value (true/false/null for unknown).
     */
    public static Boolean parseBoolean(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String lower = value.trim().toLowerCase();
        if (TRUTHY_VALUES.contains(lower))
            return true;
        if (FALSY_VALUES.contains(lower))
            return false;
        return null;
    }

    /**
     * Get a trimmed, non-blank value or {@code null}.
     */
    public static String get(Map<String, String> env, String key) {
        String value = env.get(key);
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    public static boolean getBoolean(Map<String, String> env, String key, boolean defaultValue) {
        Boolean parsed = parseBoolean(env.get(key));
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * Parse an integer, falling back to {@code defaultValue} when absent,
     * non-numeric or outside {@code [min, max]}.
     */
    public static int getInt(Map<String, String> env, String key, int defaultValue, int min, int max) {
        String value = get(env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            return parsed < min || parsed > max ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Split a comma-separated list, dropping blank entries.
     */
    public static List<String> getList(Map<String, String> env, String key) {
        String value = get(env, key);
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
