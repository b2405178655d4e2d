package com.forumbot.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Environment lookups over an explicit env map, plus one-time logging of
 * accepted options.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Logger log = LoggerFactory.getLogger(EnvUtils.class);
    private static final Set<String> loggedKeys = ConcurrentHashMap.newKeySet();

    /**
     * Get a trimmed, non-blank value or the default.
     */
    public static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    /**
     * Get an integer value; unparsable values fall back to the default.
     */
    public static int getEnvInt(Map<String, String> env, String key, int defaultValue) {
        String value = getEnv(env, key, null);
        if (value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("env: {}={} is not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Log an accepted environment option (only once per key).
     */
    public static void logAcceptedEnvOption(Map<String, String> env, String key, String description,
            boolean redact) {
        String value = env.get(key);
        if (value == null || value.isBlank() || !loggedKeys.add(key)) {
            return;
        }
        String displayValue = redact ? "<redacted>" : formatValue(value);
        log.info("env: {}={} ({})", key, displayValue, description);
    }

    private static String formatValue(String value) {
        String singleLine = value.replaceAll("\\s+", " ").trim();
        if (singleLine.length() <= 160) {
            return singleLine;
        }
        return singleLine.substring(0, 160) + "…";
    }

    /**
     * Reset logged keys (for testing).
     */
    public static void resetForTest() {
        loggedKeys.clear();
    }
}
