package com.forumbot.common.logging;

import java.util.List;
import java.util.Locale;

/**
 * Verbosity of the bot's own loggers, read from {@code LOG_LEVEL}. The enum
 * names double as Logback level names.
 */
public enum LogLevel {
    OFF("off", "none", "silent"),
    ERROR("error", "critical", "fatal"),
    WARN("warn", "warning"),
    INFO("info"),
    DEBUG("debug"),
    TRACE("trace");

    private final List<String> spellings;

    LogLevel(String... spellings) {
        this.spellings = List.of(spellings);
    }

    /**
     * Level for a {@code LOG_LEVEL} value, case-insensitive. Missing or
     * unrecognised values give {@code fallback}.
     */
    public static LogLevel fromEnv(String raw, LogLevel fallback) {
        if (raw == null)
            return fallback;
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.spellings.contains(wanted))
                return level;
        }
        return fallback;
    }

    public static LogLevel fromEnv(String raw) {
        return fromEnv(raw, INFO);
    }

    /** Value for Spring Boot's {@code logging.level.<logger>} properties. */
    public String springLevel() {
        return name();
    }
}
