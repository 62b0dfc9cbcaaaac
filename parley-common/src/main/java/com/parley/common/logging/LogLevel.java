package com.parley.common.logging;

import java.util.Map;

/**
 * Log levels accepted in {@code logging.level}, with SLF4J mapping.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("fatal", ERROR),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Convert to the level name Logback understands.
     */
    public String toSlf4jLevel() {
        return this == SILENT ? "OFF" : name();
    }
}
