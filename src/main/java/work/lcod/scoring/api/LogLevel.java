package work.lcod.scoring.api;

import java.util.Locale;

/**
 * Diagnostic severities, ordered from most to least verbose.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean isAtLeast(LogLevel threshold) {
        return compareTo(threshold) >= 0;
    }
}
