package work.lcod.buildbackend.api;

import java.util.Locale;

/**
 * Log thresholds selectable from the command line.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static final LogLevel DEFAULT = INFO;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Each {@code -v} lowers the threshold by one step from {@link #DEFAULT}, each {@code -q}
     * raises it; the result is clamped to the ends of the scale.
     */
    public static LogLevel fromVerbosity(int verbose, int quiet) {
        int index = DEFAULT.ordinal() - verbose + quiet;
        LogLevel[] levels = values();
        return levels[Math.max(0, Math.min(levels.length - 1, index))];
    }
}
