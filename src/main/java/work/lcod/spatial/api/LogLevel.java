package work.lcod.spatial.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line and in {@code spatial.toml}.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("off");

    private final String simpleLoggerName;

    LogLevel(String simpleLoggerName) {
        this.simpleLoggerName = simpleLoggerName;
    }

    /**
     * Level name understood by {@code org.slf4j.simpleLogger.defaultLogLevel}.
     */
    public String simpleLoggerName() {
        return simpleLoggerName;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value, ex);
        }
    }
}
