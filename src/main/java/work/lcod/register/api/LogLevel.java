package work.lcod.register.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the CLI, mapped onto the SLF4J simple binding.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

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

    /**
     * Must run before the first logger is created; the simple binding reads its level once.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, name().toLowerCase(Locale.ROOT));
    }
}
