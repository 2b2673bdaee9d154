package work.lcod.pumslabel.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line, mapped onto the slf4j-simple levels.
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

    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Sets the default slf4j-simple level. Only loggers created afterwards pick it up.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, simpleLoggerName());
    }
}
