package util.logging;

/**
 * Severity of a log record, ordered from the most verbose to the most severe.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    OFF(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level is more verbose than {@code threshold}
     */
    public boolean isLessSpecificThan(LogLevel threshold) {
        return value < threshold.value;
    }

    /**
     * Parse a level name such as "debug" or "WARN"; unknown names fall back to
     * {@code fallback}.
     */
    public static LogLevel parse(String raw, LogLevel fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(raw.trim())) {
                return level;
            }
        }
        return fallback;
    }
}
