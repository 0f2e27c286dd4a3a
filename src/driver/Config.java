package driver;

import util.logging.LogLevel;

/*
 * configuration of the graph builder, read once from JVM system properties
 *   -Ddebug=true       debug logging
 *   -Dverify=false     skip the VerifyGraph pass
 *   -Dlog.level=info   root log level (debug wins when set)
 *   -Dlog.console=true / -Dlog.file=true   appenders
 */
public class Config {
    private static final Config config = new Config();

    private final boolean isDebug;
    private final boolean isVerify;
    private final LogLevel logLevel;
    private final boolean logConsole;
    private final boolean logFile;

    private Config() {
        isDebug = getFlag("debug");
        isVerify = getFlag("verify", true);
        logLevel = isDebug ? LogLevel.DEBUG : LogLevel.parse(System.getProperty("log.level"), LogLevel.WARN);
        logConsole = getFlag("log.console");
        logFile = getFlag("log.file");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        return getFlag(name, false);
    }

    public static boolean getFlag(String name, boolean defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return raw.trim().equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }

    public boolean isDebug() {
        return isDebug;
    }

    public boolean isVerify() {
        return isVerify;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    public boolean isLogConsole() {
        return logConsole;
    }

    public boolean isLogFile() {
        return logFile;
    }
}
