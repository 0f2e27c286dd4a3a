package util.logging;

import driver.Config;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates loggers and owns the appenders (console and an optional log file).
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static final Object FILE_LOCK = new Object();

    private static volatile LogLevel rootLevel = LogLevel.WARN;
    private static boolean initialized = false;

    private static volatile boolean consoleEnabled = false;
    private static volatile boolean fileEnabled = false;
    private static PrintWriter fileWriter;

    private LogManager() {
    }

    /**
     * Logger following the root level.
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    /**
     * Logger pinned to {@code level} regardless of the root level.
     */
    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }
        if (level == null) {
            return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, null));
        }
        return loggers.computeIfAbsent(name + "@" + level, n -> new SimpleLogger(name, level));
    }

    /**
     * Read the logging switches from {@link Config}. Called lazily by the first getLogger.
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }
        Config config = Config.getInstance();
        rootLevel = config.getLogLevel();
        consoleEnabled = config.isLogConsole();
        if (config.isLogFile()) {
            openLogFile();
        }
        initialized = true;
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("cannot create log directory " + logDir.getAbsolutePath());
            return;
        }
        try {
            File logFile = new File(logDir, "quilgraph" + System.currentTimeMillis() + ".log");
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            }
            fileEnabled = true;
        } catch (IOException e) {
            System.err.println("cannot open log file: " + e.getMessage());
            fileEnabled = false;
        }
    }

    public static void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static void disableFile() {
        fileEnabled = false;
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }

    /**
     * 关闭所有输出
     */
    public static void shutdown() {
        disableConsole();
        disableFile();
    }
}
