package util.logging;

import driver.GraphDriver;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link Logger}: formats the record and hands it to {@link LogManager}.
 * A logger created without an explicit level follows the root level.
 */
public class SimpleLogger implements Logger {
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    private final String name;
    private final LogLevel level;

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    public String getName() {
        return name;
    }

    @Override
    public void trace(String message) {
        log(LogLevel.TRACE, message);
    }

    @Override
    public void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    @Override
    public void info(String message) {
        log(LogLevel.INFO, message);
    }

    @Override
    public void warn(String message) {
        log(LogLevel.WARN, message);
    }

    @Override
    public void error(String message) {
        log(LogLevel.ERROR, message);
    }

    @Override
    public void trace(String format, Object... args) {
        if (isEnabled(LogLevel.TRACE)) {
            log(LogLevel.TRACE, formatMessage(format, args));
        }
    }

    @Override
    public void debug(String format, Object... args) {
        if (isEnabled(LogLevel.DEBUG)) {
            log(LogLevel.DEBUG, formatMessage(format, args));
        }
    }

    @Override
    public void info(String format, Object... args) {
        if (isEnabled(LogLevel.INFO)) {
            log(LogLevel.INFO, formatMessage(format, args));
        }
    }

    @Override
    public void warn(String format, Object... args) {
        if (isEnabled(LogLevel.WARN)) {
            log(LogLevel.WARN, formatMessage(format, args));
        }
    }

    @Override
    public void error(String format, Object... args) {
        if (isEnabled(LogLevel.ERROR)) {
            log(LogLevel.ERROR, formatMessage(format, args));
        }
    }

    @Override
    public void error(String message, Throwable cause) {
        if (!isEnabled(LogLevel.ERROR)) {
            return;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        log(LogLevel.ERROR, message + System.lineSeparator() + trace);
    }

    @Override
    public boolean isEnabled(LogLevel candidate) {
        return !candidate.isLessSpecificThan(effectiveLevel());
    }

    private LogLevel effectiveLevel() {
        return level != null ? level : LogManager.getRootLevel();
    }

    private void log(LogLevel recordLevel, String message) {
        if (!isEnabled(recordLevel)) {
            return;
        }

        StackTraceElement caller = getCaller();
        String methodInfo = "";
        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        String source = GraphDriver.getInstance().getSource();
        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String record = String.format("%s %s [%s] %s - %s%s",
                source != null ? source : "-",
                timestamp,
                recordLevel,
                name,
                methodInfo,
                message);

        LogManager.writeLog(recordLevel, record);
    }

    /**
     * First stack frame outside the logging classes.
     */
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        String loggerClassName = SimpleLogger.class.getName();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            if (foundLogger && !element.getClassName().equals(loggerClassName)
                    && !element.getClassName().equals(LogManager.class.getName())) {
                return element;
            }
            if (element.getClassName().equals(loggerClassName)) {
                foundLogger = true;
            }
        }
        return null;
    }

    static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);
        while (matcher.find()) {
            if (argIndex < args.length) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(args[argIndex++])));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
