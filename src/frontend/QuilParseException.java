package frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Quil 源码解析异常, 一次报告所有语法错误
 */
public class QuilParseException extends Exception {

    private final String sourceName;
    private final List<ParseError> errors;

    /**
     * 单条错误: 行号从 1 开始, 列号从 0 开始
     */
    public static class ParseError {
        private final int lineNumber;
        private final int column;
        private final String errorMessage;

        public ParseError(int lineNumber, int column, String errorMessage) {
            this.lineNumber = lineNumber;
            this.column = column;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public int getColumn() {
            return column;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            return "Line " + lineNumber + ":" + column + ": " + errorMessage;
        }
    }

    public QuilParseException(String sourceName, List<ParseError> errors) {
        super(formatMultipleErrors(sourceName, errors));
        this.sourceName = sourceName;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public QuilParseException(String sourceName, int lineNumber, int column, String message, Throwable cause) {
        super(formatMultipleErrors(sourceName, List.of(new ParseError(lineNumber, column, message))), cause);
        this.sourceName = sourceName;
        this.errors = List.of(new ParseError(lineNumber, column, message));
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    /**
     * 格式化多个错误消息
     */
    private static String formatMultipleErrors(String sourceName, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder("Cannot parse ").append(sourceName);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i).toString());
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }
}
