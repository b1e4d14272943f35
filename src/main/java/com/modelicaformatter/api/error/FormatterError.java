package com.modelicaformatter.api.error;

import java.util.Objects;

/**
 * A diagnostic attached to a formatting result. Line and column are 1-based.
 */
public class FormatterError {
    private final Severity severity;
    private final String code;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, null, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this(severity, null, message, line, column, suggestion);
    }

    public FormatterError(Severity severity, String code, String message, int line, int column, String suggestion) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.code = code;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    public static FormatterError warning(String code, String message, int line) {
        return new FormatterError(Severity.WARNING, code, message, line, 1, null);
    }

    public static FormatterError fatal(String message) {
        return new FormatterError(Severity.FATAL, null, message, 1, 1, null);
    }

    public Severity getSeverity() { return severity; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity + (code != null ? " [" + code + "]" : "") + " line " + line + ": " + message;
    }
}
