package com.modelicaformatter.util;

import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders diagnostics for the console, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One diagnostic as {@code SEVERITY [CODE]: message (Line n)}, with its suggestion on a
     * second line when there is one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(_colorOf(error.getSeverity()), error.getSeverity().name()));
        if (error.getCode() != null) {
            sb.append(" [").append(error.getCode()).append("]");
        }
        sb.append(": ").append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Per-file counts by severity followed by a total line. Files without diagnostics are skipped.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Diagnostic Summary:")).append('\n');

        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = errors.stream()
                    .collect(Collectors.groupingBy(FormatterError::getSeverity,
                            () -> new EnumMap<>(Severity.class), Collectors.counting()));
            counts.forEach((severity, count) -> totals.merge(severity, count, Long::sum));

            Path fileName = entry.getKey().getFileName();
            sb.append(fileName != null ? fileName : entry.getKey()).append(": ")
                    .append(_joinCounts(counts)).append('\n');
        }

        sb.append("\nTotal: ").append(totals.isEmpty() ? "no diagnostics" : _joinCounts(totals));
        return sb.toString();
    }

    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity,
                () -> new EnumMap<>(Severity.class), Collectors.toList()));
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private String _joinCounts(Map<Severity, Long> counts) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<Severity, Long> entry : counts.entrySet()) {
            String label = entry.getKey().name().toLowerCase();
            parts.add(colorize(_colorOf(entry.getKey()), entry.getValue() + " " + label));
        }
        return String.join(", ", parts);
    }

    private static String _colorOf(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }
}
