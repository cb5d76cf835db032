package com.cppformatter.util;

import com.cppformatter.api.Refactoring;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders diagnostics and per-file summaries for the terminal.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use ANSI colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One diagnostic as {@code SEVERITY [KIND] line:column: message},
     * followed by the suggestion when there is one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr);
        if (error.getKind() != null) {
            sb.append(" [").append(error.getKind()).append("]");
        }
        sb.append(" ").append(error.getLine()).append(":").append(error.getColumn()).append(": ");
        sb.append(error.getMessage());

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    public String formatRefactoring(Refactoring refactoring) {
        String lines = refactoring.getStartLine() == refactoring.getEndLine()
                ? "line " + refactoring.getStartLine()
                : "lines " + refactoring.getStartLine() + "-" + refactoring.getEndLine();
        return colorize(ANSI_BLUE, refactoring.getType()) + " (" + lines + "): " + refactoring.getDescription();
    }

    /**
     * Creates a summary of diagnostics per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int totalErrors = 0;
        int totalWarnings = 0;
        int totalFatals = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, List<FormatterError>> bySeverity = groupBySeverity(errors);
            int fatals = bySeverity.getOrDefault(Severity.FATAL, List.of()).size();
            int errs = bySeverity.getOrDefault(Severity.ERROR, List.of()).size();
            int warnings = bySeverity.getOrDefault(Severity.WARNING, List.of()).size();

            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;

            sb.append(entry.getKey()).append(": ")
                    .append(counts(fatals, errs, warnings))
                    .append("\n");
        }

        sb.append("\nTotal: ").append(counts(totalFatals, totalErrors, totalWarnings));
        return sb.toString();
    }

    private String counts(int fatals, int errors, int warnings) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings")).append(", ");
        }
        if (sb.length() == 0) {
            return "none";
        }
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }

    /**
     * Groups errors by severity.
     */
    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
