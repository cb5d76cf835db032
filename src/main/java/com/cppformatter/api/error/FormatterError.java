package com.cppformatter.api.error;

/**
 * Represents a diagnostic produced while formatting a unit.
 */
public class FormatterError {
    private final Severity severity;
    private final DiagnosticKind kind;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, DiagnosticKind kind, String message, int line, int column) {
        this(severity, kind, message, line, column, null);
    }

    public FormatterError(Severity severity, DiagnosticKind kind, String message, int line, int column,
                          String suggestion) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * Converts an unrecoverable pipeline failure into a fatal diagnostic.
     */
    public static FormatterError fatal(FormatterException e) {
        return new FormatterError(Severity.FATAL, e.getKind(), e.getMessage(), e.getLine(), e.getColumn());
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public DiagnosticKind getKind() { return kind; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return kind + " at " + line + ":" + column + ": " + message;
    }
}
