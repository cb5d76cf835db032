package com.cppformatter.api.error;

/**
 * Unrecoverable failure of a formatting stage. The whole unit is rejected
 * and its input is left unmodified.
 */
public class FormatterException extends Exception {
    private final DiagnosticKind kind;
    private final int line;
    private final int column;

    public FormatterException(DiagnosticKind kind, String message, int line, int column) {
        super(message);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
