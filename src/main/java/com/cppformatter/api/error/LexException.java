package com.cppformatter.api.error;

/**
 * Thrown by the lexer for an unterminated literal or block comment.
 * The position is the start of the offending construct.
 */
public class LexException extends FormatterException {

    public LexException(String message, int line, int column) {
        super(DiagnosticKind.LEX_ERROR, message + " (started at line " + line + ", column " + column + ")",
                line, column);
    }
}
