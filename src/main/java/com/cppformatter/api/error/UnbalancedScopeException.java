package com.cppformatter.api.error;

/**
 * Thrown when braces, parentheses or preprocessor conditionals do not pair up.
 */
public class UnbalancedScopeException extends FormatterException {

    public UnbalancedScopeException(String message, int line, int column) {
        super(DiagnosticKind.UNBALANCED_SCOPE, message + " at line " + line + ", column " + column,
                line, column);
    }
}
