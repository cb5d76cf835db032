package com.cppformatter.api.error;

/**
 * Kinds of diagnostics reported upward by the formatting pipeline.
 */
public enum DiagnosticKind {
    LEX_ERROR,
    UNBALANCED_SCOPE,
    UNWRAPPABLE_LINE,
    INTERNAL_ERROR
}
