package com.cppformatter.plugins.cpp.layout;

/**
 * Syntactic role of an operator-like token, as far as spacing is concerned.
 */
public enum TokenRole {
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    /** {@code ++}/{@code --} after an operand. */
    POSTFIX_OPERATOR,
    /** {@code *}, {@code &} or {@code &&} in a declaration. */
    POINTER_DECLARATOR,
    TEMPLATE_OPEN,
    TEMPLATE_CLOSE,
    /** The symbol after the {@code operator} keyword. */
    OPERATOR_NAME,
    NONE
}
