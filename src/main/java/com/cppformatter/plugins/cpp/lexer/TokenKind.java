package com.cppformatter.plugins.cpp.lexer;

/**
 * Lexical categories of C/C++ source text.
 */
public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    PUNCTUATION,
    STRING_LITERAL,
    CHAR_LITERAL,
    NUMERIC_LITERAL,
    LINE_COMMENT,
    BLOCK_COMMENT,
    PREPROCESSOR_DIRECTIVE,
    WHITESPACE,
    NEWLINE;

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE;
    }
}
