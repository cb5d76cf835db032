package com.cppformatter.plugins.cpp.lexer;

/**
 * A single lexical unit. Tokens are immutable and compared by identity, so
 * two tokens with the same text at the same position are still distinct.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int offset;
    private final int line;
    private final int column;
    private final int visualColumn;
    private final boolean synthetic;

    public Token(TokenKind kind, String text, int offset, int line, int column) {
        this(kind, text, offset, line, column, column - 1, false);
    }

    public Token(TokenKind kind, String text, int offset, int line, int column, int visualColumn) {
        this(kind, text, offset, line, column, visualColumn, false);
    }

    private Token(TokenKind kind, String text, int offset, int line, int column, int visualColumn,
                  boolean synthetic) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.visualColumn = visualColumn;
        this.synthetic = synthetic;
    }

    /**
     * Creates a token that has no counterpart in the input, positioned at the
     * given anchor so diagnostics still point somewhere meaningful.
     */
    public static Token synthetic(TokenKind kind, String text, Token anchor) {
        return new Token(kind, text, anchor.offset, anchor.line, anchor.column, anchor.visualColumn, true);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Zero-based column in the input with tabs expanded to
     * {@link TabExpander#TAB_WIDTH}-column stops.
     */
    public int getVisualColumn() {
        return visualColumn;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    /**
     * True for tokens that carry program meaning: everything except
     * whitespace, line breaks and comments.
     */
    public boolean isSignificant() {
        return !kind.isTrivia() && !kind.isComment();
    }

    public boolean isComment() {
        return kind.isComment();
    }

    public boolean isDirective() {
        return kind == TokenKind.PREPROCESSOR_DIRECTIVE;
    }

    public boolean isPunctuation(String value) {
        return kind == TokenKind.PUNCTUATION && text.equals(value);
    }

    public boolean isKeyword(String value) {
        return kind == TokenKind.KEYWORD && text.equals(value);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    /**
     * True when the token text itself contains a line break (block comments,
     * raw strings, continued directives).
     */
    public boolean spansLines() {
        return kind != TokenKind.NEWLINE && (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0);
    }

    @Override
    public String toString() {
        return kind + "(" + text.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
