package com.cppformatter.plugins.cpp.classify;

import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * A control statement whose body is a single unbraced statement.
 */
public final class ControlHeader {
    private final Token keyword;
    private final Token headerEnd;
    private final Token bodyFirst;
    private final Token bodyLast;
    private final boolean sameLine;

    public ControlHeader(Token keyword, Token headerEnd, Token bodyFirst, Token bodyLast, boolean sameLine) {
        this.keyword = keyword;
        this.headerEnd = headerEnd;
        this.bodyFirst = bodyFirst;
        this.bodyLast = bodyLast;
        this.sameLine = sameLine;
    }

    /** {@code if}, {@code for}, {@code while}, {@code switch} or {@code else}. */
    public Token getKeyword() {
        return keyword;
    }

    /**
     * The condition's closing parenthesis, or the {@code else} itself.
     */
    public Token getHeaderEnd() {
        return headerEnd;
    }

    public Token getBodyFirst() {
        return bodyFirst;
    }

    public Token getBodyLast() {
        return bodyLast;
    }

    /**
     * True when the body starts on the line that ends the header.
     */
    public boolean isSameLine() {
        return sameLine;
    }

    @Override
    public String toString() {
        return keyword.getText() + "@" + keyword.getLine() + " body " + bodyFirst.getLine() + "-" + bodyLast.getLine();
    }
}
