package com.cppformatter.plugins.cpp.layout;

import java.util.Map;

import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * Layout computed for one line before it is committed.
 */
public final class LineLayout {
    private final int depth;
    private final int indent;
    private final boolean continuation;
    private final String rendered;
    private final Map<Token, Integer> columns;

    LineLayout(int depth, int indent, boolean continuation, String rendered, Map<Token, Integer> columns) {
        this.depth = depth;
        this.indent = indent;
        this.continuation = continuation;
        this.rendered = rendered;
        this.columns = columns;
    }

    public int getDepth() {
        return depth;
    }

    public int getIndent() {
        return indent;
    }

    public boolean isContinuation() {
        return continuation;
    }

    public String getRendered() {
        return rendered;
    }

    /**
     * Zero-based output column of a token of the line, or -1.
     */
    public int columnOf(Token token) {
        Integer column = columns.get(token);
        return column == null ? -1 : column;
    }

    /**
     * Column just after the token, for tokens on the line's first row.
     */
    public int endColumnOf(Token token) {
        int column = columnOf(token);
        return column < 0 ? -1 : column + token.getText().length();
    }

    /**
     * Rendered width including indentation.
     */
    public int width() {
        return rendered.isEmpty() ? 0 : indent + rendered.length();
    }
}
