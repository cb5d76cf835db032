package com.cppformatter.plugins.cpp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;

/**
 * One physical output line: its tokens without surrounding whitespace, the
 * classification flags, and the layout computed by the later stages.
 */
public class Line {
    private final List<Token> tokens;

    private boolean preprocessorLine;
    private boolean macroContinuation;
    private boolean commentOnlyAtColumnOne;
    private boolean oneLineHeaderWithoutBraces;
    private boolean explicitOneLineBlock;

    private int depth;
    private int indent;
    private boolean continuation;
    private String rendered = "";

    public Line(List<Token> rawTokens) {
        int start = 0;
        int end = rawTokens.size();
        while (start < end && rawTokens.get(start).getKind().isTrivia()) {
            start++;
        }
        while (end > start && rawTokens.get(end - 1).getKind().isTrivia()) {
            end--;
        }
        this.tokens = Collections.unmodifiableList(new ArrayList<>(rawTokens.subList(start, end)));

        if (!tokens.isEmpty()) {
            Token first = tokens.get(0);
            this.preprocessorLine = first.isDirective();
            this.macroContinuation = tokens.stream().anyMatch(t -> t.isDirective() && t.spansLines());
            this.commentOnlyAtColumnOne = first.getColumn() == 1
                    && tokens.stream().allMatch(t -> t.isComment() || t.getKind() == TokenKind.WHITESPACE);
        }
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Tokens without the whitespace runs between them.
     */
    public List<Token> getVisibleTokens() {
        List<Token> visible = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getKind() != TokenKind.WHITESPACE) {
                visible.add(token);
            }
        }
        return visible;
    }

    public boolean isBlank() {
        return tokens.isEmpty();
    }

    public Token first() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public boolean isCommentOnly() {
        return !tokens.isEmpty() && tokens.stream()
                .allMatch(t -> t.isComment() || t.getKind() == TokenKind.WHITESPACE);
    }

    public boolean hasMultiLineToken() {
        return tokens.stream().anyMatch(Token::spansLines);
    }

    /**
     * Source line of the first token, for diagnostics.
     */
    public int getSourceLine() {
        return tokens.isEmpty() ? 0 : tokens.get(0).getLine();
    }

    /**
     * Splits off the tokens after the given visible token. Returns the two
     * halves; the receiver is left untouched.
     */
    public List<Line> splitAfter(Token splitPoint) {
        int index = tokens.indexOf(splitPoint);
        if (index < 0 || index == tokens.size() - 1) {
            throw new IllegalArgumentException("Cannot split after " + splitPoint);
        }
        List<Line> halves = new ArrayList<>(2);
        halves.add(new Line(tokens.subList(0, index + 1)));
        halves.add(new Line(tokens.subList(index + 1, tokens.size())));
        return halves;
    }

    public boolean isPreprocessorLine() {
        return preprocessorLine;
    }

    public boolean isMacroContinuation() {
        return macroContinuation;
    }

    public boolean isCommentOnlyAtColumnOne() {
        return commentOnlyAtColumnOne;
    }

    public boolean isOneLineHeaderWithoutBraces() {
        return oneLineHeaderWithoutBraces;
    }

    public void markOneLineHeaderWithoutBraces() {
        this.oneLineHeaderWithoutBraces = true;
    }

    public boolean isExplicitOneLineBlock() {
        return explicitOneLineBlock;
    }

    public void markExplicitOneLineBlock() {
        this.explicitOneLineBlock = true;
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
     * Records the layout chosen for this line.
     */
    public void layout(int depth, int indent, boolean continuation, String rendered) {
        this.depth = depth;
        this.indent = indent;
        this.continuation = continuation;
        this.rendered = rendered;
    }

    /**
     * Rendered width including indentation, for single-line content.
     */
    public int width() {
        return rendered.isEmpty() ? 0 : indent + rendered.length();
    }

    @Override
    public String toString() {
        return " ".repeat(indent) + rendered;
    }
}
