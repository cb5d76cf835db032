package com.cppformatter.plugins.cpp.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * Tokens of one input unit together with the scope tree and the physical
 * lines they were split into. Built once by {@link StructuralModelBuilder};
 * read-only afterwards except for the per-line layout fields.
 */
public final class StructuralModel {
    private final List<Token> tokens;
    private final List<Token> significant;
    private final Map<Token, Integer> significantIndex;
    private final Map<Token, Scope> scopeOf;
    private final Map<Token, Token> matching;
    private final Set<Token> templateOpeners;
    private final Set<Token> templateClosers;
    private final Map<Token, Integer> directiveDepth;
    private final Scope root;
    private final Scope conditionalRoot;
    private final List<Line> lines;
    private final Map<Token, Integer> lineIndexOf;

    StructuralModel(List<Token> tokens,
                    List<Token> significant,
                    Map<Token, Integer> significantIndex,
                    Map<Token, Scope> scopeOf,
                    Map<Token, Token> matching,
                    Set<Token> templateOpeners,
                    Set<Token> templateClosers,
                    Map<Token, Integer> directiveDepth,
                    Scope root,
                    Scope conditionalRoot,
                    List<Line> lines,
                    Map<Token, Integer> lineIndexOf) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.significant = Collections.unmodifiableList(significant);
        this.significantIndex = significantIndex;
        this.scopeOf = scopeOf;
        this.matching = matching;
        this.templateOpeners = templateOpeners;
        this.templateClosers = templateClosers;
        this.directiveDepth = directiveDepth;
        this.root = root;
        this.conditionalRoot = conditionalRoot;
        this.lines = Collections.unmodifiableList(lines);
        this.lineIndexOf = lineIndexOf;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Tokens that are neither whitespace nor comments, in order.
     */
    public List<Token> getSignificantTokens() {
        return significant;
    }

    public Scope getRoot() {
        return root;
    }

    /**
     * Root of the separate tree of {@code #if}...{@code #endif} regions.
     */
    public Scope getConditionalRoot() {
        return conditionalRoot;
    }

    public List<Line> getLines() {
        return lines;
    }

    /**
     * Innermost scope of a token. Openers map to the scope they open and
     * closers to the scope they close.
     */
    public Scope scopeOf(Token token) {
        Scope scope = scopeOf.get(token);
        return scope != null ? scope : root;
    }

    /**
     * The scope a token sits in, treating a bracket as part of its
     * surroundings rather than of the group it delimits.
     */
    public Scope enclosingScope(Token token) {
        Scope scope = scopeOf(token);
        if (scope != root && (scope.getOpening() == token || scope.getClosing() == token)) {
            return scope.getParent();
        }
        return scope;
    }

    /**
     * The matching bracket of an opener or closer, or {@code null} when the
     * token is not a bracket or its partner sits in a discarded branch.
     */
    public Token matching(Token token) {
        return matching.get(token);
    }

    public boolean isTemplateOpen(Token token) {
        return templateOpeners.contains(token);
    }

    public boolean isTemplateClose(Token token) {
        return templateClosers.contains(token);
    }

    /**
     * Indent depth of a directive: the brace depth when only namespaces (and
     * linkage blocks) enclose it, otherwise zero.
     */
    public int directiveDepth(Token directive) {
        Integer depth = directiveDepth.get(directive);
        return depth == null ? 0 : depth;
    }

    /**
     * Brace depth used to indent a line starting with {@code first}. A line
     * starting with {@code }} sits at the depth after the close.
     */
    public int indentDepthOf(Token first) {
        if (first.isPunctuation("}")) {
            Scope closed = scopeOf(first);
            if (closed.getKind().isBraceLevel()) {
                return Math.max(0, closed.getBraceDepth() - 1);
            }
        }
        return enclosingScope(first).getBraceDepth();
    }

    public Token previousSignificant(Token token) {
        Integer index = significantIndex.get(token);
        if (index == null || index == 0) {
            return null;
        }
        return significant.get(index - 1);
    }

    /**
     * Position in {@link #getSignificantTokens()}, or -1 for trivia and comments.
     */
    public int significantIndexOf(Token token) {
        Integer index = significantIndex.get(token);
        return index == null ? -1 : index;
    }

    /**
     * Index into {@link #getLines()} of the line holding the token; a line
     * break belongs to the line it ends.
     */
    public int lineIndexOf(Token token) {
        Integer index = lineIndexOf.get(token);
        return index == null ? -1 : index;
    }

    public boolean onSameLine(Token a, Token b) {
        int first = lineIndexOf(a);
        return first >= 0 && first == lineIndexOf(b);
    }
}
