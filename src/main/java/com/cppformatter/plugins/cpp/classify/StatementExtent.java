package com.cppformatter.plugins.cpp.classify;

import java.util.List;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Finds where a single statement ends, working on significant tokens only.
 * Nested control statements are followed up to {@link #MAX_DEPTH} levels;
 * deeper nesting, preprocessor directives and anything that looks like a
 * macro invocation without a semicolon make the scan give up.
 */
final class StatementExtent {
    static final int MAX_DEPTH = 32;

    /** Returned when the extent cannot be determined. */
    static final int UNKNOWN = -1;

    private final List<Token> significant;
    private final StructuralModel model;

    StatementExtent(StructuralModel model) {
        this.model = model;
        this.significant = model.getSignificantTokens();
    }

    /**
     * Index of the last token of the statement starting at {@code start}, or
     * {@link #UNKNOWN}.
     */
    int statementEnd(int start) {
        return statementEnd(start, 0);
    }

    private int statementEnd(int start, int depth) {
        if (depth > MAX_DEPTH || start < 0 || start >= significant.size()) {
            return UNKNOWN;
        }
        Token first = significant.get(start);
        if (first.isDirective()) {
            return UNKNOWN;
        }
        if (first.isPunctuation("{")) {
            return indexOfMatching(first);
        }
        if (first.isKeyword("if")) {
            return ifChainEnd(start, depth);
        }
        if (first.isKeyword("for") || first.isKeyword("while") || first.isKeyword("switch")) {
            int close = conditionClose(start);
            return close == UNKNOWN ? UNKNOWN : statementEnd(close + 1, depth + 1);
        }
        if (first.isKeyword("do")) {
            int end = doWhileEnd(start, depth);
            return end != UNKNOWN ? end : simpleEnd(start);
        }
        if (first.isKeyword("try")) {
            return tryEnd(start);
        }
        return simpleEnd(start);
    }

    /**
     * An {@code if} with all of its {@code else if} and {@code else} arms.
     */
    private int ifChainEnd(int start, int depth) {
        int current = start;
        while (true) {
            int close = conditionClose(current);
            if (close == UNKNOWN) {
                return UNKNOWN;
            }
            int bodyEnd = statementEnd(close + 1, depth + 1);
            if (bodyEnd == UNKNOWN) {
                return UNKNOWN;
            }
            Token next = tokenAt(bodyEnd + 1);
            if (next == null || !next.isKeyword("else")) {
                return bodyEnd;
            }
            Token afterElse = tokenAt(bodyEnd + 2);
            if (afterElse != null && afterElse.isKeyword("if")) {
                current = bodyEnd + 2;
            } else {
                return statementEnd(bodyEnd + 2, depth + 1);
            }
        }
    }

    private int doWhileEnd(int start, int depth) {
        int bodyEnd = statementEnd(start + 1, depth + 1);
        if (bodyEnd == UNKNOWN) {
            return UNKNOWN;
        }
        Token keyword = tokenAt(bodyEnd + 1);
        if (keyword == null || !keyword.isKeyword("while")) {
            return UNKNOWN;
        }
        int close = conditionClose(bodyEnd + 1);
        Token semicolon = tokenAt(close + 1);
        return close != UNKNOWN && semicolon != null && semicolon.isPunctuation(";") ? close + 1 : UNKNOWN;
    }

    private int tryEnd(int start) {
        Token block = tokenAt(start + 1);
        if (block == null || !block.isPunctuation("{")) {
            return UNKNOWN;
        }
        int end = indexOfMatching(block);
        while (end != UNKNOWN) {
            Token next = tokenAt(end + 1);
            if (next == null || !next.isKeyword("catch")) {
                return end;
            }
            int close = conditionClose(end + 1);
            Token handler = tokenAt(close + 1);
            if (close == UNKNOWN || handler == null || !handler.isPunctuation("{")) {
                return UNKNOWN;
            }
            end = indexOfMatching(handler);
        }
        return UNKNOWN;
    }

    /**
     * Scans to the terminating semicolon, stepping over bracketed groups.
     */
    int simpleEnd(int start) {
        int i = start;
        while (i < significant.size()) {
            Token token = significant.get(i);
            if (token.isDirective()) {
                return UNKNOWN;
            }
            if (token.isPunctuation(";")) {
                return i;
            }
            if (token.isPunctuation("(") || token.isPunctuation("[") || token.isPunctuation("{")) {
                int close = indexOfMatching(token);
                if (close == UNKNOWN) {
                    return UNKNOWN;
                }
                if (token.isPunctuation("(") && looksLikeMacroInvocation(close)) {
                    return UNKNOWN;
                }
                i = close + 1;
                continue;
            }
            if (token.isPunctuation(")") || token.isPunctuation("]") || token.isPunctuation("}")) {
                return UNKNOWN;
            }
            i++;
        }
        return UNKNOWN;
    }

    /**
     * {@code FOO(x)} followed by an identifier on a later line: a macro that
     * supplies its own semicolon, so the statement end is unknown.
     */
    private boolean looksLikeMacroInvocation(int closeIndex) {
        Token next = tokenAt(closeIndex + 1);
        return next != null && next.isIdentifier() && !model.onSameLine(significant.get(closeIndex), next);
    }

    /**
     * Index of the {@code )} closing the condition after a control keyword,
     * skipping {@code constexpr}.
     */
    int conditionClose(int keywordIndex) {
        int open = keywordIndex + 1;
        Token token = tokenAt(open);
        if (token != null && token.isKeyword("constexpr")) {
            token = tokenAt(++open);
        }
        if (token == null || !token.isPunctuation("(")) {
            return UNKNOWN;
        }
        return indexOfMatching(token);
    }

    int indexOfMatching(Token bracket) {
        Token partner = model.matching(bracket);
        return partner == null ? UNKNOWN : model.significantIndexOf(partner);
    }

    private Token tokenAt(int index) {
        return index >= 0 && index < significant.size() ? significant.get(index) : null;
    }
}
