package com.cppformatter.plugins.cpp.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;
import com.cppformatter.plugins.cpp.model.Line;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Finds control statements with unbraced bodies and braced blocks that fit
 * on their header's line. Marks the affected lines; tokens are not touched.
 */
public class StatementClassifier {
    private static final Set<String> CONVERTIBLE = Set.of("if", "for", "while", "switch");
    private static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "try", "catch");

    /**
     * Classifies the statements of a model. Header lines of converted
     * bodies and explicit one-line blocks are flagged on their {@link Line}.
     */
    public Classification classify(StructuralModel model) {
        List<Token> significant = model.getSignificantTokens();
        StatementExtent extent = new StatementExtent(model);
        List<ControlHeader> headers = new ArrayList<>();
        Set<Token> preserved = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<Token> doWhile = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean unresolvedDo = false;

        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);
            if (token.getKind() != TokenKind.KEYWORD) {
                continue;
            }
            String word = token.getText();
            int anchorIndex;
            if (word.equals("do")) {
                unresolvedDo |= !markDoWhile(extent, significant, i, doWhile);
                anchorIndex = i;
            } else if (word.equals("else")) {
                Token next = i + 1 < significant.size() ? significant.get(i + 1) : null;
                if (next != null && next.isKeyword("if")) {
                    continue;
                }
                anchorIndex = i;
            } else if (CONVERTIBLE.contains(word) && !doWhile.contains(token)) {
                anchorIndex = extent.conditionClose(i);
            } else {
                continue;
            }
            if (anchorIndex == StatementExtent.UNKNOWN || anchorIndex + 1 >= significant.size()) {
                continue;
            }

            Token anchor = significant.get(anchorIndex);
            Token bodyFirst = significant.get(anchorIndex + 1);
            if (bodyFirst.isPunctuation("{")) {
                if (isExplicitOneLineBlock(model, extent, anchor, bodyFirst)) {
                    preserved.add(bodyFirst);
                    preserved.add(model.matching(bodyFirst));
                    lineOf(model, anchor).markExplicitOneLineBlock();
                }
                continue;
            }
            if (word.equals("do") || !isConvertibleBodyStart(bodyFirst)) {
                continue;
            }
            // an empty-bodied while may be the tail of a do loop whose body could not be measured
            if (bodyFirst.isPunctuation(";") && word.equals("while") && unresolvedDo) {
                continue;
            }

            int bodyEnd = extent.statementEnd(anchorIndex + 1);
            if (bodyEnd == StatementExtent.UNKNOWN) {
                continue;
            }
            boolean sameLine = model.onSameLine(anchor, bodyFirst);
            headers.add(new ControlHeader(token, anchor, bodyFirst, significant.get(bodyEnd), sameLine));
            if (sameLine) {
                lineOf(model, anchor).markOneLineHeaderWithoutBraces();
            }
        }
        return new Classification(headers, preserved, doWhile);
    }

    private static boolean isConvertibleBodyStart(Token bodyFirst) {
        if (bodyFirst.isDirective() || bodyFirst.isKeyword("else")) {
            return false;
        }
        return !(bodyFirst.isPunctuation(")") || bodyFirst.isPunctuation("]") || bodyFirst.isPunctuation("}"));
    }

    /**
     * The {@code while} that closes a {@code do} loop is never a header.
     * Returns false when that {@code while} could not be located.
     */
    private static boolean markDoWhile(StatementExtent extent, List<Token> significant, int doIndex,
                                       Set<Token> doWhile) {
        int bodyEnd = extent.statementEnd(doIndex + 1);
        if (bodyEnd != StatementExtent.UNKNOWN && bodyEnd + 1 < significant.size()) {
            Token next = significant.get(bodyEnd + 1);
            if (next.isKeyword("while")) {
                doWhile.add(next);
                return true;
            }
        }
        return false;
    }

    /**
     * A braced body that opens and closes on the header's line and holds at
     * most one statement and no nested braces or control statements. Two or
     * more statements make the block an ordinary one, which the brace style
     * spreads over several lines.
     */
    private static boolean isExplicitOneLineBlock(StructuralModel model, StatementExtent extent,
                                                  Token anchor, Token open) {
        Token close = model.matching(open);
        if (close == null || !model.onSameLine(anchor, open) || !model.onSameLine(open, close)) {
            return false;
        }
        List<Token> significant = model.getSignificantTokens();
        int from = model.significantIndexOf(open) + 1;
        int to = extent.indexOfMatching(open);
        int statements = 0;
        int parens = 0;
        for (int i = from; i < to; i++) {
            Token token = significant.get(i);
            if (token.isPunctuation("{") || token.isDirective()) {
                return false;
            }
            if (token.getKind() == TokenKind.KEYWORD && CONTROL_KEYWORDS.contains(token.getText())) {
                return false;
            }
            if (token.isPunctuation("(") || token.isPunctuation("[")) {
                parens++;
            } else if (token.isPunctuation(")") || token.isPunctuation("]")) {
                parens--;
            } else if (token.isPunctuation(";") && parens == 0) {
                statements++;
            }
        }
        return statements <= 1;
    }

    private static Line lineOf(StructuralModel model, Token token) {
        return model.getLines().get(model.lineIndexOf(token));
    }
}
