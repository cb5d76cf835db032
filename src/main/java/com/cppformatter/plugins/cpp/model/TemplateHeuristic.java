package com.cppformatter.plugins.cpp.model;

import java.util.List;
import java.util.Set;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;

/**
 * Decides whether a {@code <} opens a template argument list. Without a
 * symbol table this is a guess: the {@code <} must follow {@code template},
 * a cast keyword or a plain identifier, and a bounded lookahead must find
 * its closing {@code >} before anything that cannot appear inside template
 * arguments.
 */
final class TemplateHeuristic {
    static final int LOOKAHEAD_LIMIT = 256;

    private static final Set<String> CAST_KEYWORDS = Set.of(
            "static_cast", "dynamic_cast", "const_cast", "reinterpret_cast");

    /** Tokens that end the search outright. */
    private static final Set<String> STOPPERS = Set.of(";", "{", "}", ">=", ">>=", "<=");

    /** Expression operators that cannot sit at the top level of an argument list after a plain identifier. */
    private static final Set<String> EXPRESSION_STOPPERS = Set.of("&&", "||", "=");

    private TemplateHeuristic() {
    }

    /**
     * @param significant  significant tokens of the unit
     * @param index        position of the {@code <} being decided
     * @param outerAngles  template scopes already open directly around it
     */
    static boolean opensTemplate(List<Token> significant, int index, int outerAngles) {
        if (index == 0) {
            return false;
        }
        Token previous = significant.get(index - 1);
        boolean afterTemplateKeyword = previous.isKeyword("template")
                || (previous.getKind() == TokenKind.KEYWORD && CAST_KEYWORDS.contains(previous.getText()));
        if (!afterTemplateKeyword && !previous.isIdentifier()) {
            return false;
        }
        return findsClose(significant, index, outerAngles, afterTemplateKeyword);
    }

    private static boolean findsClose(List<Token> significant, int index, int outerAngles, boolean lenient) {
        int depth = 1;
        int parens = 0;
        int limit = Math.min(significant.size(), index + 1 + LOOKAHEAD_LIMIT);
        for (int i = index + 1; i < limit; i++) {
            Token token = significant.get(i);
            if (token.isDirective()) {
                return false;
            }
            if (token.getKind() != TokenKind.PUNCTUATION) {
                continue;
            }
            String text = token.getText();
            if (STOPPERS.contains(text)) {
                return false;
            }
            if (text.equals("(") || text.equals("[")) {
                parens++;
            } else if (text.equals(")") || text.equals("]")) {
                if (parens == 0) {
                    return false;
                }
                parens--;
            } else if (parens > 0) {
                continue;
            } else if (!lenient && EXPRESSION_STOPPERS.contains(text)) {
                return false;
            } else if (text.equals("<")) {
                Token before = significant.get(i - 1);
                if (before.isIdentifier() || before.isKeyword("template")) {
                    depth++;
                }
            } else if (text.equals(">")) {
                depth--;
                if (depth == 0) {
                    return true;
                }
            } else if (text.equals(">>")) {
                if (depth == 1) {
                    return outerAngles + depth >= 2;
                }
                depth -= 2;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return false;
    }
}
