package com.cppformatter.plugins.cpp.layout;

import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.lexer.Keywords;
import com.cppformatter.plugins.cpp.lexer.Punctuators;
import com.cppformatter.plugins.cpp.lexer.TabExpander;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;

/**
 * Chooses the whitespace between two adjacent tokens of a line. Owns the
 * {@code bindPointerToType}, {@code collapseTemplateCloseAngles} and
 * {@code convertTabsToSpaces} options.
 */
public class SpacingRules {
    private final boolean bindPointerToType;
    private final boolean collapseTemplateCloseAngles;
    private final boolean convertTabsToSpaces;

    public SpacingRules(FormatConfiguration configuration) {
        this.bindPointerToType = configuration.isBindPointerToType();
        this.collapseTemplateCloseAngles = configuration.isCollapseTemplateCloseAngles();
        this.convertTabsToSpaces = configuration.isConvertTabsToSpaces();
    }

    public boolean isConvertTabsToSpaces() {
        return convertTabsToSpaces;
    }

    /**
     * Whitespace to write between {@code left} and {@code right}.
     *
     * @param gap    the whitespace found between them in the input, or
     *               {@code null} when they were adjacent
     * @param column zero-based output column where the whitespace starts
     */
    public String separator(Token left, Token right, String gap, int column, TokenRoles roles) {
        if (right.isComment()) {
            if (gap == null) {
                return "";
            }
            return convertTabsToSpaces ? TabExpander.expand(gap, column) : gap;
        }
        String chosen = choose(left, right, gap != null, roles);
        if (chosen.isEmpty() && Punctuators.wouldJoin(left.getText(), right.getText())
                && !bothTemplateCloses(left, right, roles)) {
            return " ";
        }
        return chosen;
    }

    private String choose(Token left, Token right, boolean hadSpace, TokenRoles roles) {
        if (left.isComment()) {
            return hadSpace ? " " : "";
        }
        TokenRole leftRole = roles.roleOf(left);
        TokenRole rightRole = roles.roleOf(right);

        if (bothTemplateCloses(left, right, roles)) {
            return collapseTemplateCloseAngles ? "" : (hadSpace ? " " : "");
        }
        if (leftRole == TokenRole.BINARY_OPERATOR || rightRole == TokenRole.BINARY_OPERATOR) {
            return " ";
        }
        if (rightRole == TokenRole.POINTER_DECLARATOR) {
            if (leftRole == TokenRole.POINTER_DECLARATOR) {
                return "";
            }
            return bindPointerToType ? "" : " ";
        }
        if (leftRole == TokenRole.POINTER_DECLARATOR) {
            if (isDeclaratorTail(right)) {
                return "";
            }
            if (right.isIdentifier() || right.getKind() == TokenKind.KEYWORD) {
                return bindPointerToType ? " " : "";
            }
        }
        if (left.getKind() == TokenKind.KEYWORD && Keywords.CONTROL_WITH_CONDITION.contains(left.getText())
                && right.isPunctuation("(")) {
            return " ";
        }
        return hadSpace ? " " : "";
    }

    private static boolean isDeclaratorTail(Token token) {
        return token.isPunctuation(")") || token.isPunctuation(",") || token.isPunctuation("...")
                || token.isPunctuation(">") || token.isPunctuation(">>");
    }

    private static boolean bothTemplateCloses(Token left, Token right, TokenRoles roles) {
        return roles.roleOf(left) == TokenRole.TEMPLATE_CLOSE && roles.roleOf(right) == TokenRole.TEMPLATE_CLOSE;
    }
}
