package com.cppformatter.plugins.cpp.layout;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cppformatter.plugins.cpp.lexer.Keywords;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;
import com.cppformatter.plugins.cpp.model.Scope;
import com.cppformatter.plugins.cpp.model.ScopeKind;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Assigns a {@link TokenRole} to every operator-like token of a model.
 * <p>
 * The decisive question is usually whether the previous token ends an
 * operand: {@code a - b} is binary, {@code = -b} is unary. For {@code *},
 * {@code &} and {@code &&} a declaration check runs first; it accepts a
 * name followed by another name only in positions where a declaration can
 * start, so {@code return a * b} stays a multiplication.
 */
public final class TokenRoles {
    private static final Set<String> ALWAYS_BINARY = Set.of(
            "=", "==", "!=", "<=", ">=", "<=>", "||", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "<<=", ">>=", "|", "^", "/", "%", "<<", ">>", "?");
    private static final Set<String> DECLARATOR_CANDIDATES = Set.of("*", "&", "&&");
    private static final Set<String> SIZE_OPERATORS = Set.of("sizeof", "alignof", "decltype", "typeid", "_Alignof");
    private static final Set<String> ACCESS_SPECIFIERS = Set.of("public", "protected", "private");

    private final StructuralModel model;
    private final List<Token> significant;
    private final Map<Token, TokenRole> roles = new IdentityHashMap<>();
    private final Map<Scope, Integer> pendingQuestions = new IdentityHashMap<>();

    private TokenRoles(StructuralModel model) {
        this.model = model;
        this.significant = model.getSignificantTokens();
    }

    public static TokenRoles of(StructuralModel model) {
        TokenRoles result = new TokenRoles(model);
        result.assignAll();
        return result;
    }

    public TokenRole roleOf(Token token) {
        return roles.getOrDefault(token, TokenRole.NONE);
    }

    public boolean isBinary(Token token) {
        return roleOf(token) == TokenRole.BINARY_OPERATOR;
    }

    private void assignAll() {
        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);
            if (token.getKind() != TokenKind.PUNCTUATION) {
                continue;
            }
            TokenRole role = assign(token, i);
            if (role != TokenRole.NONE) {
                roles.put(token, role);
            }
        }
    }

    private TokenRole assign(Token token, int index) {
        Token previous = index > 0 ? significant.get(index - 1) : null;
        String text = token.getText();

        if (model.isTemplateOpen(token)) {
            return TokenRole.TEMPLATE_OPEN;
        }
        if (model.isTemplateClose(token)) {
            return TokenRole.TEMPLATE_CLOSE;
        }
        if (previous != null && previous.isKeyword("operator")) {
            return TokenRole.OPERATOR_NAME;
        }
        if (text.equals("?")) {
            Scope scope = model.enclosingScope(token);
            pendingQuestions.merge(scope, 1, Integer::sum);
        }
        if (text.equals(":")) {
            Scope scope = model.enclosingScope(token);
            Integer pending = pendingQuestions.get(scope);
            if (pending != null && pending > 0) {
                pendingQuestions.put(scope, pending - 1);
                return TokenRole.BINARY_OPERATOR;
            }
            return TokenRole.NONE;
        }
        if (ALWAYS_BINARY.contains(text)) {
            return endsOperand(previous) ? TokenRole.BINARY_OPERATOR : TokenRole.NONE;
        }
        if (DECLARATOR_CANDIDATES.contains(text)) {
            if (isDeclarator(index)) {
                return TokenRole.POINTER_DECLARATOR;
            }
            return endsOperand(previous) ? TokenRole.BINARY_OPERATOR : TokenRole.UNARY_OPERATOR;
        }
        if (text.equals("+") || text.equals("-")) {
            return endsOperand(previous) ? TokenRole.BINARY_OPERATOR : TokenRole.UNARY_OPERATOR;
        }
        if (text.equals("<") || text.equals(">")) {
            return endsOperand(previous) ? TokenRole.BINARY_OPERATOR : TokenRole.NONE;
        }
        if (text.equals("++") || text.equals("--")) {
            return endsOperand(previous) ? TokenRole.POSTFIX_OPERATOR : TokenRole.UNARY_OPERATOR;
        }
        if (text.equals("!") || text.equals("~")) {
            return TokenRole.UNARY_OPERATOR;
        }
        return TokenRole.NONE;
    }

    /**
     * True when {@code token} can be the last token of an operand.
     */
    private boolean endsOperand(Token token) {
        if (token == null) {
            return false;
        }
        switch (token.getKind()) {
            case IDENTIFIER:
            case NUMERIC_LITERAL:
            case STRING_LITERAL:
            case CHAR_LITERAL:
                return true;
            case KEYWORD:
                return Keywords.VALUE_KEYWORDS.contains(token.getText());
            case PUNCTUATION:
                break;
            default:
                return false;
        }
        if (token.isPunctuation("]") || model.isTemplateClose(token)) {
            return true;
        }
        if (roleOf(token) == TokenRole.POSTFIX_OPERATOR) {
            return true;
        }
        if (token.isPunctuation(")")) {
            Scope group = model.scopeOf(token);
            return !group.isConditional() && !isCast(token);
        }
        return false;
    }

    /**
     * A parenthesized type: only type words, qualifiers, {@code ::} and
     * declarators, with a built-in type or qualifier present or a trailing
     * declarator, not directly after a name or {@code sizeof}.
     */
    private boolean isCast(Token close) {
        Token open = model.matching(close);
        if (open == null) {
            return false;
        }
        int from = model.significantIndexOf(open);
        int to = model.significantIndexOf(close);
        if (to - from < 2) {
            return false;
        }
        Token beforeOpen = from > 0 ? significant.get(from - 1) : null;
        if (beforeOpen != null && (beforeOpen.isIdentifier() || SIZE_OPERATORS.contains(beforeOpen.getText())
                || beforeOpen.isPunctuation(")") || beforeOpen.isPunctuation("]"))) {
            return false;
        }
        boolean typeWord = false;
        for (int i = from + 1; i < to; i++) {
            Token token = significant.get(i);
            String text = token.getText();
            if (token.getKind() == TokenKind.KEYWORD
                    && (Keywords.BUILTIN_TYPES.contains(text) || Keywords.QUALIFIERS.contains(text))) {
                typeWord = true;
            } else if (!token.isIdentifier() && !text.equals("*") && !text.equals("&") && !text.equals("::")
                    && !model.isTemplateOpen(token) && !model.isTemplateClose(token) && !text.equals(",")) {
                return false;
            }
        }
        String last = significant.get(to - 1).getText();
        return typeWord || last.equals("*") || last.equals("&");
    }

    private boolean isDeclarator(int index) {
        Token previous = index > 0 ? significant.get(index - 1) : null;
        Token next = index + 1 < significant.size() ? significant.get(index + 1) : null;
        if (previous == null) {
            return false;
        }
        if (next != null && isTypeLike(previous) && (next.isPunctuation(")") || next.isPunctuation(",")
                || next.isPunctuation("...") || model.isTemplateClose(next))) {
            return true;
        }
        if (previous.getKind() == TokenKind.KEYWORD && (Keywords.BUILTIN_TYPES.contains(previous.getText())
                || Keywords.QUALIFIERS.contains(previous.getText()))) {
            return true;
        }
        if (model.isTemplateClose(previous) || roleOf(previous) == TokenRole.POINTER_DECLARATOR) {
            return true;
        }
        if (!previous.isIdentifier() || next == null) {
            return false;
        }
        boolean declaratorFollows = next.isIdentifier() || next.isKeyword("operator")
                || (next.getKind() == TokenKind.KEYWORD && Keywords.QUALIFIERS.contains(next.getText()))
                || (next.getKind() == TokenKind.PUNCTUATION && DECLARATOR_CANDIDATES.contains(next.getText()));
        if (!declaratorFollows) {
            return false;
        }
        int chainStart = qualifiedNameStart(index - 1);
        return startsDeclaration(chainStart > 0 ? significant.get(chainStart - 1) : null);
    }

    private boolean isTypeLike(Token token) {
        if (token.isIdentifier() || model.isTemplateClose(token) || roleOf(token) == TokenRole.POINTER_DECLARATOR) {
            return true;
        }
        return token.getKind() == TokenKind.KEYWORD
                && (Keywords.BUILTIN_TYPES.contains(token.getText()) || Keywords.QUALIFIERS.contains(token.getText()));
    }

    /**
     * Index of the first token of a name such as {@code std::vector<int>::iterator}
     * that ends at {@code last}.
     */
    private int qualifiedNameStart(int last) {
        int start = last;
        while (start > 0 && significant.get(start - 1).isPunctuation("::")) {
            int before = start - 2;
            if (before < 0) {
                return start - 1;
            }
            Token token = significant.get(before);
            if (model.isTemplateClose(token)) {
                Token open = model.matching(token);
                int openIndex = open == null ? -1 : model.significantIndexOf(open);
                if (openIndex < 1 || !significant.get(openIndex - 1).isIdentifier()) {
                    return start - 1;
                }
                start = openIndex - 1;
            } else if (token.isIdentifier()) {
                start = before;
            } else {
                return start - 1;
            }
        }
        return start;
    }

    /**
     * True when a declaration may start right after {@code token}.
     */
    private boolean startsDeclaration(Token token) {
        if (token == null || token.isDirective() || token.isPunctuation(";")
                || token.isPunctuation("{") || token.isPunctuation("}")) {
            return true;
        }
        if (token.isPunctuation(":")) {
            Token before = model.previousSignificant(token);
            return before != null && ACCESS_SPECIFIERS.contains(before.getText());
        }
        if (token.getKind() == TokenKind.KEYWORD && Keywords.DECLARATION_SPECIFIERS.contains(token.getText())) {
            return true;
        }
        if (model.isTemplateOpen(token)) {
            return true;
        }
        if (model.isTemplateClose(token)) {
            Token open = model.matching(token);
            Token beforeOpen = open == null ? null : model.previousSignificant(open);
            return beforeOpen != null && beforeOpen.isKeyword("template");
        }
        if (token.isPunctuation(",")) {
            Scope scope = model.enclosingScope(token);
            if (scope.getKind() == ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
                return true;
            }
            return scope.getKind() == ScopeKind.PAREN_GROUP && isParameterList(scope.getOpening());
        }
        if (token.isPunctuation("(")) {
            return isParameterList(token);
        }
        return false;
    }

    /**
     * Parentheses of a function declarator, a range-for or a handler.
     */
    private boolean isParameterList(Token open) {
        if (!open.isPunctuation("(")) {
            return false;
        }
        int openIndex = model.significantIndexOf(open);
        if (openIndex < 1) {
            return false;
        }
        Token name = significant.get(openIndex - 1);
        if (name.isKeyword("for") || name.isKeyword("catch")) {
            return true;
        }
        if (!name.isIdentifier()) {
            return false;
        }
        int nameStart = qualifiedNameStart(openIndex - 1);
        if (nameStart > 0 && significant.get(nameStart - 1).isPunctuation("~")) {
            nameStart--;
        }
        Token beforeName = nameStart > 0 ? significant.get(nameStart - 1) : null;
        return beforeName != null && isTypeLike(beforeName);
    }
}
