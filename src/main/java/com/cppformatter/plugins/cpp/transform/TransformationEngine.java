package com.cppformatter.plugins.cpp.transform;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.cppformatter.api.Refactoring;
import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.classify.Classification;
import com.cppformatter.plugins.cpp.classify.ControlHeader;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;
import com.cppformatter.plugins.cpp.model.BraceType;
import com.cppformatter.plugins.cpp.model.Scope;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Rewrites the token stream: wraps unbraced control bodies in braces and
 * moves block braces onto their own lines. Only brace and line-break tokens
 * are added; whitespace next to a moved brace may be dropped; nothing else
 * is touched.
 */
public class TransformationEngine {
    private final boolean useAllmanBraces;

    public TransformationEngine(FormatConfiguration configuration) {
        this.useAllmanBraces = configuration.isUseAllmanBraces();
    }

    public TransformResult transform(StructuralModel model, Classification classification) {
        List<Refactoring> refactorings = new ArrayList<>();
        List<Token> stream = insertBraces(model, classification, refactorings);
        String eol = detectLineBreak(model.getTokens());
        List<Token> output = breakLines(model, classification, stream, eol, refactorings);
        return new TransformResult(output, refactorings);
    }

    /**
     * Adds a synthetic brace pair around every collected header body. Nested
     * bodies may end on the same token; the inner closer goes first.
     */
    private List<Token> insertBraces(StructuralModel model, Classification classification,
                                     List<Refactoring> refactorings) {
        Map<Token, List<Token>> before = new IdentityHashMap<>();
        Map<Token, List<Token>> after = new IdentityHashMap<>();
        List<Token> tokens = model.getTokens();
        Map<Token, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            positions.put(tokens.get(i), i);
        }

        for (ControlHeader header : classification.getHeaders()) {
            Token open = Token.synthetic(TokenKind.PUNCTUATION, "{", header.getBodyFirst());
            Token close = Token.synthetic(TokenKind.PUNCTUATION, "}", header.getBodyLast());

            Token headerEnd = header.getHeaderEnd();
            if (!useAllmanBraces && !followedByLineComment(tokens, positions.get(headerEnd))) {
                after.computeIfAbsent(headerEnd, k -> new ArrayList<>()).add(open);
            } else {
                before.computeIfAbsent(header.getBodyFirst(), k -> new ArrayList<>()).add(open);
            }

            Token closeAnchor = header.getBodyLast();
            int position = positions.get(closeAnchor);
            if (followedByLineComment(tokens, position)) {
                closeAnchor = nextNonWhitespace(tokens, position);
            }
            after.computeIfAbsent(closeAnchor, k -> new ArrayList<>()).add(0, close);

            refactorings.add(new Refactoring(Refactoring.BRACE_INSERTION,
                    header.getKeyword().getLine(), header.getBodyLast().getLine(),
                    "Added braces around the body of '" + header.getKeyword().getText() + "'"));
        }

        List<Token> stream = new ArrayList<>(tokens.size() + 2 * classification.getHeaders().size());
        for (Token token : tokens) {
            stream.addAll(before.getOrDefault(token, List.of()));
            stream.add(token);
            stream.addAll(after.getOrDefault(token, List.of()));
        }
        return stream;
    }

    private List<Token> breakLines(StructuralModel model, Classification classification, List<Token> stream,
                                   String eol, List<Refactoring> refactorings) {
        List<Token> out = new ArrayList<>(stream.size());
        boolean contentOnLine = false;

        for (int i = 0; i < stream.size(); i++) {
            Token token = stream.get(i);
            if (!isManagedBrace(token, model, classification)) {
                out.add(token);
                if (token.getKind() == TokenKind.NEWLINE) {
                    contentOnLine = false;
                } else if (token.getKind() != TokenKind.WHITESPACE) {
                    contentOnLine = true;
                }
                continue;
            }

            boolean opener = token.isPunctuation("{");
            boolean moved = false;
            if (contentOnLine) {
                trimTrailingWhitespace(out);
                if (opener && !useAllmanBraces) {
                    out.add(Token.synthetic(TokenKind.WHITESPACE, " ", token));
                } else {
                    out.add(Token.synthetic(TokenKind.NEWLINE, eol, token));
                    moved = true;
                }
            }
            out.add(token);
            contentOnLine = true;

            Token next = nextNonWhitespace(stream, i);
            if (opener ? keepsFollowingOnLine(next) : keepsFollowingAfterClose(token, next, model)) {
                if (!opener && !useAllmanBraces && next != null && next.isKeyword("else")) {
                    i = skipWhitespace(stream, i);
                    out.add(Token.synthetic(TokenKind.WHITESPACE, " ", token));
                }
            } else {
                i = skipWhitespace(stream, i);
                out.add(Token.synthetic(TokenKind.NEWLINE, eol, token));
                contentOnLine = false;
                moved = true;
            }

            if (moved && !token.isSynthetic()) {
                refactorings.add(new Refactoring(Refactoring.ALLMAN_BRACE, token.getLine(), token.getLine(),
                        "Moved '" + token.getText() + "' onto its own line"));
            }
        }
        return out;
    }

    /**
     * Synthetic braces are always placed; original ones only when the brace
     * style applies to them.
     */
    private boolean isManagedBrace(Token token, StructuralModel model, Classification classification) {
        if (!token.isPunctuation("{") && !token.isPunctuation("}")) {
            return false;
        }
        if (token.isSynthetic()) {
            return true;
        }
        return useAllmanBraces && model.scopeOf(token).isBlock() && !classification.isPreserved(token);
    }

    private static boolean keepsFollowingOnLine(Token next) {
        return next == null || next.getKind() == TokenKind.NEWLINE || next.getKind() == TokenKind.LINE_COMMENT;
    }

    private boolean keepsFollowingAfterClose(Token close, Token next, StructuralModel model) {
        if (next == null || next.getKind() == TokenKind.NEWLINE || next.isComment()) {
            return true;
        }
        if (next.isPunctuation(";") || next.isPunctuation(",") || next.isPunctuation(")") || next.isPunctuation("]")) {
            return true;
        }
        if (!close.isSynthetic()) {
            Scope scope = model.scopeOf(close);
            if (scope.getBraceType() == BraceType.TYPE_BODY) {
                return true;
            }
        }
        return close.isSynthetic() && !useAllmanBraces && next.isKeyword("else");
    }

    private static boolean followedByLineComment(List<Token> tokens, int position) {
        Token next = nextNonWhitespace(tokens, position);
        return next != null && next.getKind() == TokenKind.LINE_COMMENT;
    }

    private static Token nextNonWhitespace(List<Token> tokens, int position) {
        int index = skipWhitespace(tokens, position) + 1;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * Index of the last whitespace token directly after {@code position}, or
     * {@code position} itself when none follows.
     */
    private static int skipWhitespace(List<Token> tokens, int position) {
        int index = position;
        while (index + 1 < tokens.size() && tokens.get(index + 1).getKind() == TokenKind.WHITESPACE) {
            index++;
        }
        return index;
    }

    private static void trimTrailingWhitespace(List<Token> out) {
        while (!out.isEmpty() && out.get(out.size() - 1).getKind() == TokenKind.WHITESPACE) {
            out.remove(out.size() - 1);
        }
    }

    /**
     * The first line break of the input sets the convention; {@code \n}
     * when there is none.
     */
    static String detectLineBreak(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.getKind() == TokenKind.NEWLINE) {
                return token.getText();
            }
        }
        return "\n";
    }
}
