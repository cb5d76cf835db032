package com.cppformatter.plugins.cpp.transform;

import java.util.Collections;
import java.util.List;

import com.cppformatter.api.Refactoring;
import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * The rewritten token stream and the rewrites that produced it.
 */
public final class TransformResult {
    private final List<Token> tokens;
    private final List<Refactoring> refactorings;

    TransformResult(List<Token> tokens, List<Refactoring> refactorings) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.refactorings = Collections.unmodifiableList(refactorings);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<Refactoring> getRefactorings() {
        return refactorings;
    }
}
