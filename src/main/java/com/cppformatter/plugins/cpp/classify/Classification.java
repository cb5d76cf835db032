package com.cppformatter.plugins.cpp.classify;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * What the classifier found: headers whose bodies get braces, and braced
 * one-line blocks that must stay on one line.
 */
public final class Classification {
    private final List<ControlHeader> headers;
    private final Set<Token> preservedBraces;
    private final Set<Token> doWhileKeywords;

    Classification(List<ControlHeader> headers, Set<Token> preservedBraces, Set<Token> doWhileKeywords) {
        this.headers = Collections.unmodifiableList(headers);
        this.preservedBraces = Collections.unmodifiableSet(preservedBraces);
        this.doWhileKeywords = Collections.unmodifiableSet(doWhileKeywords);
    }

    /** In document order of their keywords. */
    public List<ControlHeader> getHeaders() {
        return headers;
    }

    /**
     * True for both braces of an explicit one-line block.
     */
    public boolean isPreserved(Token brace) {
        return preservedBraces.contains(brace);
    }

    public boolean isDoWhile(Token whileKeyword) {
        return doWhileKeywords.contains(whileKeyword);
    }
}
