package com.cppformatter.plugins.cpp.lexer;

import java.util.List;

/**
 * Multi-character operators and separators, matched longest first.
 */
public final class Punctuators {

    private static final List<String> MULTI_CHAR = List.of(
            "<=>", "->*", "<<=", ">>=", "...",
            "::", "->", ".*", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "##");

    private Punctuators() {
    }

    /**
     * Returns the longest punctuator starting at {@code pos}; unknown
     * characters come back as a one-character token.
     */
    public static String match(CharSequence source, int pos) {
        for (String candidate : MULTI_CHAR) {
            if (regionMatches(source, pos, candidate)) {
                return candidate;
            }
        }
        return String.valueOf(source.charAt(pos));
    }

    /**
     * True when writing {@code left} and {@code right} with nothing in between
     * would be read back as a different token sequence.
     */
    public static boolean wouldJoin(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        char last = left.charAt(left.length() - 1);
        char first = right.charAt(0);
        if (isWordChar(last) && (isWordChar(first) || first == '\'' || first == '"')) {
            return true;
        }
        if (Character.isDigit(last) && first == '.') {
            return true;
        }
        if (last == '/' && (first == '/' || first == '*')) {
            return true;
        }
        if (isWordChar(last) || isWordChar(first)) {
            return last == '.' && Character.isDigit(first);
        }
        String joined = left + right;
        int tail = Math.max(0, left.length() - 2);
        for (int start = tail; start < left.length(); start++) {
            String match = match(joined, start);
            if (start + match.length() > left.length()) {
                return true;
            }
        }
        return false;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean regionMatches(CharSequence source, int pos, String candidate) {
        if (pos + candidate.length() > source.length()) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            if (source.charAt(pos + i) != candidate.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
