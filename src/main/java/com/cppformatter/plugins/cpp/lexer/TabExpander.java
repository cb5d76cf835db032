package com.cppformatter.plugins.cpp.lexer;

/**
 * Column arithmetic with tab stops every {@value #TAB_WIDTH} columns.
 * Columns are zero-based here.
 */
public final class TabExpander {
    public static final int TAB_WIDTH = 8;

    private TabExpander() {
    }

    public static int nextStop(int column) {
        return (column / TAB_WIDTH + 1) * TAB_WIDTH;
    }

    /**
     * Column reached after writing {@code text[from, to)} starting at column 0.
     */
    public static int visualColumn(CharSequence text, int from, int to) {
        int column = 0;
        for (int i = from; i < to; i++) {
            column = text.charAt(i) == '\t' ? nextStop(column) : column + 1;
        }
        return column;
    }

    /**
     * Replaces every tab with the spaces that reach the next stop, for text
     * that starts at {@code startColumn}.
     */
    public static String expand(String text, int startColumn) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + 8);
        int column = startColumn;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int stop = nextStop(column);
                out.append(" ".repeat(stop - column));
                column = stop;
            } else {
                out.append(c);
                column++;
            }
        }
        return out.toString();
    }

    /**
     * Like {@link #expand} but leaves tabs inside string and character
     * literals alone.
     */
    public static String expandOutsideLiterals(String text, int startColumn) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + 8);
        int column = startColumn;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(c).append(text.charAt(++i));
                    column += 2;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '\t') {
                int stop = nextStop(column);
                out.append(" ".repeat(stop - column));
                column = stop;
                continue;
            }
            out.append(c);
            column++;
        }
        return out.toString();
    }

    /**
     * True when a line break of {@code text} falls inside a string or
     * character literal.
     */
    public static boolean literalSpansBreak(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    i++;
                    if (text.charAt(i) == '\n' || text.charAt(i) == '\r') {
                        return true;
                    }
                } else if (c == quote) {
                    quote = 0;
                } else if (c == '\n' || c == '\r') {
                    quote = 0;
                }
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                if (close < 0) {
                    return false;
                }
                i = close + 1;
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                return false;
            } else if (c == '"' || c == '\'') {
                quote = c;
            }
        }
        return false;
    }
}
