package com.cppformatter.plugins.cpp.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import com.cppformatter.api.error.LexException;

/**
 * Splits C/C++ source text into tokens, including whitespace runs and line
 * breaks, so the input can be rebuilt exactly from the token texts.
 * <p>
 * The lexer is a lazy, single-pass sequence: {@link #next()} produces one
 * token at a time and the sequence cannot be restarted. A leading byte-order
 * mark is skipped; it is not part of any token.
 */
public class Lexer {
    private static final Set<String> STRING_PREFIXES = Set.of("L", "u", "U", "u8");
    private static final Set<String> RAW_STRING_PREFIXES = Set.of("R", "LR", "uR", "UR", "u8R");
    private static final int MAX_RAW_DELIMITER = 16;

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;
    private int lineStart;
    private boolean atLineStart = true;

    public Lexer(String source) {
        this.source = source;
        this.pos = !source.isEmpty() && source.charAt(0) == '\uFEFF' ? 1 : 0;
        this.lineStart = pos;
    }

    /**
     * Convenience for callers that need the whole stream at once.
     */
    public static List<Token> tokenize(String source) throws LexException {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        while (lexer.hasNext()) {
            tokens.add(lexer.next());
        }
        return tokens;
    }

    public boolean hasNext() {
        return pos < source.length();
    }

    public Token next() throws LexException {
        if (!hasNext()) {
            throw new NoSuchElementException("End of input reached");
        }

        char c = source.charAt(pos);
        Token token;
        if (c == '\n' || c == '\r') {
            token = _lexNewline();
        } else if (isHorizontalSpace(c)) {
            token = _lexWhitespace();
        } else if (c == '#' && atLineStart) {
            token = _lexDirective();
        } else if (c == '/' && peek(1) == '/') {
            token = emit(TokenKind.LINE_COMMENT, scanLineComment(pos));
        } else if (c == '/' && peek(1) == '*') {
            token = emit(TokenKind.BLOCK_COMMENT, scanBlockComment(pos));
        } else if (c == '"') {
            token = emit(TokenKind.STRING_LITERAL, scanUserSuffix(scanQuoted(pos, '"', "string literal")));
        } else if (c == '\'') {
            token = emit(TokenKind.CHAR_LITERAL, scanUserSuffix(scanQuoted(pos, '\'', "character literal")));
        } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            token = emit(TokenKind.NUMERIC_LITERAL, scanNumber(pos));
        } else if (Punctuators.isWordChar(c)) {
            token = _lexWord();
        } else {
            String punct = Punctuators.match(source, pos);
            token = emit(TokenKind.PUNCTUATION, pos + punct.length());
        }

        if (token.getKind() == TokenKind.NEWLINE) {
            atLineStart = true;
        } else if (token.getKind() != TokenKind.WHITESPACE) {
            atLineStart = false;
        }
        return token;
    }

    private Token _lexNewline() {
        int end = pos + 1;
        if (source.charAt(pos) == '\r' && end < source.length() && source.charAt(end) == '\n') {
            end++;
        }
        return emit(TokenKind.NEWLINE, end);
    }

    private Token _lexWhitespace() {
        int end = pos;
        while (end < source.length() && isHorizontalSpace(source.charAt(end))) {
            end++;
        }
        return emit(TokenKind.WHITESPACE, end);
    }

    private Token _lexWord() throws LexException {
        int end = pos;
        while (end < source.length() && Punctuators.isWordChar(source.charAt(end))) {
            end++;
        }
        String word = source.substring(pos, end);
        char after = end < source.length() ? source.charAt(end) : '\0';

        if (after == '"' && RAW_STRING_PREFIXES.contains(word)) {
            return emit(TokenKind.STRING_LITERAL, scanUserSuffix(scanRawString(end)));
        }
        if (after == '"' && STRING_PREFIXES.contains(word)) {
            return emit(TokenKind.STRING_LITERAL, scanUserSuffix(scanQuoted(end, '"', "string literal")));
        }
        if (after == '\'' && STRING_PREFIXES.contains(word)) {
            return emit(TokenKind.CHAR_LITERAL, scanUserSuffix(scanQuoted(end, '\'', "character literal")));
        }
        return emit(Keywords.isKeyword(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, end);
    }

    /**
     * A directive runs to the end of its logical line: backslash-continued
     * lines and block comments opened on the line belong to it.
     */
    private Token _lexDirective() throws LexException {
        int end = pos + 1;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\n' || c == '\r') {
                if (!endsWithContinuation(end)) {
                    break;
                }
                end += (c == '\r' && end + 1 < source.length() && source.charAt(end + 1) == '\n') ? 2 : 1;
            } else if (c == '/' && end + 1 < source.length() && source.charAt(end + 1) == '*') {
                end = scanBlockComment(end);
            } else if (c == '/' && end + 1 < source.length() && source.charAt(end + 1) == '/') {
                end = scanLineComment(end);
            } else if (c == '"' || c == '\'') {
                end = scanLenientQuoted(end, c);
            } else {
                end++;
            }
        }
        return emit(TokenKind.PREPROCESSOR_DIRECTIVE, end);
    }

    private int scanLineComment(int start) {
        int end = start + 2;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\n' || c == '\r') {
                if (!endsWithContinuation(end)) {
                    break;
                }
                end += (c == '\r' && end + 1 < source.length() && source.charAt(end + 1) == '\n') ? 2 : 1;
            } else {
                end++;
            }
        }
        return end;
    }

    private int scanBlockComment(int start) throws LexException {
        int close = source.indexOf("*/", start + 2);
        if (close < 0) {
            throw unterminated("Unterminated block comment", start);
        }
        return close + 2;
    }

    private int scanQuoted(int start, char quote, String what) throws LexException {
        int end = start + 1;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\\') {
                end++;
                if (end < source.length() && source.charAt(end) == '\r'
                        && end + 1 < source.length() && source.charAt(end + 1) == '\n') {
                    end++;
                }
                end++;
            } else if (c == quote) {
                return end + 1;
            } else if (c == '\n' || c == '\r') {
                break;
            } else {
                end++;
            }
        }
        throw unterminated("Unterminated " + what, literalStart(start));
    }

    /**
     * Quotes inside directives ({@code #error don't}) need not be balanced.
     */
    private int scanLenientQuoted(int start, char quote) {
        int end = start + 1;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\\' && end + 1 < source.length() && source.charAt(end + 1) != '\n'
                    && source.charAt(end + 1) != '\r') {
                end += 2;
            } else if (c == quote) {
                return end + 1;
            } else if (c == '\n' || c == '\r') {
                return end;
            } else {
                end++;
            }
        }
        return end;
    }

    private int scanRawString(int quotePos) throws LexException {
        int open = source.indexOf('(', quotePos + 1);
        if (open < 0 || open - quotePos - 1 > MAX_RAW_DELIMITER) {
            throw unterminated("Malformed raw string literal", literalStart(quotePos));
        }
        String delimiter = source.substring(quotePos + 1, open);
        for (int i = 0; i < delimiter.length(); i++) {
            char c = delimiter.charAt(i);
            if (Character.isWhitespace(c) || c == '\\' || c == ')') {
                throw unterminated("Malformed raw string literal", literalStart(quotePos));
            }
        }
        String terminator = ")" + delimiter + "\"";
        int close = source.indexOf(terminator, open + 1);
        if (close < 0) {
            throw unterminated("Unterminated raw string literal", literalStart(quotePos));
        }
        return close + terminator.length();
    }

    private int scanNumber(int start) {
        int end = start;
        boolean hex = source.startsWith("0x", start) || source.startsWith("0X", start);
        while (end < source.length()) {
            char c = source.charAt(end);
            if (Punctuators.isWordChar(c) || c == '.') {
                end++;
            } else if (c == '\'' && end > start && Punctuators.isWordChar(source.charAt(end - 1))
                    && end + 1 < source.length() && Character.isLetterOrDigit(source.charAt(end + 1))) {
                end++;
            } else if ((c == '+' || c == '-') && isExponentMarker(source.charAt(end - 1), hex)) {
                end++;
            } else {
                break;
            }
        }
        return end;
    }

    private int scanUserSuffix(int end) {
        while (end < source.length() && Punctuators.isWordChar(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isExponentMarker(char c, boolean hex) {
        return hex ? (c == 'p' || c == 'P') : (c == 'e' || c == 'E');
    }

    /**
     * True when the line ending at {@code newlinePos} ends with a backslash,
     * optionally followed by blanks.
     */
    private boolean endsWithContinuation(int newlinePos) {
        int i = newlinePos - 1;
        while (i >= pos && isHorizontalSpace(source.charAt(i))) {
            i--;
        }
        return i >= pos && source.charAt(i) == '\\';
    }

    /**
     * Encoding prefixes belong to the literal, so errors point at them.
     */
    private int literalStart(int quotePos) {
        int start = quotePos;
        while (start > pos && Punctuators.isWordChar(source.charAt(start - 1))) {
            start--;
        }
        return start;
    }

    private LexException unterminated(String message, int start) {
        int[] position = positionOf(start);
        return new LexException(message, position[0], position[1]);
    }

    private int[] positionOf(int target) {
        int l = line;
        int c = column;
        for (int i = pos; i < target; i++) {
            char ch = source.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                l++;
                c = 1;
            } else if (ch != '\r') {
                c++;
            }
        }
        return new int[] {l, c};
    }

    private Token emit(TokenKind kind, int end) {
        String text = source.substring(pos, end);
        Token token = new Token(kind, text, pos, line, column, TabExpander.visualColumn(source, lineStart, pos));
        int lastBreak = Math.max(text.lastIndexOf('\n'), text.lastIndexOf('\r'));
        if (lastBreak >= 0) {
            lineStart = pos + lastBreak + 1;
        }
        int[] position = positionOf(end);
        line = position[0];
        column = position[1];
        pos = end;
        return token;
    }

    private char peek(int ahead) {
        int index = pos + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }
}
