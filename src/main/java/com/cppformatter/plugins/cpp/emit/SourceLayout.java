package com.cppformatter.plugins.cpp.emit;

import java.util.List;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;

/**
 * File-level properties of the input that the output reproduces: the line
 * break convention and the byte-order mark.
 */
public final class SourceLayout {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String lineBreak;
    private final boolean byteOrderMark;

    public SourceLayout(String lineBreak, boolean byteOrderMark) {
        this.lineBreak = lineBreak;
        this.byteOrderMark = byteOrderMark;
    }

    /**
     * The first line break of the input sets the convention; {@code \n}
     * when the input has none.
     */
    public static SourceLayout detect(String source, List<Token> tokens) {
        String lineBreak = "\n";
        for (Token token : tokens) {
            if (token.getKind() == TokenKind.NEWLINE) {
                lineBreak = token.getText();
                break;
            }
        }
        return new SourceLayout(lineBreak, !source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK);
    }

    public String getLineBreak() {
        return lineBreak;
    }

    public boolean hasByteOrderMark() {
        return byteOrderMark;
    }

    String byteOrderMark() {
        return byteOrderMark ? String.valueOf(BYTE_ORDER_MARK) : "";
    }
}
