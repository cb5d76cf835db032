package com.cppformatter.plugins.cpp.lexer;

import com.cppformatter.api.error.DiagnosticKind;
import com.cppformatter.api.error.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest {

    @Test
    void tokenTextsRebuildTheInput() throws LexException {
        String source = "int main() {\n\treturn a<<2; // done\n}\r\n/* tail */";
        List<Token> tokens = Lexer.tokenize(source);

        String rebuilt = tokens.stream().map(Token::getText).collect(Collectors.joining());
        assertThat(rebuilt).isEqualTo(source);
    }

    @Test
    void classifiesWordsNumbersAndPunctuation() throws LexException {
        List<Token> tokens = visible("unsigned count = 0x1F + 1.5e-3;");

        assertThat(tokens).extracting(Token::getKind).containsExactly(
                TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.PUNCTUATION, TokenKind.NUMERIC_LITERAL,
                TokenKind.PUNCTUATION, TokenKind.NUMERIC_LITERAL, TokenKind.PUNCTUATION);
        assertThat(tokens.get(5).getText()).isEqualTo("1.5e-3");
    }

    @Test
    void bracesInsideLiteralsAndCommentsAreNotPunctuation() throws LexException {
        List<Token> tokens = visible("s = \"{ }\"; c = '}'; /* { */ // }");

        assertThat(tokens).filteredOn(t -> t.isPunctuation("{") || t.isPunctuation("}")).isEmpty();
        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(6).getKind()).isEqualTo(TokenKind.CHAR_LITERAL);
    }

    @Test
    void directiveWithContinuationIsOneToken() throws LexException {
        List<Token> tokens = Lexer.tokenize("#define MAX(a, b) \\\n  ((a) > (b) ? (a) : (b))\nint x;");

        Token directive = tokens.get(0);
        assertThat(directive.getKind()).isEqualTo(TokenKind.PREPROCESSOR_DIRECTIVE);
        assertThat(directive.getText()).isEqualTo("#define MAX(a, b) \\\n  ((a) > (b) ? (a) : (b))");
        assertThat(directive.spansLines()).isTrue();
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.NEWLINE);
        assertThat(tokens.get(2).getLine()).isEqualTo(3);
    }

    @Test
    void hashInsideExpressionIsNotADirective() throws LexException {
        List<Token> tokens = visible("x = a # b;");

        assertThat(tokens).noneMatch(Token::isDirective);
    }

    @Test
    void indentedDirectiveIsRecognized() throws LexException {
        List<Token> tokens = visible("  #  ifdef DEBUG\n#endif");

        assertThat(tokens).hasSize(2).allMatch(Token::isDirective);
    }

    @Test
    void rawStringMayContainQuotesAndLineBreaks() throws LexException {
        List<Token> tokens = visible("auto s = R\"x(a \"quoted\"\n)\" text)x\";");

        Token literal = tokens.get(3);
        assertThat(literal.getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(literal.getText()).isEqualTo("R\"x(a \"quoted\"\n)\" text)x\"");
        assertThat(tokens.get(4).isPunctuation(";")).isTrue();
    }

    @Test
    void encodingPrefixBelongsToTheLiteral() throws LexException {
        List<Token> tokens = visible("auto w = L\"wide\"; auto c = u8'a';");

        assertThat(tokens.get(3).getText()).isEqualTo("L\"wide\"");
        assertThat(tokens.get(8).getText()).isEqualTo("u8'a'");
    }

    @Test
    void digitSeparatorsStayInsideTheNumber() throws LexException {
        List<Token> tokens = visible("n = 1'000'000;");

        assertThat(tokens.get(2).getText()).isEqualTo("1'000'000");
    }

    @Test
    void longestPunctuatorWins() throws LexException {
        List<Token> tokens = visible("a <<= b->c ... d <=> e");

        assertThat(tokens).extracting(Token::getText)
                .containsExactly("a", "<<=", "b", "->", "c", "...", "d", "<=>", "e");
    }

    @Test
    void tracksLineAndColumn() throws LexException {
        List<Token> tokens = visible("int a;\n  int b;");

        Token b = tokens.get(4);
        assertThat(b.getText()).isEqualTo("b");
        assertThat(b.getLine()).isEqualTo(2);
        assertThat(b.getColumn()).isEqualTo(7);
    }

    @Test
    void visualColumnExpandsTabs() throws LexException {
        List<Token> tokens = visible("\tint\tx;");

        assertThat(tokens.get(0).getColumn()).isEqualTo(2);
        assertThat(tokens.get(0).getVisualColumn()).isEqualTo(8);
        assertThat(tokens.get(1).getVisualColumn()).isEqualTo(16);
    }

    @Test
    void byteOrderMarkIsSkipped() throws LexException {
        List<Token> tokens = Lexer.tokenize("\uFEFFint x;");

        assertThat(tokens.get(0).getText()).isEqualTo("int");
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
        assertThat(tokens.get(0).getVisualColumn()).isZero();
    }

    @Test
    void crlfIsOneNewlineToken() throws LexException {
        List<Token> tokens = Lexer.tokenize("a;\r\nb;");

        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.NEWLINE)
                .extracting(Token::getText).containsExactly("\r\n");
        assertThat(tokens.get(tokens.size() - 2).getLine()).isEqualTo(2);
    }

    @Test
    void producesTokensLazily() throws LexException {
        Lexer lexer = new Lexer("a b");

        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.next().getText()).isEqualTo("a");
        assertThat(lexer.next().getKind()).isEqualTo(TokenKind.WHITESPACE);
        assertThat(lexer.next().getText()).isEqualTo("b");
        assertThat(lexer.hasNext()).isFalse();
    }

    @Test
    void unterminatedStringReportsItsStart() {
        assertThatThrownBy(() -> Lexer.tokenize("int a;\nchar *s = \"abc;\n"))
                .isInstanceOf(LexException.class)
                .satisfies(e -> {
                    LexException lex = (LexException) e;
                    assertThat(lex.getKind()).isEqualTo(DiagnosticKind.LEX_ERROR);
                    assertThat(lex.getLine()).isEqualTo(2);
                    assertThat(lex.getColumn()).isEqualTo(11);
                });
    }

    @Test
    void unterminatedBlockCommentReportsItsStart() {
        assertThatThrownBy(() -> Lexer.tokenize("x;  /* never closed\nstill comment"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("Unterminated block comment")
                .satisfies(e -> assertThat(((LexException) e).getColumn()).isEqualTo(5));
    }

    @Test
    void unterminatedCharLiteral() {
        assertThatThrownBy(() -> Lexer.tokenize("c = 'a;"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("character literal");
    }

    @Test
    void unbalancedQuoteInsideDirectiveIsAccepted() throws LexException {
        List<Token> tokens = visible("#error don't do this\nint x;");

        assertThat(tokens.get(0).getText()).isEqualTo("#error don't do this");
        assertThat(tokens.get(1).getText()).isEqualTo("int");
    }

    private static List<Token> visible(String source) throws LexException {
        return Lexer.tokenize(source).stream()
                .filter(t -> !t.getKind().isTrivia())
                .collect(Collectors.toList());
    }
}
