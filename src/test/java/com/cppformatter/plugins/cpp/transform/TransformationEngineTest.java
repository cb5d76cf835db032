package com.cppformatter.plugins.cpp.transform;

import com.cppformatter.api.Refactoring;
import com.cppformatter.api.error.FormatterException;
import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.classify.StatementClassifier;
import com.cppformatter.plugins.cpp.lexer.Lexer;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.StructuralModel;
import com.cppformatter.plugins.cpp.model.StructuralModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TransformationEngineTest {

    private static final FormatConfiguration ALLMAN = FormatConfiguration.defaults();
    private static final FormatConfiguration ATTACHED = FormatConfiguration.builder().useAllmanBraces(false).build();

    @Test
    void wrapsUnbracedBodyInBraces() throws FormatterException {
        TransformResult result = transform("if (x) y();", ALLMAN);

        assertThat(text(result)).isEqualTo("if (x)\n{\ny();\n}");
        assertThat(result.getRefactorings()).singleElement().satisfies(r -> {
            assertThat(r.getType()).isEqualTo(Refactoring.BRACE_INSERTION);
            assertThat(r.getStartLine()).isEqualTo(1);
        });
        assertThat(result.getTokens()).filteredOn(Token::isSynthetic)
                .extracting(Token::getText).contains("{", "}");
    }

    @Test
    void movesOpeningBraceOntoItsOwnLine() throws FormatterException {
        TransformResult result = transform("void f() {\n  g();\n}", ALLMAN);

        assertThat(text(result)).isEqualTo("void f()\n{\n  g();\n}");
        assertThat(result.getRefactorings()).extracting(Refactoring::getType)
                .containsExactly(Refactoring.ALLMAN_BRACE);
    }

    @Test
    void typeBodyKeepsItsSemicolon() throws FormatterException {
        TransformResult result = transform("struct S { int x; };", ALLMAN);

        assertThat(text(result)).isEqualTo("struct S\n{\nint x;\n};");
    }

    @Test
    void explicitOneLineBlockIsLeftAlone() throws FormatterException {
        TransformResult result = transform("if (x) { y(); }", ALLMAN);

        assertThat(text(result)).isEqualTo("if (x) { y(); }");
        assertThat(result.getRefactorings()).isEmpty();
    }

    @Test
    void initializerBracesStayInline() throws FormatterException {
        TransformResult result = transform("int a[] = { 1, 2 };", ALLMAN);

        assertThat(text(result)).isEqualTo("int a[] = { 1, 2 };");
    }

    @Test
    void attachedStyleOpensOnTheHeaderLine() throws FormatterException {
        TransformResult result = transform("if (x) y();", ATTACHED);

        assertThat(text(result)).isEqualTo("if (x) {\ny();\n}");
    }

    @Test
    void attachedStyleLeavesExistingBracesWhereTheyAre() throws FormatterException {
        TransformResult result = transform("void f() {\n  g();\n}", ATTACHED);

        assertThat(text(result)).isEqualTo("void f() {\n  g();\n}");
    }

    @Test
    void closingBraceGoesAfterTrailingLineComment() throws FormatterException {
        TransformResult result = transform("if (x) y(); // note\nz();", ALLMAN);

        assertThat(text(result)).isEqualTo("if (x)\n{\ny(); // note\n}\nz();");
    }

    @Test
    void insertedLineBreaksFollowTheInputConvention() throws FormatterException {
        TransformResult result = transform("if (x)\r\n  y();\r\n", ALLMAN);

        assertThat(text(result)).isEqualTo("if (x)\r\n  {\r\ny();\r\n}\r\n");
    }

    @Test
    void detectsLineBreakFromFirstNewline() throws FormatterException {
        assertThat(TransformationEngine.detectLineBreak(Lexer.tokenize("a;\r\nb;\n"))).isEqualTo("\r\n");
        assertThat(TransformationEngine.detectLineBreak(Lexer.tokenize("a;"))).isEqualTo("\n");
    }

    private static TransformResult transform(String source, FormatConfiguration configuration)
            throws FormatterException {
        StructuralModel model = StructuralModelBuilder.build(Lexer.tokenize(source));
        return new TransformationEngine(configuration).transform(model, new StatementClassifier().classify(model));
    }

    private static String text(TransformResult result) {
        return result.getTokens().stream().map(Token::getText).collect(Collectors.joining());
    }
}
