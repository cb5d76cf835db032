package com.cppformatter.plugins.cpp.classify;

import com.cppformatter.api.error.FormatterException;
import com.cppformatter.plugins.cpp.lexer.Lexer;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.StructuralModel;
import com.cppformatter.plugins.cpp.model.StructuralModelBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @Test
    void findsUnbracedBodyOnTheHeaderLine() throws FormatterException {
        StructuralModel model = build("if (x) do_it();");
        Classification classification = classifier.classify(model);

        assertThat(classification.getHeaders()).hasSize(1);
        ControlHeader header = classification.getHeaders().get(0);
        assertThat(header.getKeyword().getText()).isEqualTo("if");
        assertThat(header.getHeaderEnd().getText()).isEqualTo(")");
        assertThat(header.getBodyFirst().getText()).isEqualTo("do_it");
        assertThat(header.getBodyLast().getText()).isEqualTo(";");
        assertThat(header.isSameLine()).isTrue();
        assertThat(model.getLines().get(0).isOneLineHeaderWithoutBraces()).isTrue();
    }

    @Test
    void bodyOnTheNextLineIsNotSameLine() throws FormatterException {
        StructuralModel model = build("while (n--)\n  step(n);");
        Classification classification = classifier.classify(model);

        assertThat(classification.getHeaders()).singleElement()
                .satisfies(h -> assertThat(h.isSameLine()).isFalse());
        assertThat(model.getLines().get(0).isOneLineHeaderWithoutBraces()).isFalse();
    }

    @Test
    void nestedBodyExtendsOverTheWholeInnerStatement() throws FormatterException {
        StructuralModel model = build("for (i = 0; i < n; i++) if (a[i]) return i; else continue;");
        Classification classification = classifier.classify(model);

        assertThat(classification.getHeaders()).extracting(h -> h.getKeyword().getText())
                .containsExactly("for", "if", "else");
        ControlHeader loop = classification.getHeaders().get(0);
        assertThat(loop.getBodyFirst().getText()).isEqualTo("if");
        assertThat(loop.getBodyLast().getText()).isEqualTo(";");
        assertThat(loop.getBodyLast()).isSameAs(classification.getHeaders().get(2).getBodyLast());
    }

    @Test
    void elseIfIsNotItsOwnHeader() throws FormatterException {
        Classification classification = classifier.classify(build("if (a) b(); else if (c) d();"));

        assertThat(classification.getHeaders()).extracting(h -> h.getKeyword().getText())
                .containsExactly("if", "if");
    }

    @Test
    void bracedBodiesAreNotHeaders() throws FormatterException {
        Classification classification = classifier.classify(build("if (x)\n{\n  y();\n}"));

        assertThat(classification.getHeaders()).isEmpty();
    }

    @Test
    void emptyStatementIsABody() throws FormatterException {
        Classification classification = classifier.classify(build("while (spin());\nfor (;;) ;"));

        assertThat(classification.getHeaders()).hasSize(2).allSatisfy(h -> {
            assertThat(h.getBodyFirst().getText()).isEqualTo(";");
            assertThat(h.getBodyLast()).isSameAs(h.getBodyFirst());
            assertThat(h.isSameLine()).isTrue();
        });
    }

    @Test
    void emptyWhileAfterUnmeasurableDoBodyIsLeftAlone() throws FormatterException {
        Classification classification = classifier.classify(build("do\n  CHECK(x)\nwhile (y);"));

        assertThat(classification.getHeaders()).isEmpty();
    }

    @Test
    void doWhileConditionIsNotAHeader() throws FormatterException {
        StructuralModel model = build("do x++; while (x < 3);");
        Classification classification = classifier.classify(model);

        Token loopWhile = model.getSignificantTokens().stream()
                .filter(t -> t.isKeyword("while")).findFirst().orElseThrow();
        assertThat(classification.isDoWhile(loopWhile)).isTrue();
        assertThat(classification.getHeaders()).isEmpty();
    }

    @Test
    void singleStatementBlockOnOneLineIsPreserved() throws FormatterException {
        StructuralModel model = build("if (x) { y(); }");
        Classification classification = classifier.classify(model);

        Token open = model.getSignificantTokens().stream()
                .filter(t -> t.isPunctuation("{")).findFirst().orElseThrow();
        assertThat(classification.isPreserved(open)).isTrue();
        assertThat(classification.isPreserved(model.matching(open))).isTrue();
        assertThat(model.getLines().get(0).isExplicitOneLineBlock()).isTrue();
    }

    @Test
    void twoStatementsOnOneLineAreNotPreserved() throws FormatterException {
        StructuralModel model = build("if (x) { y(); z(); }");
        Classification classification = classifier.classify(model);

        Token open = model.getSignificantTokens().stream()
                .filter(t -> t.isPunctuation("{")).findFirst().orElseThrow();
        assertThat(classification.isPreserved(open)).isFalse();
        assertThat(model.getLines().get(0).isExplicitOneLineBlock()).isFalse();
    }

    @Test
    void directiveInsideBodyStopsConversion() throws FormatterException {
        Classification classification = classifier.classify(build("if (x)\n#ifdef A\n  a();\n#endif\n"));

        assertThat(classification.getHeaders()).isEmpty();
    }

    @Test
    void macroWithoutSemicolonStopsConversion() throws FormatterException {
        Classification classification = classifier.classify(build("if (x)\n  CHECK(x)\nnext();"));

        assertThat(classification.getHeaders()).isEmpty();
    }

    private static StructuralModel build(String source) throws FormatterException {
        return StructuralModelBuilder.build(Lexer.tokenize(source));
    }
}
