package com.cppformatter.plugins.cpp.model;

import com.cppformatter.api.error.DiagnosticKind;
import com.cppformatter.api.error.FormatterException;
import com.cppformatter.api.error.UnbalancedScopeException;
import com.cppformatter.plugins.cpp.lexer.Lexer;
import com.cppformatter.plugins.cpp.lexer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuralModelBuilderTest {

    @Test
    void buildsNestedScopeTree() throws FormatterException {
        StructuralModel model = build("namespace app { void run() { go(1); } }");

        Scope namespace = model.getRoot().getChildren().get(0);
        assertThat(namespace.getKind()).isEqualTo(ScopeKind.NAMESPACE);
        assertThat(namespace.getBraceDepth()).isEqualTo(1);

        Scope parameters = namespace.getChildren().get(0);
        assertThat(parameters.getKind()).isEqualTo(ScopeKind.PAREN_GROUP);

        Scope body = namespace.getChildren().get(1);
        assertThat(body.getKind()).isEqualTo(ScopeKind.BRACE);
        assertThat(body.getBraceType()).isEqualTo(BraceType.STATEMENT_BLOCK);
        assertThat(body.getBraceDepth()).isEqualTo(2);
        assertThat(body.getParent()).isSameAs(namespace);
        assertThat(body.getClosing()).isNotNull();
    }

    @Test
    void externLinkageBlockActsLikeANamespace() throws FormatterException {
        StructuralModel model = build("extern \"C\" { int f(void); }");

        assertThat(model.getRoot().getChildren().get(0).getKind()).isEqualTo(ScopeKind.NAMESPACE);
    }

    @Test
    void classifiesBraces() throws FormatterException {
        StructuralModel model = build("struct P { int x; };\nint a[] = {1, 2};\nvoid f() { auto g = [] { return 1; }; }");

        List<Scope> top = model.getRoot().getChildren();
        assertThat(top.get(0).getBraceType()).isEqualTo(BraceType.TYPE_BODY);
        assertThat(top).filteredOn(s -> s.getKind() == ScopeKind.BRACE)
                .extracting(Scope::getBraceType)
                .containsExactly(BraceType.TYPE_BODY, BraceType.INITIALIZER, BraceType.STATEMENT_BLOCK);

        Scope function = top.get(top.size() - 1);
        Scope lambda = function.getChildren().stream()
                .filter(s -> s.getKind() == ScopeKind.BRACE)
                .findFirst().orElseThrow();
        assertThat(lambda.getBraceType()).isEqualTo(BraceType.INITIALIZER);
        assertThat(lambda.isBlock()).isFalse();
    }

    @Test
    void conditionParenthesesAreMarked() throws FormatterException {
        StructuralModel model = build("if (a) f(b);");

        List<Scope> groups = model.getRoot().getChildren();
        assertThat(groups.get(0).isConditional()).isTrue();
        assertThat(groups.get(1).isConditional()).isFalse();
    }

    @Test
    void recognizesNestedTemplateArguments() throws FormatterException {
        StructuralModel model = build("std::map<int, std::vector<int>> m;");
        List<Token> significant = model.getSignificantTokens();

        Token outer = find(significant, "<", 0);
        Token inner = find(significant, "<", 1);
        Token close = find(significant, ">>", 0);
        assertThat(model.isTemplateOpen(outer)).isTrue();
        assertThat(model.isTemplateOpen(inner)).isTrue();
        assertThat(model.isTemplateClose(close)).isTrue();
        assertThat(model.matching(outer)).isSameAs(close);
    }

    @Test
    void spacedTemplateClosesAreTwoScopes() throws FormatterException {
        StructuralModel model = build("vector<vector<int> > v;");
        List<Token> significant = model.getSignificantTokens();

        assertThat(model.isTemplateClose(find(significant, ">", 0))).isTrue();
        assertThat(model.isTemplateClose(find(significant, ">", 1))).isTrue();
    }

    @Test
    void comparisonsAreNotTemplates() throws FormatterException {
        StructuralModel model = build("if (a < b && c > d) x = y >> 2;");
        List<Token> significant = model.getSignificantTokens();

        assertThat(model.isTemplateOpen(find(significant, "<", 0))).isFalse();
        assertThat(model.isTemplateClose(find(significant, ">", 0))).isFalse();
        assertThat(model.isTemplateClose(find(significant, ">>", 0))).isFalse();
    }

    @Test
    void castKeywordOpensTemplate() throws FormatterException {
        StructuralModel model = build("p = static_cast<char *>(q);");

        assertThat(model.isTemplateOpen(find(model.getSignificantTokens(), "<", 0))).isTrue();
    }

    @Test
    void directiveDepthFollowsNamespacesOnly() throws FormatterException {
        StructuralModel model = build("#define A 1\nnamespace n {\n#define B 2\nvoid f() {\n#define C 3\n}\n}\n");
        List<Token> directives = model.getSignificantTokens().stream().filter(Token::isDirective).toList();

        assertThat(model.directiveDepth(directives.get(0))).isZero();
        assertThat(model.directiveDepth(directives.get(1))).isEqualTo(1);
        assertThat(model.directiveDepth(directives.get(2))).isZero();
    }

    @Test
    void alternativeBranchesMayEachOpenABrace() throws FormatterException {
        StructuralModel model = build("#ifdef WIDE\nvoid f(long x) {\n#else\nvoid f(int x) {\n#endif\n  use(x);\n}\n");

        Scope conditional = model.getConditionalRoot().getChildren().get(0);
        assertThat(conditional.getKind()).isEqualTo(ScopeKind.PREPROCESSOR_CONDITIONAL);
        assertThat(conditional.getClosing().getText()).isEqualTo("#endif");
    }

    @Test
    void disabledBranchMayBeUnbalanced() throws FormatterException {
        StructuralModel model = build("#if 0\n}\n#endif\nint x;\n");

        assertThat(model.getLines()).hasSize(5);
    }

    @Test
    void splitsIntoPhysicalLines() throws FormatterException {
        StructuralModel model = build("int a;\n\n  int b; // note\n");

        assertThat(model.getLines()).hasSize(4);
        assertThat(model.getLines().get(1).isBlank()).isTrue();
        Line third = model.getLines().get(2);
        assertThat(third.first().getText()).isEqualTo("int");
        assertThat(third.getVisibleTokens()).extracting(Token::getText)
                .containsExactly("int", "b", ";", "// note");
        assertThat(model.lineIndexOf(third.first())).isEqualTo(2);
    }

    @Test
    void flagsDirectiveAndCommentLines() throws FormatterException {
        StructuralModel model = build("#define M(x) \\\n  (x)\n#define N 1\n// top\n  // indented\nint a; /* c */\n");
        List<Line> lines = model.getLines();

        assertThat(lines.get(0).isPreprocessorLine()).isTrue();
        assertThat(lines.get(0).isMacroContinuation()).isTrue();
        assertThat(lines.get(1).isPreprocessorLine()).isTrue();
        assertThat(lines.get(1).isMacroContinuation()).isFalse();
        assertThat(lines.get(2).isCommentOnlyAtColumnOne()).isTrue();
        assertThat(lines.get(3).isCommentOnlyAtColumnOne()).isFalse();
        assertThat(lines.get(4).isCommentOnlyAtColumnOne()).isFalse();
        assertThat(lines.get(4).isPreprocessorLine()).isFalse();
    }

    @Test
    void indentDepthOfClosingBraceIsOutside() throws FormatterException {
        StructuralModel model = build("void f() {\n  x();\n}");
        List<Token> significant = model.getSignificantTokens();

        assertThat(model.indentDepthOf(find(significant, "x", 0))).isEqualTo(1);
        assertThat(model.indentDepthOf(find(significant, "}", 0))).isZero();
        assertThat(model.indentDepthOf(find(significant, "{", 0))).isZero();
    }

    @Test
    void rejectsUnclosedBrace() {
        assertThatThrownBy(() -> build("int main() {\n  return 0;\n"))
                .isInstanceOf(UnbalancedScopeException.class)
                .hasMessageContaining("Unclosed '{'")
                .satisfies(e -> {
                    UnbalancedScopeException error = (UnbalancedScopeException) e;
                    assertThat(error.getKind()).isEqualTo(DiagnosticKind.UNBALANCED_SCOPE);
                    assertThat(error.getLine()).isEqualTo(1);
                    assertThat(error.getColumn()).isEqualTo(12);
                });
    }

    @Test
    void rejectsStrayCloser() {
        assertThatThrownBy(() -> build("int x; }"))
                .isInstanceOf(UnbalancedScopeException.class)
                .hasMessageContaining("Unmatched '}'");
    }

    @Test
    void rejectsMismatchedCloser() {
        assertThatThrownBy(() -> build("f(a];"))
                .isInstanceOf(UnbalancedScopeException.class)
                .hasMessageContaining("Mismatched ']'");
    }

    @Test
    void rejectsUnterminatedConditional() {
        assertThatThrownBy(() -> build("#ifdef X\nint a;\n"))
                .isInstanceOf(UnbalancedScopeException.class)
                .hasMessageContaining("Unterminated #ifdef");
    }

    @Test
    void rejectsEndifWithoutIf() {
        assertThatThrownBy(() -> build("int a;\n#endif\n"))
                .isInstanceOf(UnbalancedScopeException.class)
                .hasMessageContaining("#endif without matching #if");
    }

    private static StructuralModel build(String source) throws FormatterException {
        return StructuralModelBuilder.build(Lexer.tokenize(source));
    }

    private static Token find(List<Token> tokens, String text, int occurrence) {
        int seen = 0;
        for (Token token : tokens) {
            if (token.getText().equals(text) && seen++ == occurrence) {
                return token;
            }
        }
        throw new AssertionError("No occurrence " + occurrence + " of " + text);
    }
}
