package com.cppformatter.plugins.cpp.emit;

import com.cppformatter.api.error.FormatterException;
import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.layout.IndentationEngine;
import com.cppformatter.plugins.cpp.lexer.Lexer;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.Line;
import com.cppformatter.plugins.cpp.model.StructuralModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmitterTest {

    private final Emitter emitter = new Emitter();

    @Test
    void keepsFinalLineBreak() throws FormatterException {
        assertThat(emit("int x;\n")).isEqualTo("int x;\n");
        assertThat(emit("int x;")).isEqualTo("int x;");
    }

    @Test
    void stripsTrailingWhitespace() throws FormatterException {
        assertThat(emit("x(); // note   \ny();   \n")).isEqualTo("x(); // note\ny();\n");
    }

    @Test
    void whitespaceOnlyLinesBecomeEmpty() throws FormatterException {
        assertThat(emit("a();\n    \nb();")).isEqualTo("a();\n\nb();");
    }

    @Test
    void reproducesCrlfLineBreaks() throws FormatterException {
        assertThat(emit("a();\r\nb();\r\n")).isEqualTo("a();\r\nb();\r\n");
    }

    @Test
    void reproducesByteOrderMark() throws FormatterException {
        String output = emit("\uFEFFint x;\n");

        assertThat(output).isEqualTo("\uFEFFint x;\n");
    }

    @Test
    void detectsSourceLayout() throws FormatterException {
        String source = "\uFEFFa;\r\nb;\n";
        SourceLayout layout = SourceLayout.detect(source, Lexer.tokenize(source));

        assertThat(layout.getLineBreak()).isEqualTo("\r\n");
        assertThat(layout.hasByteOrderMark()).isTrue();
        assertThat(SourceLayout.detect("a;", Lexer.tokenize("a;")).getLineBreak()).isEqualTo("\n");
    }

    private String emit(String source) throws FormatterException {
        List<Token> tokens = Lexer.tokenize(source);
        List<Line> lines = new IndentationEngine(FormatConfiguration.defaults())
                .layout(StructuralModelBuilder.build(tokens));
        return emitter.emit(lines, SourceLayout.detect(source, tokens));
    }
}
