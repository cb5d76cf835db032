package com.cppformatter.plugins.cpp;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cppformatter.api.FormatterPlugin;
import com.cppformatter.api.FormatterResult;
import com.cppformatter.api.Refactoring;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.FormatterException;
import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.config.FormatterConfig;
import com.cppformatter.plugins.cpp.classify.Classification;
import com.cppformatter.plugins.cpp.classify.StatementClassifier;
import com.cppformatter.plugins.cpp.emit.Emitter;
import com.cppformatter.plugins.cpp.emit.SourceLayout;
import com.cppformatter.plugins.cpp.layout.IndentationEngine;
import com.cppformatter.plugins.cpp.lexer.Lexer;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.StructuralModel;
import com.cppformatter.plugins.cpp.model.StructuralModelBuilder;
import com.cppformatter.plugins.cpp.transform.TransformResult;
import com.cppformatter.plugins.cpp.transform.TransformationEngine;
import com.cppformatter.plugins.cpp.wrap.LineWrapper;
import com.cppformatter.plugins.cpp.wrap.WrapResult;

/**
 * C and C++ formatter plugin. Runs the lexer, the structural model builder,
 * the statement classifier, the transformation engine, layout, wrapping and
 * the emitter, in that order, on one unit of source text.
 * <p>
 * No per-unit state is kept in fields, so a single instance can format
 * several files concurrently.
 */
public class CppFormatter implements FormatterPlugin {

    private volatile FormatConfiguration configuration = FormatConfiguration.defaults();

    public CppFormatter() {
    }

    public CppFormatter(FormatConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void initialize(FormatterConfig config) {
        this.configuration = config.getFormatConfiguration();
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        return format(sourceCode);
    }

    /**
     * Formats one unit. A lexing or scope error yields an unsuccessful result
     * with a single fatal error and no formatted code.
     */
    public FormatterResult format(String sourceCode) {
        FormatConfiguration options = configuration;
        try {
            List<Token> tokens = Lexer.tokenize(sourceCode);
            SourceLayout sourceLayout = SourceLayout.detect(sourceCode, tokens);

            StructuralModel model = StructuralModelBuilder.build(tokens);
            StatementClassifier classifier = new StatementClassifier();
            Classification classification = classifier.classify(model);

            TransformResult transformed = new TransformationEngine(options).transform(model, classification);

            // the new braces need their scopes before anything is laid out
            StructuralModel rebuilt = StructuralModelBuilder.build(transformed.getTokens());
            classifier.classify(rebuilt);

            IndentationEngine indentation = new IndentationEngine(options);
            WrapResult wrapped = new LineWrapper(options, indentation).wrap(rebuilt);

            String formattedCode = new Emitter().emit(wrapped.getLines(), sourceLayout);

            List<Refactoring> refactorings = new ArrayList<>(transformed.getRefactorings());
            refactorings.addAll(wrapped.getRefactorings());

            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(formattedCode)
                    .errors(wrapped.getWarnings())
                    .appliedRefactorings(refactorings)
                    .build();
        } catch (FormatterException e) {
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(FormatterError.fatal(e))
                    .build();
        }
    }

    public FormatConfiguration getConfiguration() {
        return configuration;
    }
}
