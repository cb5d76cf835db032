package com.cppformatter.plugins.cpp.wrap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.cppformatter.api.Refactoring;
import com.cppformatter.api.error.DiagnosticKind;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.Severity;
import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.layout.IndentationEngine;
import com.cppformatter.plugins.cpp.layout.LayoutState;
import com.cppformatter.plugins.cpp.layout.LineLayout;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.Line;
import com.cppformatter.plugins.cpp.model.ScopeKind;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Breaks lines that are longer than {@code maxLineLength}. A line is split
 * after the rightmost {@code &&} or {@code ||} that keeps the first part
 * within the limit, or failing that after the rightmost such comma outside
 * template arguments. The rest goes back through layout as a continuation
 * line and may be split again.
 */
public class LineWrapper {
    private final int maxLineLength;
    private final IndentationEngine indentation;

    public LineWrapper(FormatConfiguration configuration, IndentationEngine indentation) {
        this.maxLineLength = configuration.getMaxLineLength();
        this.indentation = indentation;
    }

    /**
     * Lays out and wraps every line of the model, in order.
     */
    public WrapResult wrap(StructuralModel model) {
        LayoutState state = indentation.start(model);
        List<Line> result = new ArrayList<>(model.getLines().size());
        List<FormatterError> warnings = new ArrayList<>();
        List<Refactoring> refactorings = new ArrayList<>();
        Deque<Line> pending = new ArrayDeque<>(model.getLines());

        while (!pending.isEmpty()) {
            Line line = pending.pollFirst();
            LineLayout layout = indentation.measure(line, state);
            if (widestRow(layout) <= maxLineLength) {
                indentation.commit(line, layout, state);
                result.add(line);
                continue;
            }

            Token splitPoint = line.isPreprocessorLine() || line.hasMultiLineToken()
                    ? null : findSplitPoint(line, layout, state);
            if (splitPoint == null) {
                indentation.commit(line, layout, state);
                result.add(line);
                warnings.add(new FormatterError(Severity.WARNING, DiagnosticKind.UNWRAPPABLE_LINE,
                        "Line is " + widestRow(layout) + " columns long and has no wrap point",
                        line.getSourceLine(), maxLineLength + 1,
                        "Shorten the line or break it by hand"));
                continue;
            }

            List<Line> halves = line.splitAfter(splitPoint);
            pending.addFirst(halves.get(1));
            pending.addFirst(halves.get(0));
            refactorings.add(new Refactoring(Refactoring.LINE_WRAP, line.getSourceLine(), line.getSourceLine(),
                    "Wrapped after '" + splitPoint.getText() + "'"));
        }
        return new WrapResult(result, warnings, refactorings);
    }

    private Token findSplitPoint(Line line, LineLayout layout, LayoutState state) {
        StructuralModel model = state.getModel();
        List<Token> tokens = line.getTokens();
        Set<Token> insideBlocks = tokensInsideSameLineBlocks(tokens, model);
        int lastSignificant = -1;
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).isSignificant()) {
                lastSignificant = i;
                break;
            }
        }

        Token logical = null;
        Token comma = null;
        for (int i = 0; i < lastSignificant; i++) {
            Token token = tokens.get(i);
            if (!token.isSignificant() || insideBlocks.contains(token)
                    || layout.endColumnOf(token) < 0 || layout.endColumnOf(token) > maxLineLength) {
                continue;
            }
            if ((token.isPunctuation("&&") || token.isPunctuation("||"))
                    && state.getRoles().isBinary(token)) {
                logical = token;
            } else if (token.isPunctuation(",")
                    && model.enclosingScope(token).getKind() != ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
                comma = token;
            }
        }
        return logical != null ? logical : comma;
    }

    /**
     * Tokens strictly between a block's braces when both braces are on
     * this line.
     */
    private static Set<Token> tokensInsideSameLineBlocks(List<Token> tokens, StructuralModel model) {
        Set<Token> inside = Collections.newSetFromMap(new IdentityHashMap<>());
        int depth = 0;
        for (Token token : tokens) {
            boolean blockBrace = (token.isPunctuation("{") || token.isPunctuation("}"))
                    && model.scopeOf(token).isBlock();
            if (blockBrace && token.isPunctuation("}") && depth > 0) {
                depth--;
            }
            if (depth > 0) {
                inside.add(token);
            }
            if (blockBrace && token.isPunctuation("{") && tokens.contains(model.matching(token))) {
                depth++;
            }
        }
        return inside;
    }

    private int widestRow(LineLayout layout) {
        String rendered = layout.getRendered();
        if (rendered.isEmpty()) {
            return 0;
        }
        int widest = 0;
        int rowStart = 0;
        boolean firstRow = true;
        for (int i = 0; i <= rendered.length(); i++) {
            if (i == rendered.length() || rendered.charAt(i) == '\n' || rendered.charAt(i) == '\r') {
                int width = (i - rowStart) + (firstRow ? layout.getIndent() : 0);
                widest = Math.max(widest, width);
                rowStart = i + 1;
                firstRow = false;
            }
        }
        return widest;
    }
}
