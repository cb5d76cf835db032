package com.cppformatter.plugins.cpp.layout;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.cppformatter.config.FormatConfiguration;
import com.cppformatter.plugins.cpp.lexer.TabExpander;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;
import com.cppformatter.plugins.cpp.model.Line;
import com.cppformatter.plugins.cpp.model.Scope;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * Computes the indentation of each line and renders its tokens with the
 * spacing rules. Lines are laid out in order because a continuation line
 * depends on the line before it and on where an open condition started.
 * <p>
 * Owns the {@code indentWidth}, {@code continuationIndentMax} and
 * {@code minConditionalIndent} options.
 */
public class IndentationEngine {
    private final int indentWidth;
    private final int continuationIndentMax;
    private final int minConditionalIndent;
    private final SpacingRules spacing;

    public IndentationEngine(FormatConfiguration configuration) {
        this.indentWidth = configuration.getIndentWidth();
        this.continuationIndentMax = configuration.getContinuationIndentMax();
        this.minConditionalIndent = configuration.getMinConditionalIndent();
        this.spacing = new SpacingRules(configuration);
    }

    public LayoutState start(StructuralModel model) {
        return new LayoutState(model, TokenRoles.of(model));
    }

    /**
     * Lays out every line of the model in order.
     */
    public List<Line> layout(StructuralModel model) {
        LayoutState state = start(model);
        for (Line line : model.getLines()) {
            place(line, state);
        }
        return model.getLines();
    }

    public void place(Line line, LayoutState state) {
        commit(line, measure(line, state), state);
    }

    /**
     * Computes the layout a line would get after the lines committed so far,
     * without changing any state.
     */
    public LineLayout measure(Line line, LayoutState state) {
        if (line.isBlank()) {
            return new LineLayout(0, 0, false, "", Map.of());
        }
        StructuralModel model = state.getModel();
        Token first = line.first();

        if (line.isPreprocessorLine()) {
            int depth = model.directiveDepth(first);
            return render(line, depth, depth * indentWidth, false, state);
        }

        int depth = model.indentDepthOf(first);
        int base = depth * indentWidth;
        if (startsWithCloser(first, model)) {
            return render(line, depth, base, false, state);
        }

        Scope enclosing = model.enclosingScope(first);
        int cap = base + continuationIndentMax;
        int indent;
        if (enclosing.getKind().isExpressionGroup()) {
            int openColumn = enclosing.isConditional() ? state.openerColumn(enclosing.getOpening()) : -1;
            if (openColumn >= 0) {
                int floor = base + minConditionalIndent;
                indent = Math.max(Math.min(Math.max(floor, openColumn + 1), cap), floor);
            } else {
                indent = Math.min(base + 2 * indentWidth, cap);
            }
        } else if (state.previousEndsWithBinary()) {
            indent = Math.min(base + 2 * indentWidth, cap);
        } else {
            return render(line, depth, base, false, state);
        }
        return render(line, depth, indent, true, state);
    }

    public void commit(Line line, LineLayout layout, LayoutState state) {
        line.layout(layout.getDepth(), layout.getIndent(), layout.isContinuation(), layout.getRendered());
        if (line.isBlank() || line.isPreprocessorLine() || line.isCommentOnly()) {
            return;
        }
        StructuralModel model = state.getModel();
        Token last = null;
        for (Token token : line.getTokens()) {
            if (!token.isSignificant()) {
                continue;
            }
            last = token;
            if (token.isPunctuation("(") && model.scopeOf(token).isConditional()) {
                state.recordOpenerColumn(token, layout.columnOf(token));
            }
        }
        state.setPreviousEndsWithBinary(last != null && state.getRoles().isBinary(last));
    }

    private static boolean startsWithCloser(Token first, StructuralModel model) {
        return first.isPunctuation(")") || first.isPunctuation("]") || first.isPunctuation("}")
                || model.isTemplateClose(first);
    }

    private LineLayout render(Line line, int depth, int indent, boolean continuation, LayoutState state) {
        StringBuilder out = new StringBuilder();
        Map<Token, Integer> columns = new IdentityHashMap<>();
        Token previous = null;
        String gap = null;
        int rowStart = 0;

        for (Token token : line.getTokens()) {
            if (token.getKind() == TokenKind.WHITESPACE) {
                gap = gap == null ? token.getText() : gap + token.getText();
                continue;
            }
            if (previous != null) {
                out.append(spacing.separator(previous, token, gap, column(out, rowStart, indent), state.getRoles()));
            }
            int start = column(out, rowStart, indent);
            columns.put(token, start);
            out.append(renderToken(token, start));
            int lastBreak = Math.max(out.lastIndexOf("\n"), out.lastIndexOf("\r"));
            if (lastBreak >= 0) {
                rowStart = lastBreak + 1;
            }
            previous = token;
            gap = null;
        }
        return new LineLayout(depth, indent, continuation, out.toString(), columns);
    }

    private static int column(StringBuilder out, int rowStart, int indent) {
        return rowStart == 0 ? indent + out.length() : out.length() - rowStart;
    }

    /**
     * Token text as written at {@code column}. Continuation rows of block
     * comments and multi-line directives move by the same amount as the
     * token's first row; a directive whose string literal spans a line break
     * is written as is.
     */
    private String renderToken(Token token, int column) {
        boolean rebasable = token.isComment() || token.isDirective();
        if (!rebasable) {
            return token.getText();
        }
        boolean convert = spacing.isConvertTabsToSpaces();
        if (!token.spansLines()) {
            return convert ? expand(token, token.getText(), column) : token.getText();
        }
        if (token.isDirective() && TabExpander.literalSpansBreak(token.getText())) {
            return token.getText();
        }

        int delta = column - token.getVisualColumn();
        String text = token.getText();
        StringBuilder out = new StringBuilder(text.length() + 16);
        int rowStart = 0;
        boolean firstRow = true;
        while (rowStart <= text.length()) {
            int rowEnd = rowStart;
            while (rowEnd < text.length() && text.charAt(rowEnd) != '\n' && text.charAt(rowEnd) != '\r') {
                rowEnd++;
            }
            int breakEnd = rowEnd;
            if (breakEnd < text.length() && text.charAt(breakEnd) == '\r') {
                breakEnd++;
            }
            if (breakEnd < text.length() && text.charAt(breakEnd) == '\n') {
                breakEnd++;
            }
            String row = text.substring(rowStart, rowEnd);
            boolean lastRow = rowEnd >= text.length();
            if (firstRow) {
                row = convert ? expand(token, row, column) : row;
            } else {
                int content = 0;
                while (content < row.length() && (row.charAt(content) == ' ' || row.charAt(content) == '\t')) {
                    content++;
                }
                int width = Math.max(0, TabExpander.visualColumn(row, 0, content) + delta);
                String rest = row.substring(content);
                row = " ".repeat(rest.isEmpty() ? 0 : width) + (convert ? expand(token, rest, width) : rest);
            }
            out.append(lastRow ? row : stripTrailing(row)).append(text, rowEnd, breakEnd);
            firstRow = false;
            if (lastRow) {
                break;
            }
            rowStart = breakEnd;
        }
        return out.toString();
    }

    private static String expand(Token token, String text, int column) {
        return token.isDirective()
                ? TabExpander.expandOutsideLiterals(text, column)
                : TabExpander.expand(text, column);
    }

    private static String stripTrailing(String row) {
        int end = row.length();
        while (end > 0 && (row.charAt(end - 1) == ' ' || row.charAt(end - 1) == '\t')) {
            end--;
        }
        return row.substring(0, end);
    }
}
