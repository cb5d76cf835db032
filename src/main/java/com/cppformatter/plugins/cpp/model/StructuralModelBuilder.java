package com.cppformatter.plugins.cpp.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cppformatter.api.error.UnbalancedScopeException;
import com.cppformatter.plugins.cpp.lexer.Keywords;
import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.lexer.TokenKind;

/**
 * Builds the {@link StructuralModel} of a token stream in one pass with an
 * explicit scope stack.
 * <p>
 * Preprocessor conditionals are tracked on their own stack. Each
 * {@code #if} remembers the scope stack it started with; every alternative
 * branch starts again from that state, and after {@code #endif} parsing
 * continues with the state reached at the end of the first live branch.
 * Branches of {@code #if 0} are not live. This keeps code such as two
 * alternative function headers that each open a brace balanced.
 */
public final class StructuralModelBuilder {
    private static final Set<String> BLOCK_AFTER = Set.of(
            "else", "do", "try", "const", "noexcept", "mutable", "volatile", "override", "final");
    private static final Set<String> LAMBDA_SPECIFIERS = Set.of("mutable", "noexcept", "constexpr", "consteval");

    private final List<Token> tokens;
    private final List<Token> significant = new ArrayList<>();
    private final Map<Token, Integer> significantIndex = new IdentityHashMap<>();
    private final Map<Token, Scope> scopeOf = new IdentityHashMap<>();
    private final Map<Token, Token> matching = new IdentityHashMap<>();
    private final Set<Token> templateOpeners = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Token> templateClosers = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Scope> lambdaBodies = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Token, Integer> directiveDepth = new IdentityHashMap<>();

    private final Scope root = Scope.root();
    private final Scope conditionalRoot = Scope.root();
    private final Deque<Scope> stack = new ArrayDeque<>();
    private final Deque<StatementHead> heads = new ArrayDeque<>();
    private final Deque<Conditional> conditionals = new ArrayDeque<>();

    private StructuralModelBuilder(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Builds the model of a complete token stream.
     *
     * @throws UnbalancedScopeException on a stray or mismatched closer, or
     *         when a scope or preprocessor conditional is still open at the end
     */
    public static StructuralModel build(List<Token> tokens) throws UnbalancedScopeException {
        return new StructuralModelBuilder(new ArrayList<>(tokens)).run();
    }

    private StructuralModel run() throws UnbalancedScopeException {
        for (Token token : tokens) {
            if (token.isSignificant()) {
                significantIndex.put(token, significant.size());
                significant.add(token);
            }
        }

        stack.push(root);
        heads.push(new StatementHead());

        for (Token token : tokens) {
            if (!token.isSignificant()) {
                scopeOf.put(token, stack.peek());
            } else if (token.isDirective()) {
                scopeOf.put(token, stack.peek());
                handleDirective(token);
            } else {
                handleSignificant(token);
            }
        }

        checkEndOfInput();
        List<Line> lines = new ArrayList<>();
        Map<Token, Integer> lineIndexOf = new IdentityHashMap<>();
        splitLines(lines, lineIndexOf);

        return new StructuralModel(tokens, significant, significantIndex, scopeOf, matching,
                templateOpeners, templateClosers, directiveDepth, root, conditionalRoot, lines, lineIndexOf);
    }

    private void handleSignificant(Token token) throws UnbalancedScopeException {
        int index = significantIndex.get(token);
        Token previous = index > 0 ? significant.get(index - 1) : null;
        boolean statementLevel = stack.peek().getKind().isBraceLevel() || stack.peek() == root;
        StatementHead head = heads.peek();

        if (token.getKind() == TokenKind.PUNCTUATION) {
            switch (token.getText()) {
                case "{":
                    openBrace(token, index, previous);
                    return;
                case "(":
                case "[": {
                    boolean condition = token.getText().equals("(") && isCondition(index);
                    Scope group = Scope.parenGroup(token, stack.peek(), condition);
                    scopeOf.put(token, group);
                    stack.push(group);
                    return;
                }
                case ")":
                case "]":
                case "}":
                    close(token);
                    return;
                case "<":
                    if (TemplateHeuristic.opensTemplate(significant, index, openAngles())) {
                        Scope angles = Scope.templateAngles(token, stack.peek());
                        templateOpeners.add(token);
                        scopeOf.put(token, angles);
                        stack.push(angles);
                        return;
                    }
                    break;
                case ">":
                    if (stack.peek().getKind() == ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
                        closeAngles(token, 1);
                        return;
                    }
                    break;
                case ">>":
                    if (openAngles() >= 2) {
                        closeAngles(token, 2);
                        return;
                    }
                    break;
                case ";":
                    if (statementLevel) {
                        head.reset();
                    }
                    break;
                case "=":
                    if (statementLevel && (previous == null || !previous.isKeyword("operator"))) {
                        head.sawAssign = true;
                    }
                    break;
                case ":":
                    if (statementLevel && head.sawCloseParen) {
                        head.sawCtorInit = true;
                    }
                    break;
                default:
                    break;
            }
        } else if (statementLevel && token.getKind() == TokenKind.KEYWORD) {
            String word = token.getText();
            if (word.equals("namespace")) {
                head.sawNamespace = true;
            } else if (Keywords.TYPE_HEADS.contains(word)) {
                head.sawTypeHead = true;
            } else if (word.equals("return") || word.equals("co_return")) {
                head.sawReturn = true;
            }
        }
        scopeOf.put(token, stack.peek());
    }

    private void openBrace(Token token, int index, Token previous) {
        Scope parent = stack.peek();
        Scope scope;
        if (isLinkageOrNamespace(index, previous)) {
            scope = Scope.namespace(token, parent);
        } else {
            BraceType type = classifyBrace(index, previous);
            scope = Scope.brace(token, parent, type);
            if (type == BraceType.INITIALIZER && isLambdaBody(index)) {
                lambdaBodies.add(scope);
            }
        }
        scopeOf.put(token, scope);
        stack.push(scope);
        heads.push(new StatementHead());
    }

    private boolean isLinkageOrNamespace(int index, Token previous) {
        if (insideExpression()) {
            return false;
        }
        StatementHead head = heads.peek();
        if (head.sawAssign || head.sawReturn) {
            return false;
        }
        if (previous != null && previous.getKind() == TokenKind.STRING_LITERAL && index >= 2
                && significant.get(index - 2).isKeyword("extern")) {
            return true;
        }
        return head.sawNamespace;
    }

    /**
     * Decides what a {@code {} delimits from the tokens before it. Rules are
     * tried in order; the first that applies wins.
     */
    private BraceType classifyBrace(int index, Token previous) {
        StatementHead head = heads.peek();
        if (insideExpression()) {
            return BraceType.INITIALIZER;
        }
        if (previous != null && (previous.isPunctuation("=") || previous.isPunctuation(",")
                || previous.isKeyword("return") || previous.isKeyword("co_return"))) {
            return BraceType.INITIALIZER;
        }
        if (head.sawAssign || head.sawReturn) {
            return BraceType.INITIALIZER;
        }
        if (previous != null && previous.isPunctuation(")")) {
            return BraceType.STATEMENT_BLOCK;
        }
        if (head.sawTypeHead) {
            return BraceType.TYPE_BODY;
        }
        if (previous == null || previous.isDirective() || previous.isPunctuation(";")
                || previous.isPunctuation("{") || previous.isPunctuation("}") || previous.isPunctuation(":")) {
            return BraceType.STATEMENT_BLOCK;
        }
        if (BLOCK_AFTER.contains(previous.getText())
                && (previous.getKind() == TokenKind.KEYWORD || previous.isIdentifier())) {
            return BraceType.STATEMENT_BLOCK;
        }
        if (head.sawCloseParen && !head.sawCtorInit) {
            return BraceType.STATEMENT_BLOCK;
        }
        return BraceType.INITIALIZER;
    }

    /**
     * True inside parentheses, brackets, template arguments, or a braced
     * initializer other than a lambda body.
     */
    private boolean insideExpression() {
        Scope top = stack.peek();
        if (top.getKind().isExpressionGroup()) {
            return true;
        }
        return top.getKind() == ScopeKind.BRACE && top.getBraceType() == BraceType.INITIALIZER
                && !lambdaBodies.contains(top);
    }

    private boolean isLambdaBody(int index) {
        int i = index - 1;
        while (i >= 0 && LAMBDA_SPECIFIERS.contains(significant.get(i).getText())) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        Token previous = significant.get(i);
        if (previous.isPunctuation("]")) {
            return true;
        }
        if (previous.isPunctuation(")")) {
            Token opener = matching.get(previous);
            int openerIndex = opener == null ? -1 : significantIndex.get(opener);
            return openerIndex > 0 && significant.get(openerIndex - 1).isPunctuation("]");
        }
        return false;
    }

    private boolean isCondition(int index) {
        if (index == 0) {
            return false;
        }
        Token previous = significant.get(index - 1);
        if (previous.getKind() != TokenKind.KEYWORD) {
            return false;
        }
        if (Keywords.CONTROL_WITH_CONDITION.contains(previous.getText())) {
            return true;
        }
        return previous.isKeyword("constexpr") && index >= 2 && significant.get(index - 2).isKeyword("if");
    }

    private int openAngles() {
        int count = 0;
        for (Scope scope : stack) {
            if (scope.getKind() != ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
                break;
            }
            count++;
        }
        return count;
    }

    private void closeAngles(Token closer, int count) {
        Scope innermost = stack.peek();
        for (int i = 0; i < count; i++) {
            Scope angles = stack.pop();
            angles.close(closer);
            matching.put(angles.getOpening(), closer);
        }
        matching.put(closer, innermost.getOpening());
        templateClosers.add(closer);
        scopeOf.put(closer, innermost);
    }

    private void close(Token closer) throws UnbalancedScopeException {
        // A '<' that never found its '>' before the enclosing group ended was a comparison.
        while (stack.peek().getKind() == ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
            templateOpeners.remove(stack.pop().getOpening());
        }

        Scope top = stack.peek();
        String text = closer.getText();
        if (top == root) {
            if (inDisabledBranch()) {
                scopeOf.put(closer, top);
                return;
            }
            throw new UnbalancedScopeException("Unmatched '" + text + "'", closer.getLine(), closer.getColumn());
        }

        String expected = top.getOpening().getText().equals("(") ? ")"
                : top.getOpening().getText().equals("[") ? "]" : "}";
        if (!expected.equals(text)) {
            if (inDisabledBranch()) {
                scopeOf.put(closer, top);
                return;
            }
            Token opening = top.getOpening();
            throw new UnbalancedScopeException("Mismatched '" + text + "' closes '" + opening.getText()
                    + "' opened at line " + opening.getLine() + ", column " + opening.getColumn(),
                    closer.getLine(), closer.getColumn());
        }

        stack.pop();
        top.close(closer);
        matching.put(top.getOpening(), closer);
        matching.put(closer, top.getOpening());
        scopeOf.put(closer, top);

        if (top.getKind().isBraceLevel()) {
            heads.pop();
            if (top.isBlock()) {
                heads.peek().reset();
            }
        } else if (text.equals(")") && (stack.peek().getKind().isBraceLevel() || stack.peek() == root)) {
            heads.peek().sawCloseParen = true;
        }
    }

    private void handleDirective(Token directive) throws UnbalancedScopeException {
        directiveDepth.put(directive, effectiveDirectiveDepth());
        String name = directiveName(directive);
        switch (name) {
            case "if":
            case "ifdef":
            case "ifndef": {
                Scope parent = conditionals.isEmpty() ? conditionalRoot : conditionals.peek().scope;
                Conditional conditional = new Conditional(
                        Scope.preprocessorConditional(directive, parent), snapshot());
                conditional.currentLive = !isIfZero(directive);
                conditionals.push(conditional);
                break;
            }
            case "elif":
            case "elifdef":
            case "elifndef":
            case "else": {
                if (conditionals.isEmpty()) {
                    throw new UnbalancedScopeException("#" + name + " without matching #if",
                            directive.getLine(), directive.getColumn());
                }
                Conditional conditional = conditionals.peek();
                if (conditional.currentLive && conditional.firstLiveEnd == null) {
                    conditional.firstLiveEnd = snapshot();
                }
                restore(conditional.start);
                conditional.currentLive = name.equals("else") || !isIfZero(directive);
                break;
            }
            case "endif": {
                if (conditionals.isEmpty()) {
                    throw new UnbalancedScopeException("#endif without matching #if",
                            directive.getLine(), directive.getColumn());
                }
                Conditional conditional = conditionals.pop();
                if (conditional.firstLiveEnd != null) {
                    restore(conditional.firstLiveEnd);
                } else if (!conditional.currentLive) {
                    restore(conditional.start);
                }
                conditional.scope.close(directive);
                matching.put(conditional.scope.getOpening(), directive);
                matching.put(directive, conditional.scope.getOpening());
                break;
            }
            default:
                break;
        }
    }

    private int effectiveDirectiveDepth() {
        int depth = 0;
        for (Scope scope : stack) {
            if (scope == root) {
                break;
            }
            if (scope.getKind() == ScopeKind.NAMESPACE) {
                depth++;
            } else if (scope.getKind().isBraceLevel()) {
                return 0;
            }
        }
        return depth;
    }

    private boolean inDisabledBranch() {
        for (Conditional conditional : conditionals) {
            if (!conditional.currentLive) {
                return true;
            }
        }
        return false;
    }

    private void checkEndOfInput() throws UnbalancedScopeException {
        Scope outermost = null;
        for (Scope scope : stack) {
            if (scope != root && scope.getKind() != ScopeKind.TEMPLATE_ANGLE_BRACKETS) {
                outermost = scope;
            }
        }
        if (outermost != null) {
            Token opening = outermost.getOpening();
            throw new UnbalancedScopeException("Unclosed '" + opening.getText() + "'",
                    opening.getLine(), opening.getColumn());
        }
        if (!conditionals.isEmpty()) {
            Token opening = conditionals.getLast().scope.getOpening();
            throw new UnbalancedScopeException("Unterminated #" + directiveName(opening),
                    opening.getLine(), opening.getColumn());
        }
        while (stack.peek() != root) {
            templateOpeners.remove(stack.pop().getOpening());
        }
    }

    private void splitLines(List<Line> lines, Map<Token, Integer> lineIndexOf) {
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            lineIndexOf.put(token, lines.size());
            if (token.getKind() == TokenKind.NEWLINE) {
                lines.add(new Line(current));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        lines.add(new Line(current));
    }

    /**
     * Name of a directive: {@code "define"} for {@code #  define X}.
     */
    public static String directiveName(Token directive) {
        String text = directive.getText();
        int i = 1;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        int start = i;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
            i++;
        }
        return text.substring(start, i);
    }

    private static boolean isIfZero(Token directive) {
        String text = directive.getText();
        int start = text.indexOf(directiveName(directive)) + directiveName(directive).length();
        String condition = text.substring(start).replaceAll("/\\*.*?\\*/|//.*", "").trim();
        return directiveName(directive).endsWith("if") && condition.equals("0");
    }

    private Snapshot snapshot() {
        List<StatementHead> headCopies = new ArrayList<>();
        for (StatementHead head : heads) {
            headCopies.add(head.copy());
        }
        return new Snapshot(new ArrayList<>(stack), headCopies);
    }

    private void restore(Snapshot snapshot) {
        stack.clear();
        heads.clear();
        // Deque iteration runs top to bottom, so push in reverse.
        for (int i = snapshot.scopes.size() - 1; i >= 0; i--) {
            stack.push(snapshot.scopes.get(i));
        }
        for (int i = snapshot.heads.size() - 1; i >= 0; i--) {
            heads.push(snapshot.heads.get(i).copy());
        }
    }

    /**
     * What has been seen so far in the current statement at brace level.
     */
    private static final class StatementHead {
        boolean sawNamespace;
        boolean sawTypeHead;
        boolean sawAssign;
        boolean sawReturn;
        boolean sawCloseParen;
        boolean sawCtorInit;

        void reset() {
            sawNamespace = false;
            sawTypeHead = false;
            sawAssign = false;
            sawReturn = false;
            sawCloseParen = false;
            sawCtorInit = false;
        }

        StatementHead copy() {
            StatementHead copy = new StatementHead();
            copy.sawNamespace = sawNamespace;
            copy.sawTypeHead = sawTypeHead;
            copy.sawAssign = sawAssign;
            copy.sawReturn = sawReturn;
            copy.sawCloseParen = sawCloseParen;
            copy.sawCtorInit = sawCtorInit;
            return copy;
        }
    }

    private static final class Snapshot {
        final List<Scope> scopes;
        final List<StatementHead> heads;

        Snapshot(List<Scope> scopes, List<StatementHead> heads) {
            this.scopes = scopes;
            this.heads = heads;
        }
    }

    private static final class Conditional {
        final Scope scope;
        final Snapshot start;
        Snapshot firstLiveEnd;
        boolean currentLive = true;

        Conditional(Scope scope, Snapshot start) {
            this.scope = scope;
            this.start = start;
        }
    }
}
