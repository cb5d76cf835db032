package com.cppformatter.plugins.cpp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cppformatter.plugins.cpp.lexer.Token;

/**
 * A node of the scope tree. Children are owned by their parent; the parent
 * link is a plain back-reference.
 */
public final class Scope {
    private final ScopeKind kind;
    private final Token opening;
    private final Scope parent;
    private final int depth;
    private final int braceDepth;
    private final BraceType braceType;
    private final boolean conditional;
    private final List<Scope> children = new ArrayList<>();
    private Token closing;

    private Scope(ScopeKind kind, Token opening, Scope parent, BraceType braceType, boolean conditional) {
        this.kind = kind;
        this.opening = opening;
        this.parent = parent;
        this.braceType = braceType;
        this.conditional = conditional;
        this.depth = parent == null ? 0 : parent.depth + 1;
        int inherited = parent == null ? 0 : parent.braceDepth;
        this.braceDepth = kind.isBraceLevel() ? inherited + 1 : inherited;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    static Scope root() {
        return new Scope(ScopeKind.TRANSLATION_UNIT, null, null, null, false);
    }

    static Scope brace(Token opening, Scope parent, BraceType type) {
        return new Scope(ScopeKind.BRACE, opening, parent, type, false);
    }

    static Scope namespace(Token opening, Scope parent) {
        return new Scope(ScopeKind.NAMESPACE, opening, parent, BraceType.STATEMENT_BLOCK, false);
    }

    static Scope parenGroup(Token opening, Scope parent, boolean conditional) {
        return new Scope(ScopeKind.PAREN_GROUP, opening, parent, null, conditional);
    }

    static Scope templateAngles(Token opening, Scope parent) {
        return new Scope(ScopeKind.TEMPLATE_ANGLE_BRACKETS, opening, parent, null, false);
    }

    /**
     * Preprocessor conditionals live in their own tree, independent of braces.
     */
    static Scope preprocessorConditional(Token opening, Scope parent) {
        return new Scope(ScopeKind.PREPROCESSOR_CONDITIONAL, opening, parent, null, false);
    }

    void close(Token closingToken) {
        this.closing = closingToken;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public Token getOpening() {
        return opening;
    }

    public Token getClosing() {
        return closing;
    }

    public Scope getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Number of brace-level scopes on the path from the root to this scope,
     * this one included.
     */
    public int getBraceDepth() {
        return braceDepth;
    }

    /**
     * Brace role for BRACE and NAMESPACE scopes, {@code null} otherwise.
     */
    public BraceType getBraceType() {
        return braceType;
    }

    /**
     * True for the parentheses holding an {@code if}/{@code for}/{@code while}/
     * {@code switch}/{@code catch} condition.
     */
    public boolean isConditional() {
        return conditional;
    }

    public List<Scope> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * True for braces that the brace style rules move around.
     */
    public boolean isBlock() {
        return kind.isBraceLevel() && braceType != BraceType.INITIALIZER;
    }

    @Override
    public String toString() {
        return kind + (braceType != null ? "/" + braceType : "")
                + (opening != null ? "@" + opening.getLine() + ":" + opening.getColumn() : "");
    }
}
