package com.cppformatter.plugins.cpp.model;

public enum ScopeKind {
    /** Root of the scope tree; never opened or closed by a token. */
    TRANSLATION_UNIT,
    BRACE,
    NAMESPACE,
    PREPROCESSOR_CONDITIONAL,
    TEMPLATE_ANGLE_BRACKETS,
    PAREN_GROUP;

    /** Scopes that add one level of brace depth. */
    public boolean isBraceLevel() {
        return this == BRACE || this == NAMESPACE;
    }

    /** Scopes whose lines continue an unfinished expression. */
    public boolean isExpressionGroup() {
        return this == PAREN_GROUP || this == TEMPLATE_ANGLE_BRACKETS;
    }
}
