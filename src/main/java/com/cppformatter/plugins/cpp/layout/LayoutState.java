package com.cppformatter.plugins.cpp.layout;

import java.util.IdentityHashMap;
import java.util.Map;

import com.cppformatter.plugins.cpp.lexer.Token;
import com.cppformatter.plugins.cpp.model.StructuralModel;

/**
 * What the indentation engine remembers between consecutive lines of one
 * unit. Created by {@link IndentationEngine#start}.
 */
public final class LayoutState {
    private final StructuralModel model;
    private final TokenRoles roles;
    private final Map<Token, Integer> openerColumns = new IdentityHashMap<>();
    private boolean previousEndsWithBinary;

    LayoutState(StructuralModel model, TokenRoles roles) {
        this.model = model;
        this.roles = roles;
    }

    public StructuralModel getModel() {
        return model;
    }

    public TokenRoles getRoles() {
        return roles;
    }

    int openerColumn(Token opener) {
        Integer column = openerColumns.get(opener);
        return column == null ? -1 : column;
    }

    void recordOpenerColumn(Token opener, int column) {
        openerColumns.put(opener, column);
    }

    boolean previousEndsWithBinary() {
        return previousEndsWithBinary;
    }

    void setPreviousEndsWithBinary(boolean value) {
        this.previousEndsWithBinary = value;
    }
}
