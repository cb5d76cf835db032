package com.cppformatter.plugins.cpp.model;

/**
 * What a {@code {...}} pair delimits. Only the first two take part in brace
 * style rewriting; initializers and lambdas inside expressions stay inline.
 */
public enum BraceType {
    STATEMENT_BLOCK,
    TYPE_BODY,
    INITIALIZER
}
