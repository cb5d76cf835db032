package com.cppformatter.api;

/**
 * Represents a structural rewrite that was applied to a unit.
 */
public class Refactoring {
    public static final String BRACE_INSERTION = "BRACE_INSERTION";
    public static final String ALLMAN_BRACE = "ALLMAN_BRACE";
    public static final String LINE_WRAP = "LINE_WRAP";

    private final String type;
    private final int startLine;
    private final int endLine;
    private final String description;

    public Refactoring(String type, int startLine, int endLine, String description) {
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    // Getters
    public String getType() { return type; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }
}
