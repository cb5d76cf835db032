package com.cppformatter.plugins.cpp.wrap;

import java.util.Collections;
import java.util.List;

import com.cppformatter.api.Refactoring;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.plugins.cpp.model.Line;

/**
 * Final lines of a unit plus what the wrapper did and could not do.
 */
public final class WrapResult {
    private final List<Line> lines;
    private final List<FormatterError> warnings;
    private final List<Refactoring> refactorings;

    WrapResult(List<Line> lines, List<FormatterError> warnings, List<Refactoring> refactorings) {
        this.lines = Collections.unmodifiableList(lines);
        this.warnings = Collections.unmodifiableList(warnings);
        this.refactorings = Collections.unmodifiableList(refactorings);
    }

    public List<Line> getLines() {
        return lines;
    }

    public List<FormatterError> getWarnings() {
        return warnings;
    }

    public List<Refactoring> getRefactorings() {
        return refactorings;
    }
}
