package com.cppformatter.plugins.cpp.emit;

import java.util.List;

import com.cppformatter.plugins.cpp.model.Line;

/**
 * Serializes laid-out lines. A trailing line break in the input shows up
 * as a final empty line, so it is kept or left out without special casing.
 */
public class Emitter {

    public String emit(List<Line> lines, SourceLayout layout) {
        StringBuilder out = new StringBuilder();
        out.append(layout.byteOrderMark());
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                out.append(layout.getLineBreak());
            }
            Line line = lines.get(i);
            String rendered = stripTrailing(line.getRendered());
            if (!rendered.isEmpty()) {
                out.append(" ".repeat(line.getIndent())).append(rendered);
            }
        }
        return out.toString();
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        return text.substring(0, end);
    }
}
