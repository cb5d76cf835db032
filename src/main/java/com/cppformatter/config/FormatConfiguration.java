package com.cppformatter.config;

/**
 * Immutable set of formatting rules handed to the pipeline.
 * Each option is consulted by exactly one stage:
 * <ul>
 *   <li>{@code useAllmanBraces}: transformation engine</li>
 *   <li>{@code indentWidth}, {@code continuationIndentMax}, {@code minConditionalIndent}: indentation engine</li>
 *   <li>{@code bindPointerToType}, {@code collapseTemplateCloseAngles}, {@code convertTabsToSpaces}: spacing rules</li>
 *   <li>{@code maxLineLength}: line wrapper</li>
 * </ul>
 */
public final class FormatConfiguration {
    public static final int DEFAULT_INDENT_WIDTH = 2;
    public static final int DEFAULT_MAX_LINE_LENGTH = 200;
    public static final int DEFAULT_CONTINUATION_INDENT_MAX = 120;
    public static final int DEFAULT_MIN_CONDITIONAL_INDENT = 0;

    private final int indentWidth;
    private final int maxLineLength;
    private final int continuationIndentMax;
    private final int minConditionalIndent;
    private final boolean useAllmanBraces;
    private final boolean bindPointerToType;
    private final boolean collapseTemplateCloseAngles;
    private final boolean convertTabsToSpaces;

    private FormatConfiguration(Builder builder) {
        this.indentWidth = builder.indentWidth;
        this.maxLineLength = builder.maxLineLength;
        this.continuationIndentMax = builder.continuationIndentMax;
        this.minConditionalIndent = builder.minConditionalIndent;
        this.useAllmanBraces = builder.useAllmanBraces;
        this.bindPointerToType = builder.bindPointerToType;
        this.collapseTemplateCloseAngles = builder.collapseTemplateCloseAngles;
        this.convertTabsToSpaces = builder.convertTabsToSpaces;
    }

    public static FormatConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public int getContinuationIndentMax() {
        return continuationIndentMax;
    }

    public int getMinConditionalIndent() {
        return minConditionalIndent;
    }

    public boolean isUseAllmanBraces() {
        return useAllmanBraces;
    }

    public boolean isBindPointerToType() {
        return bindPointerToType;
    }

    public boolean isCollapseTemplateCloseAngles() {
        return collapseTemplateCloseAngles;
    }

    public boolean isConvertTabsToSpaces() {
        return convertTabsToSpaces;
    }

    @Override
    public String toString() {
        return "FormatConfiguration{indentWidth=" + indentWidth
                + ", maxLineLength=" + maxLineLength
                + ", continuationIndentMax=" + continuationIndentMax
                + ", minConditionalIndent=" + minConditionalIndent
                + ", useAllmanBraces=" + useAllmanBraces
                + ", bindPointerToType=" + bindPointerToType
                + ", collapseTemplateCloseAngles=" + collapseTemplateCloseAngles
                + ", convertTabsToSpaces=" + convertTabsToSpaces + "}";
    }

    public static class Builder {
        private int indentWidth = DEFAULT_INDENT_WIDTH;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private int continuationIndentMax = DEFAULT_CONTINUATION_INDENT_MAX;
        private int minConditionalIndent = DEFAULT_MIN_CONDITIONAL_INDENT;
        private boolean useAllmanBraces = true;
        private boolean bindPointerToType = true;
        private boolean collapseTemplateCloseAngles = true;
        private boolean convertTabsToSpaces = true;

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder continuationIndentMax(int continuationIndentMax) {
            this.continuationIndentMax = continuationIndentMax;
            return this;
        }

        public Builder minConditionalIndent(int minConditionalIndent) {
            this.minConditionalIndent = minConditionalIndent;
            return this;
        }

        public Builder useAllmanBraces(boolean useAllmanBraces) {
            this.useAllmanBraces = useAllmanBraces;
            return this;
        }

        public Builder bindPointerToType(boolean bindPointerToType) {
            this.bindPointerToType = bindPointerToType;
            return this;
        }

        public Builder collapseTemplateCloseAngles(boolean collapseTemplateCloseAngles) {
            this.collapseTemplateCloseAngles = collapseTemplateCloseAngles;
            return this;
        }

        public Builder convertTabsToSpaces(boolean convertTabsToSpaces) {
            this.convertTabsToSpaces = convertTabsToSpaces;
            return this;
        }

        public FormatConfiguration build() {
            if (indentWidth < 1) {
                throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
            }
            if (maxLineLength < 1) {
                throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
            }
            if (continuationIndentMax < 0 || minConditionalIndent < 0) {
                throw new IllegalArgumentException("Continuation indents must not be negative");
            }
            return new FormatConfiguration(this);
        }
    }
}
