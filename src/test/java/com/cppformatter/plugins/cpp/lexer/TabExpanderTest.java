package com.cppformatter.plugins.cpp.lexer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TabExpanderTest {

    @Test
    void tabsAdvanceToTheNextStop() {
        assertThat(TabExpander.nextStop(0)).isEqualTo(8);
        assertThat(TabExpander.nextStop(7)).isEqualTo(8);
        assertThat(TabExpander.nextStop(8)).isEqualTo(16);
        assertThat(TabExpander.visualColumn("a\tb\t", 0, 4)).isEqualTo(16);
    }

    @Test
    void expansionDependsOnTheStartColumn() {
        assertThat(TabExpander.expand("a\tb", 0)).isEqualTo("a       b");
        assertThat(TabExpander.expand("a\tb", 5)).isEqualTo("a  b");
        assertThat(TabExpander.expand("no tabs", 3)).isEqualTo("no tabs");
    }

    @Test
    void tabsInsideLiteralsAreKept() {
        assertThat(TabExpander.expandOutsideLiterals("#define S\t\"a\tb\"", 0))
                .isEqualTo("#define S       \"a\tb\"");
    }

    @Test
    void detectsLiteralsContinuedOverALineBreak() {
        assertThat(TabExpander.literalSpansBreak("#define S \"abc\\\ndef\"")).isTrue();
        assertThat(TabExpander.literalSpansBreak("#define F(x) \\\n  (x)")).isFalse();
        assertThat(TabExpander.literalSpansBreak("#define C /* \"x\\\n */ 1")).isFalse();
    }
}
