package com.rstfmt.core.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FormatContext}.
 */
class FormatContextTest {

    @Test
    void root_nonPositiveWidth_isUnbounded() {
        assertThat(FormatContext.root(0).isUnbounded()).isTrue();
        assertThat(FormatContext.root(-5).isUnbounded()).isTrue();
        assertThat(FormatContext.root(null).isUnbounded()).isTrue();
        assertThat(FormatContext.root(72).width()).isEqualTo(72);
    }

    @Test
    void indent_neverDropsBelowOne() {
        FormatContext context = FormatContext.root(5);

        assertThat(context.indent(3).width()).isEqualTo(2);
        assertThat(context.indent(10).width()).isEqualTo(1);
        assertThat(FormatContext.root(null).indent(3).isUnbounded()).isTrue();
    }

    @Test
    void transitions_leaveOriginalUntouched() {
        FormatContext context = FormatContext.root(40);
        FormatContext derived = context.inSection().withBullet("-").withColumnWidths(List.of(5, 6));

        assertThat(context.sectionDepth()).isZero();
        assertThat(context.bullet()).isNull();
        assertThat(context.columnWidths()).isNull();
        assertThat(derived.sectionDepth()).isEqualTo(1);
        assertThat(derived.bullet()).isEqualTo("-");
        assertThat(derived.columnWidths()).containsExactly(5, 6);
    }

    @Test
    void sectionCharacter_followsDepthAndCycles() {
        FormatContext context = FormatContext.root(72);
        StringBuilder chars = new StringBuilder();
        for (int depth = 1; depth <= 7; depth++) {
            context = context.inSection();
            chars.append(context.sectionCharacter());
        }

        assertThat(chars.toString()).isEqualTo("=-^\"~+=");
    }

    @Test
    void constructor_rejectsInvalidState() {
        assertThatThrownBy(() -> new FormatContext(-1, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FormatContext(0, 0, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
