package com.structgrep.core.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanTest {

    @Test
    void constructor_withEndBeforeStart_throwsException() {
        assertThatThrownBy(() -> new Span(5, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Span(-1, 4))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contains_withNestedAndEqualSpans_isInclusive() {
        Span outer = new Span(10, 20);

        assertThat(outer.contains(new Span(10, 20))).isTrue();
        assertThat(outer.contains(new Span(12, 15))).isTrue();
        assertThat(outer.contains(Span.empty(20))).isTrue();
        assertThat(outer.contains(new Span(9, 15))).isFalse();
        assertThat(outer.contains(new Span(15, 21))).isFalse();
    }

    @Test
    void overlaps_withAdjacentSpans_returnsFalse() {
        assertThat(new Span(0, 5).overlaps(new Span(5, 10))).isFalse();
        assertThat(new Span(0, 5).overlaps(new Span(4, 10))).isTrue();
    }

    @Test
    void overlaps_withZeroWidthSpan_usesContainment() {
        Span statement = new Span(0, 10);

        assertThat(statement.overlaps(Span.empty(3))).isTrue();
        assertThat(Span.empty(3).overlaps(statement)).isTrue();
        assertThat(statement.overlaps(Span.empty(11))).isFalse();
    }

    @Test
    void compareTo_ordersByStartThenEnd() {
        assertThat(new Span(1, 5)).isLessThan(new Span(2, 3));
        assertThat(new Span(1, 3)).isLessThan(new Span(1, 5));
        assertThat(new Span(1, 3).compareTo(new Span(1, 3))).isZero();
    }

    @Test
    void covering_returnsSmallestEnclosingSpan() {
        assertThat(Span.covering(new Span(4, 6), new Span(10, 12))).isEqualTo(new Span(4, 12));
    }
}
