package com.texclean.text;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpanRewriterTest {

    @Test
    void shouldApplySpansComputedAgainstTheSameSnapshot() {
        String text = "keep DROP keep REPLACE end";
        List<TextSpan> spans = List.of(
                TextSpan.deletion(5, 10),
                new TextSpan(15, 22, "new"));

        assertEquals("keep keep new end", SpanRewriter.apply(text, spans));
    }

    @Test
    void shouldNotDependOnSpanOrder() {
        String text = "abcdef";
        List<TextSpan> leftToRight = List.of(TextSpan.deletion(0, 1), TextSpan.deletion(2, 3), new TextSpan(5, 6, "X"));
        List<TextSpan> shuffled = List.of(new TextSpan(5, 6, "X"), TextSpan.deletion(0, 1), TextSpan.deletion(2, 3));

        assertEquals("bdeX", SpanRewriter.apply(text, leftToRight));
        assertEquals("bdeX", SpanRewriter.apply(text, shuffled));
    }

    @Test
    void shouldAcceptAdjacentSpans() {
        assertEquals("c", SpanRewriter.apply("abc", List.of(TextSpan.deletion(0, 1), TextSpan.deletion(1, 2))));
    }

    @Test
    void shouldRejectOverlappingSpans() {
        assertThrows(IllegalArgumentException.class,
                () -> SpanRewriter.apply("abcdef", List.of(TextSpan.deletion(0, 3), TextSpan.deletion(2, 4))));
    }

    @Test
    void shouldRejectSpansPastTheEnd() {
        assertThrows(IllegalArgumentException.class,
                () -> SpanRewriter.apply("abc", List.of(TextSpan.deletion(1, 4))));
    }
}
