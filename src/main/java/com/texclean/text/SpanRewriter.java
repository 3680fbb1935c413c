package com.texclean.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies a batch of replacements that were all computed against the same snapshot of a text.
 * Spans are applied from the rightmost to the leftmost so that earlier offsets stay valid.
 */
public final class SpanRewriter {
    private SpanRewriter() {
    }

    public static String apply(String text, List<TextSpan> spans) {
        if (spans.isEmpty()) {
            return text;
        }
        List<TextSpan> ordered = new ArrayList<>(spans);
        ordered.sort(Comparator.comparingInt(TextSpan::start).thenComparingInt(TextSpan::end).reversed());

        StringBuilder builder = new StringBuilder(text);
        int lowestStart = text.length();
        for (TextSpan span : ordered) {
            if (span.end() > text.length()) {
                throw new IllegalArgumentException("Span " + span + " exceeds text length " + text.length());
            }
            if (span.end() > lowestStart) {
                throw new IllegalArgumentException("Span " + span + " overlaps a span starting at " + lowestStart);
            }
            builder.replace(span.start(), span.end(), span.replacement());
            lowestStart = span.start();
        }
        return builder.toString();
    }
}
