package com.texclean.conditional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.texclean.text.SpanRewriter;
import com.texclean.text.TextSpan;

/**
 * Evaluates {@code \iffalse}/{@code \if0} and {@code \iftrue}/{@code \if1} blocks statically, deleting the
 * dead branch and the delimiters of the live one. Other conditionals are kept but searched for nested
 * resolvable blocks. Malformed nesting leaves the text untouched.
 */
public class ConditionalSimplifier {
    private static final Logger log = LoggerFactory.getLogger(ConditionalSimplifier.class);

    public static final List<String> DEFAULT_EXCEPTIONS = List.of(
            "iff",
            "ifthenelse",
            "ifbool",
            "iftoggle",
            "ifdef",
            "ifndef",
            "ifundef",
            "ifdefstring",
            "ifdefempty",
            "ifstrequal",
            "ifstrempty",
            "ifblank",
            "ifnumcomp",
            "ifdimcomp",
            "ifcsdef",
            "ifcsundef",
            "ifboolexpr",
            "ifpackageloaded");

    private final ConditionalTokenizer tokenizer;
    private final ConditionalParser parser = new ConditionalParser();

    public ConditionalSimplifier() {
        this(List.of());
    }

    public ConditionalSimplifier(Collection<String> additionalExceptions) {
        Set<String> exceptions = new LinkedHashSet<>(DEFAULT_EXCEPTIONS);
        exceptions.addAll(additionalExceptions);
        this.tokenizer = new ConditionalTokenizer(exceptions);
    }

    public SimplificationResult simplify(String text) {
        ConditionalNode root;
        try {
            root = parser.parse(text, tokenizer.tokenize(text));
        } catch (MalformedConditionalException e) {
            log.debug("Leaving conditionals untouched: {}", e.getMessage());
            return SimplificationResult.aborted(text, e.diagnostic());
        }
        return SimplificationResult.simplified(SpanRewriter.apply(text, deletionSpans(text, root)));
    }

    List<TextSpan> deletionSpans(String text, ConditionalNode root) {
        List<TextSpan> spans = new ArrayList<>();
        Deque<ConditionalNode> pending = new ArrayDeque<>(root.thenChildren());
        while (!pending.isEmpty()) {
            ConditionalNode node = pending.pop();
            switch (node.kind()) {
                case RESOLVED_FALSE -> {
                    if (node.hasElse()) {
                        spans.add(deletion(text, node.open().start(), node.elseToken().end()));
                        spans.add(deletion(text, node.close().start(), node.close().end()));
                        pending.addAll(node.elseChildren());
                    } else {
                        spans.add(deletion(text, node.open().start(), node.close().end()));
                    }
                }
                case RESOLVED_TRUE -> {
                    spans.add(deletion(text, node.open().start(), node.open().end()));
                    pending.addAll(node.thenChildren());
                    if (node.hasElse()) {
                        spans.add(deletion(text, node.elseToken().start(), node.close().end()));
                    } else {
                        spans.add(deletion(text, node.close().start(), node.close().end()));
                    }
                }
                case UNKNOWN -> {
                    pending.addAll(node.thenChildren());
                    pending.addAll(node.elseChildren());
                }
            }
        }
        return spans;
    }

    // Swallows a single whitespace character after the span so a removed line leaves no blank line.
    private static TextSpan deletion(String text, int start, int end) {
        int extended = end < text.length() && Character.isWhitespace(text.charAt(end)) ? end + 1 : end;
        return TextSpan.deletion(start, extended);
    }
}
