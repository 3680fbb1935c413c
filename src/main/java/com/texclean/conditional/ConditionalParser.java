package com.texclean.conditional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the conditional tree with an explicit stack, so nesting depth is not bounded by the call stack.
 */
public class ConditionalParser {

    public ConditionalNode parse(String text, List<ConditionalToken> tokens) {
        ConditionalNode root = ConditionalNode.root();
        Deque<ConditionalNode> open = new ArrayDeque<>();
        open.push(root);

        for (ConditionalToken token : tokens) {
            ConditionalNode current = open.peek();
            switch (token.type()) {
                case OPEN -> open.push(current.openChild(ConditionalNode.classify(token), token));
                case ELSE -> {
                    if (current.isRoot()) {
                        throw malformed(ConditionalDiagnostic.Failure.UNMATCHED_ELSE, text, token, current);
                    }
                    if (current.hasElse()) {
                        throw malformed(ConditionalDiagnostic.Failure.DUPLICATE_ELSE, text, token, current);
                    }
                    current.markElse(token);
                }
                case CLOSE -> {
                    if (current.isRoot()) {
                        throw malformed(ConditionalDiagnostic.Failure.UNMATCHED_FI, text, token, current);
                    }
                    current.markClosed(token);
                    open.pop();
                }
            }
        }

        ConditionalNode dangling = open.peek();
        if (!dangling.isRoot()) {
            throw malformed(ConditionalDiagnostic.Failure.UNCLOSED_IF, text, dangling.open(), dangling.parent());
        }
        return root;
    }

    private static MalformedConditionalException malformed(
            ConditionalDiagnostic.Failure failure,
            String text,
            ConditionalToken offending,
            ConditionalNode innermost) {
        List<ConditionalDiagnostic.TokenLocation> ancestors = new ArrayList<>();
        for (ConditionalNode node = innermost; node != null && !node.isRoot(); node = node.parent()) {
            ancestors.add(0, locate(text, node.open()));
        }
        return new MalformedConditionalException(new ConditionalDiagnostic(failure, locate(text, offending), ancestors));
    }

    static ConditionalDiagnostic.TokenLocation locate(String text, ConditionalToken token) {
        int line = 1;
        for (int i = 0; i < token.start() && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return new ConditionalDiagnostic.TokenLocation(token.text(), token.start(), line);
    }
}
