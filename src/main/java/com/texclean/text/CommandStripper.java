package com.texclean.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes {@code \command[opt]{argument}[opt]} invocations, optionally keeping the argument text.
 */
public class CommandStripper {

    public String strip(String text, String command, boolean keepText) {
        Pattern head = commandHead(command);
        String current = text;
        while (true) {
            List<TextSpan> spans = findInvocations(current, head, keepText);
            current = SpanRewriter.apply(current, spans);
            if (!keepText || spans.isEmpty()) {
                return current;
            }
        }
    }

    public String delete(String text, String command) {
        return strip(text, command, false);
    }

    public String unwrap(String text, String command) {
        return strip(text, command, true);
    }

    private List<TextSpan> findInvocations(String text, Pattern head, boolean keepText) {
        List<TextSpan> spans = new ArrayList<>();
        Matcher matcher = head.matcher(text);
        int from = 0;
        while (from < text.length() && matcher.find(from)) {
            int open = DelimiterMatcher.skipOptionGroups(text, matcher.end());
            int close = DelimiterMatcher.findClosingBrace(text, open);
            if (close == DelimiterMatcher.NO_MATCH) {
                from = matcher.end();
                continue;
            }
            int end = DelimiterMatcher.skipOptionGroups(text, close + 1);
            String replacement = keepText ? text.substring(open + 1, close) : deletionMarker(text, end);
            spans.add(new TextSpan(matcher.start(), end, replacement));
            from = end;
        }
        return spans;
    }

    // A lone invocation on its line leaves a '%' so the line break does not turn into a paragraph break.
    private static String deletionMarker(String text, int end) {
        if (end >= text.length()) {
            return "";
        }
        int newline = text.indexOf('\n', end);
        if (newline < 0) {
            return "";
        }
        return text.substring(end, newline).isBlank() ? "%" : "";
    }

    private static Pattern commandHead(String command) {
        return Pattern.compile("\\\\" + Pattern.quote(command) + "(?![A-Za-z@])");
    }
}
