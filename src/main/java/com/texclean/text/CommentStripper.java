package com.texclean.text;

import java.util.List;

/**
 * Removes LaTeX line comments. A {@code %} is a comment unless it is escaped by an odd number of
 * backslashes or sits inside the brace argument of one of the protected commands (e.g. the {@code url} command).
 * Lines carrying the {@value #AUTO_IGNORE_MARKER} marker are left alone.
 */
public class CommentStripper {
    public static final String AUTO_IGNORE_MARKER = "auto-ignore";
    public static final List<String> DEFAULT_PROTECTED_COMMANDS = List.of("url", "href");

    private final List<String> protectedCommands;

    public CommentStripper() {
        this(DEFAULT_PROTECTED_COMMANDS);
    }

    public CommentStripper(List<String> protectedCommands) {
        this.protectedCommands = List.copyOf(protectedCommands);
    }

    public String strip(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (String line : TextLines.split(text)) {
            out.append(stripLine(line));
        }
        return out.toString();
    }

    public String stripLine(String line) {
        if (line.contains(AUTO_IGNORE_MARKER)) {
            return line;
        }
        if (line.isEmpty()) {
            return line;
        }
        if (startsWithComment(line)) {
            return "";
        }
        int comment = findCommentStart(line);
        if (comment < 0) {
            return line.endsWith("\n") ? line : line + "\n";
        }
        return SpanRewriter.apply(line, List.of(new TextSpan(comment + 1, line.length(), "\n")));
    }

    int findCommentStart(String line) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '%') {
                return i;
            }
            if (c == '\\') {
                int protectedEnd = protectedSpanEnd(line, i);
                i = protectedEnd > 0 ? protectedEnd : i + 2;
                continue;
            }
            i++;
        }
        return -1;
    }

    private int protectedSpanEnd(String line, int backslash) {
        for (String command : protectedCommands) {
            int nameEnd = backslash + 1 + command.length();
            if (!line.startsWith(command, backslash + 1)) {
                continue;
            }
            if (nameEnd < line.length() && Character.isLetter(line.charAt(nameEnd))) {
                continue;
            }
            int open = nameEnd;
            while (open < line.length() && (line.charAt(open) == ' ' || line.charAt(open) == '\t')) {
                open++;
            }
            int close = DelimiterMatcher.findClosingBrace(line, open);
            if (close != DelimiterMatcher.NO_MATCH) {
                return close + 1;
            }
        }
        return -1;
    }

    private static boolean startsWithComment(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i < line.length() && line.charAt(i) == '%';
    }
}
