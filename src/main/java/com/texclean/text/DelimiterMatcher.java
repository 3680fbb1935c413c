package com.texclean.text;

public final class DelimiterMatcher {
    public static final int NO_MATCH = -1;

    private DelimiterMatcher() {
    }

    /**
     * Returns the index of the brace closing the one at {@code openIndex}, or {@link #NO_MATCH} when
     * {@code openIndex} is not an opening brace or the braces are unbalanced up to the end of the text.
     * Braces escaped with a backslash ({@code \{}, {@code \}}) do not count.
     */
    public static int findClosingBrace(CharSequence text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '{') {
            return NO_MATCH;
        }
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return NO_MATCH;
    }

    /**
     * Returns the index just past a run of {@code [...]} option groups starting at {@code index}.
     * Groups must follow each other directly; an unterminated group ends the run before it.
     */
    public static int skipOptionGroups(CharSequence text, int index) {
        int i = index;
        while (i < text.length() && text.charAt(i) == '[') {
            int close = indexOf(text, ']', i + 1);
            if (close < 0) {
                break;
            }
            i = close + 1;
        }
        return i;
    }

    private static int indexOf(CharSequence text, char target, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                return i;
            }
        }
        return -1;
    }
}
