package com.texclean.conditional;

import java.util.regex.Pattern;

public record ConditionalToken(Type type, int start, int end, String text) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public enum Type {
        OPEN,
        ELSE,
        CLOSE
    }

    /** Token text with whitespace removed, so {@code \if 0} reads as {@code \if0}. */
    public String compactText() {
        return WHITESPACE.matcher(text).replaceAll("");
    }

    public String name() {
        String compact = compactText();
        return compact.startsWith("\\if") ? compact.substring(3) : "";
    }
}
