package com.texclean.text;

public record TextSpan(int start, int end, String replacement) {
    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        replacement = replacement == null ? "" : replacement;
    }

    public static TextSpan deletion(int start, int end) {
        return new TextSpan(start, end, "");
    }
}
