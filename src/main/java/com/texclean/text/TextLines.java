package com.texclean.text;

import java.util.ArrayList;
import java.util.List;

public final class TextLines {
    private TextLines() {
    }

    /** Splits after every {@code \n}; each line keeps its terminator and the last one may lack it. */
    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
