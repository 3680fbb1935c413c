package com.texclean.files;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.texclean.text.TextLines;

public class TexSourceReader {
    public static final String END_DOCUMENT = "\\end{document}";

    /** Reads the file as lines that keep their terminators, dropping everything after {@code \end{document}}. */
    public List<String> read(Path file) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return stripAfter(TextLines.split(content), END_DOCUMENT);
    }

    public static List<String> stripAfter(List<String> lines, String marker) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int markerIndex = line.indexOf(marker);
            if (markerIndex < 0) {
                continue;
            }
            int percent = line.indexOf('%');
            if (percent < 0 || percent > markerIndex) {
                return new ArrayList<>(lines.subList(0, i + 1));
            }
        }
        return new ArrayList<>(lines);
    }
}
