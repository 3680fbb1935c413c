package com.texclean.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps externalised TikZ pictures for an {@code \includegraphics} of the PDF that TikZ produced for them.
 */
public class TikzPictureReplacer {
    private static final Pattern PICTURE = Pattern.compile("\\\\tikzsetnextfilename\\{[\\s\\S]*?\\\\end\\{tikzpicture\\}");
    private static final Pattern FILE_NAME = Pattern.compile("\\\\tikzsetnextfilename\\{(.*?)\\}");

    public String replace(String content, List<String> externalFigures) {
        Matcher matcher = PICTURE.matcher(content);
        List<TextSpan> spans = new ArrayList<>();
        while (matcher.find()) {
            Matcher name = FILE_NAME.matcher(matcher.group());
            if (!name.find()) {
                continue;
            }
            String suffix = "/" + name.group(1) + ".pdf";
            List<String> candidates = externalFigures.stream()
                    .filter(figure -> figure.contains(suffix))
                    .toList();
            if (candidates.size() == 1) {
                spans.add(new TextSpan(matcher.start(), matcher.end(), "\\includegraphics{" + candidates.get(0) + "}"));
            }
        }
        return SpanRewriter.apply(content, spans);
    }
}
