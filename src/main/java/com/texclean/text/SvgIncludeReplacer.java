package com.texclean.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps {@code \includesvg} for {@code \includeinkscape} when Inkscape has already exported the drawing.
 */
public class SvgIncludeReplacer {
    private static final Pattern INCLUDE_SVG = Pattern.compile("\\\\includesvg(\\[.*?\\])?\\{(.*?)\\}");

    public String replace(String content, List<String> inkscapeExports) {
        Matcher matcher = INCLUDE_SVG.matcher(content);
        List<TextSpan> spans = new ArrayList<>();
        while (matcher.find()) {
            String svgPath = matcher.group(2);
            String suffix = "/" + baseName(svgPath) + "-tex.pdf_tex";
            List<String> candidates = inkscapeExports.stream()
                    .filter(export -> export.contains(suffix))
                    .toList();
            if (candidates.size() == 1) {
                String options = matcher.group(1) == null ? "" : matcher.group(1);
                spans.add(new TextSpan(matcher.start(), matcher.end(),
                        "\\includeinkscape" + options + "{" + candidates.get(0) + "}"));
            }
        }
        return SpanRewriter.apply(content, spans);
    }

    private static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
