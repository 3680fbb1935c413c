package com.texclean.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class EnvironmentStripper {
    public static final String COMMENT_ENVIRONMENT = "comment";

    public String strip(String text, String environment) {
        Pattern block = Pattern.compile(
                "\\\\begin\\{" + Pattern.quote(environment) + "\\}[\\s\\S]*?\\\\end\\{" + Pattern.quote(environment) + "\\}");
        Matcher matcher = block.matcher(text);
        List<TextSpan> spans = new ArrayList<>();
        while (matcher.find()) {
            spans.add(TextSpan.deletion(matcher.start(), matcher.end()));
        }
        return SpanRewriter.apply(text, spans);
    }
}
