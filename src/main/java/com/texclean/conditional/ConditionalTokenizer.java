package com.texclean.conditional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scans text for primitive conditional tokens. Declarations such as {@code \newif\ifdraft} or
 * {@code \let\ifdraft\iftrue} are consumed without producing tokens, and so are commands in the exception
 * set (given without the backslash, e.g. {@code ifthenelse}), which look like conditionals but never take a
 * {@code \fi}.
 */
public class ConditionalTokenizer {
    private static final String NAME = "(?:[A-Za-z@]+|[0-9]+)";
    private static final Pattern TOKEN = Pattern.compile(
            "(?<declaration>\\\\(?:newif|let|def|gdef|edef|xdef)\\s*\\\\if[A-Za-z@]*(?:[ \\t]*=?[ \\t]*\\\\if" + NAME + ")?)"
                    + "|(?<open>\\\\if\\s*(?<name>" + NAME + ")|\\\\if(?![A-Za-z@]))"
                    + "|(?<else>\\\\else(?![A-Za-z@]))"
                    + "|(?<close>\\\\fi(?![A-Za-z@]))");

    private final Set<String> exceptions;

    public ConditionalTokenizer(Collection<String> exceptions) {
        this.exceptions = exceptions.stream()
                .map(name -> name.startsWith("\\") ? name.substring(1) : name)
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<ConditionalToken> tokenize(String text) {
        List<ConditionalToken> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            if (matcher.group("declaration") != null) {
                continue;
            }
            if (matcher.group("open") != null) {
                String name = matcher.group("name");
                if (name != null && exceptions.contains("if" + name)) {
                    continue;
                }
                tokens.add(new ConditionalToken(ConditionalToken.Type.OPEN, matcher.start(), matcher.end(), matcher.group()));
            } else if (matcher.group("else") != null) {
                tokens.add(new ConditionalToken(ConditionalToken.Type.ELSE, matcher.start(), matcher.end(), matcher.group()));
            } else {
                tokens.add(new ConditionalToken(ConditionalToken.Type.CLOSE, matcher.start(), matcher.end(), matcher.group()));
            }
        }
        return tokens;
    }
}
