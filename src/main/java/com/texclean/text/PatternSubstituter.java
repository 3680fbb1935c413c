package com.texclean.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites every match of a rule's pattern with its insertion template. Templates reference named groups
 * as {@code {name}}; {@code {{} and {@code }}} produce literal braces.
 */
public class PatternSubstituter {
    private static final Logger log = LoggerFactory.getLogger(PatternSubstituter.class);
    private static final Pattern PYTHON_NAMED_GROUP = Pattern.compile("\\(\\?P<");
    private static final Pattern PYTHON_BACKREFERENCE = Pattern.compile("\\(\\?P=(\\w+)\\)");
    private static final Pattern QUANTIFIER = Pattern.compile("\\{\\d+(,\\d*)?}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String apply(String content, List<SubstitutionRule> rules) {
        String current = content;
        for (SubstitutionRule rule : rules) {
            current = apply(current, rule);
        }
        return current;
    }

    public String apply(String content, SubstitutionRule rule) {
        log.info("Processing pattern: {}", rule.description());
        Pattern pattern = compile(rule.pattern());
        List<TemplatePart> template = parseTemplate(rule.insertion());
        String current = content;
        Matcher matcher = pattern.matcher(current);
        int from = 0;
        while (from <= current.length() && matcher.find(from)) {
            String insertion = fill(template, matcher);
            if (rule.stripWhitespace()) {
                insertion = stripWhitespace(insertion);
            }
            log.debug("Found {}", current.substring(matcher.start(), matcher.end()));
            log.debug("Replacing with {}", insertion);
            int start = matcher.start();
            current = SpanRewriter.apply(current, List.of(new TextSpan(start, matcher.end(), insertion)));
            from = start + insertion.length();
            if (matcher.end() == start && insertion.isEmpty()) {
                from++;
            }
            matcher = pattern.matcher(current);
        }
        log.info("Finished pattern: {}", rule.description());
        return current;
    }

    public static String stripWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }

    static Pattern compile(String pattern) {
        String named = PYTHON_NAMED_GROUP.matcher(pattern).replaceAll("(?<");
        named = PYTHON_BACKREFERENCE.matcher(named).replaceAll("\\\\k<$1>");
        return Pattern.compile(escapeLiteralBraces(named));
    }

    // Python treats a '{' that does not start a quantifier as a literal; java.util.regex rejects it.
    static String escapeLiteralBraces(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        boolean inClass = false;
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                out.append(c).append(pattern.charAt(i + 1));
                i += 2;
                continue;
            }
            if (inClass) {
                inClass = c != ']';
            } else if (c == '[') {
                inClass = true;
            } else if (c == '{' && !QUANTIFIER.matcher(pattern).region(i, pattern.length()).lookingAt()) {
                out.append('\\');
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    static List<TemplatePart> parseTemplate(String insertion) {
        List<TemplatePart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < insertion.length()) {
            char c = insertion.charAt(i);
            if (c == '{' && i + 1 < insertion.length() && insertion.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < insertion.length() && insertion.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '{') {
                int close = insertion.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated placeholder in insertion: " + insertion);
                }
                if (literal.length() > 0) {
                    parts.add(TemplatePart.literal(literal.toString()));
                    literal.setLength(0);
                }
                parts.add(TemplatePart.group(insertion.substring(i + 1, close).trim()));
                i = close + 1;
            } else if (c == '}') {
                throw new IllegalArgumentException("Single '}' in insertion: " + insertion);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(TemplatePart.literal(literal.toString()));
        }
        return parts;
    }

    private static String fill(List<TemplatePart> template, Matcher matcher) {
        StringBuilder out = new StringBuilder();
        for (TemplatePart part : template) {
            if (part.group() == null) {
                out.append(part.literal());
            } else {
                String value = matcher.group(part.group());
                out.append(value == null ? "" : value);
            }
        }
        return out.toString();
    }

    record TemplatePart(String literal, String group) {
        static TemplatePart literal(String text) {
            return new TemplatePart(text, null);
        }

        static TemplatePart group(String name) {
            return new TemplatePart(null, name);
        }
    }
}
