package com.texclean.reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.texclean.files.PathConvention;

/**
 * Decides whether a file is referenced as a brace argument, e.g. {@code \includegraphics{figs/plot}}.
 *
 * <p>Strict matching needs the exact relative path with its extension. Loose matching also accepts the
 * name without extension and without any number of leading directories, as long as the directories that
 * are given form a suffix of the real path: {@code to/img} matches {@code path/to/img.ext} while
 * {@code path/img} does not. Both modes ignore case, accept a leading {@code ./}, and allow whitespace or
 * {@code %} just inside the braces.
 */
public class ReferenceResolver {
    private final PathConvention pathConvention;

    public ReferenceResolver(PathConvention pathConvention) {
        this.pathConvention = pathConvention;
    }

    public boolean isReferenced(String filename, CharSequence contents, boolean strict) {
        return search(filename, contents, strict).isPresent();
    }

    public Optional<ReferenceMatch> search(String filename, CharSequence contents, boolean strict) {
        Matcher matcher = referencePattern(filename, strict).matcher(contents);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new ReferenceMatch(filename, matcher.start(), matcher.end(), matcher.group()));
    }

    /** Every referenced file, in input order. Several files may match the same reference. */
    public List<String> keepReferenced(Collection<String> filenames, CharSequence contents, boolean strict) {
        List<String> referenced = new ArrayList<>();
        for (String filename : filenames) {
            if (isReferenced(filename, contents, strict)) {
                referenced.add(filename);
            }
        }
        return referenced;
    }

    Pattern referencePattern(String filename, boolean strict) {
        String portable = pathConvention.toPortable(filename);
        String filenameRegex = strict ? Pattern.quote(portable) : looseRegex(portable);
        return Pattern.compile(
                "\\{[\\s%]*(?:\\./)?" + filenameRegex + "[\\s%]*\\}",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String looseRegex(String portable) {
        int slash = portable.lastIndexOf('/');
        String directory = slash < 0 ? "" : portable.substring(0, slash);
        String basename = portable.substring(slash + 1);

        int dot = basename.lastIndexOf('.');
        String basenameRegex = dot > 0
                ? Pattern.quote(basename.substring(0, dot)) + "(?:" + Pattern.quote(basename.substring(dot)) + ")?"
                : Pattern.quote(basename);

        String prefixRegex = "";
        if (!directory.isEmpty()) {
            for (String fragment : directory.split("/")) {
                if (fragment.isEmpty()) {
                    continue;
                }
                prefixRegex = "(?:" + prefixRegex + Pattern.quote(fragment + "/") + ")?";
            }
        }
        return prefixRegex + basenameRegex;
    }
}
