package com.texclean.reference;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least fixed point of "is mentioned by a reachable file". A candidate is mentioned when its path without
 * extension appears followed by {@code .} or {@code }} in the body of a file already reachable.
 *
 * <p>Each pass checks every remaining candidate against the bodies reachable at the start of the pass and
 * merges the hits afterwards, so the checks inside a pass are independent and may run in parallel.
 */
public class TransitiveReferenceClosure {
    private static final Logger log = LoggerFactory.getLogger(TransitiveReferenceClosure.class);

    private final boolean parallel;

    public TransitiveReferenceClosure() {
        this(false);
    }

    public TransitiveReferenceClosure(boolean parallel) {
        this.parallel = parallel;
    }

    public Set<String> compute(Map<String, String> bodies, Collection<String> roots) {
        Set<String> reachable = new LinkedHashSet<>(roots);
        Map<String, Pattern> mentions = new LinkedHashMap<>();
        for (String candidate : bodies.keySet()) {
            mentions.put(candidate, mentionPattern(candidate));
        }

        int pass = 0;
        while (true) {
            pass++;
            List<String> reachableBodies = reachable.stream()
                    .map(bodies::get)
                    .filter(Objects::nonNull)
                    .toList();
            Set<String> snapshot = Set.copyOf(reachable);
            Stream<String> remaining = mentions.keySet().stream()
                    .filter(candidate -> !snapshot.contains(candidate));
            if (parallel) {
                remaining = remaining.parallel();
            }
            List<String> added = remaining
                    .filter(candidate -> isMentioned(mentions.get(candidate), reachableBodies))
                    .toList();
            if (added.isEmpty()) {
                log.debug("Reference closure settled after {} passes with {} files", pass, reachable.size());
                return reachable;
            }
            reachable.addAll(added);
        }
    }

    private static boolean isMentioned(Pattern mention, List<String> bodies) {
        for (String body : bodies) {
            if (mention.matcher(body).find()) {
                return true;
            }
        }
        return false;
    }

    static Pattern mentionPattern(String filename) {
        return Pattern.compile(Pattern.quote(stripExtension(filename)) + "[.}]");
    }

    static String stripExtension(String filename) {
        int slash = filename.lastIndexOf('/');
        int dot = filename.lastIndexOf('.');
        return dot > slash + 1 ? filename.substring(0, dot) : filename;
    }
}
