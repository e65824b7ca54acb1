package com.askus.backend.routing.gate;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A named set of regular expressions. The rule matches when any of its
 * expressions is found in the lower-cased query.
 */
public final class PatternRule implements Predicate<String> {

    private final String name;
    private final List<Pattern> patterns;

    private PatternRule(String name, List<Pattern> patterns) {
        this.name = Objects.requireNonNull(name, "name");
        this.patterns = List.copyOf(patterns);
    }

    public static PatternRule of(String name, String... regexes) {
        if (regexes == null || regexes.length == 0) throw new IllegalArgumentException("rule " + name + " has no patterns");
        return new PatternRule(name, Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList());
    }

    /** Builds a rule matching any of the given words or phrases as whole words. */
    public static PatternRule anyWord(String name, String... words) {
        String alternation = String.join("|", Arrays.stream(words)
                .map(w -> Pattern.quote(w).replace(" ", "\\E\\s+\\Q"))
                .toList());
        return of(name, "\\b(?:" + alternation + ")\\b");
    }

    public String name() {
        return name;
    }

    @Override
    public boolean test(String text) {
        if (text == null || text.isEmpty()) return false;
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "PatternRule[" + name + "]";
    }
}
