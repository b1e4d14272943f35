package com.modelicaformatter.plugins.modelica.stages;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named regular-expression substitution applied to the whole text.
 */
public final class RewriteRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final BiFunction<String, MatchResult, String> replacer;

    private RewriteRule(String name, Pattern pattern, String replacement,
                        BiFunction<String, MatchResult, String> replacer) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = replacement;
        this.replacer = replacer;
    }

    /**
     * Rule with a {@link Matcher#replaceAll(String)} template; {@code $n} refers to groups.
     */
    public static RewriteRule of(String name, String regex, String replacement) {
        return new RewriteRule(name, Pattern.compile(regex), replacement, null);
    }

    /**
     * Rule whose replacement is computed per match. The function receives the complete input text
     * so it can inspect the characters around the match; its result is inserted literally.
     */
    public static RewriteRule computed(String name, String regex,
                                       BiFunction<String, MatchResult, String> replacer) {
        return new RewriteRule(name, Pattern.compile(regex), null, Objects.requireNonNull(replacer, "replacer"));
    }

    public String getName() {
        return name;
    }

    public String apply(String text) {
        Matcher matcher = pattern.matcher(text);
        if (replacer == null) {
            return matcher.replaceAll(replacement);
        }
        return matcher.replaceAll(match -> Matcher.quoteReplacement(replacer.apply(text, match)));
    }

    @Override
    public String toString() {
        return name + ": " + pattern.pattern();
    }
}
