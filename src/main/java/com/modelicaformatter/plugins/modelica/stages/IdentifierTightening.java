package com.modelicaformatter.plugins.modelica.stages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed table of domain-specific subtractions written without spaces, e.g. {@code nUniShc-1}.
 * Applied by the preprocessor and again by the final cleanup, because the general minus rule
 * spreads these back out to {@code nUniShc - 1}.
 */
public final class IdentifierTightening {
    public static final List<String> DEFAULT_IDENTIFIERS = List.of("nUniShc", "nUniHea", "nUniCoo");

    private static final Pattern VALID_IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    private final List<String> identifiers;
    private final List<RewriteRule> rules;

    public IdentifierTightening(List<String> identifiers) {
        List<String> accepted = new ArrayList<>();
        for (String identifier : identifiers) {
            if (identifier != null && VALID_IDENTIFIER.matcher(identifier).matches()) {
                accepted.add(identifier);
            }
        }
        this.identifiers = Collections.unmodifiableList(accepted);
        this.rules = _buildRules(this.identifiers);
    }

    public static IdentifierTightening defaults() {
        return new IdentifierTightening(DEFAULT_IDENTIFIERS);
    }

    public List<String> getIdentifiers() {
        return identifiers;
    }

    public List<RewriteRule> getRules() {
        return rules;
    }

    public String apply(String text) {
        String result = text;
        for (RewriteRule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    private static List<RewriteRule> _buildRules(List<String> identifiers) {
        List<RewriteRule> rules = new ArrayList<>();
        if (!identifiers.isEmpty()) {
            String names = identifiers.stream().map(Pattern::quote).collect(Collectors.joining("|"));
            rules.add(RewriteRule.of("name-minus-count",
                    "\\b(" + names + ")[ \\t]*-[ \\t]*(\\d+)\\b", "$1-$2"));
        }
        rules.add(RewriteRule.of("one-minus-cycle-ratio",
                "\\([ \\t]*1[ \\t]*-[ \\t]*ratCycShc[ \\t]*\\)", "(1-ratCycShc)"));
        rules.add(RewriteRule.of("units-plus-cycle-ratio",
                "\\(nUniShc[ \\t]*-[ \\t]*(\\d+)[ \\t]*\\+[ \\t]*ratCycShc[ \\t]*\\)", "(nUniShc-$1 + ratCycShc)"));
        return Collections.unmodifiableList(rules);
    }
}
