package com.modelicaformatter.plugins.modelica.stages;

import java.util.List;
import java.util.regex.MatchResult;

import com.modelicaformatter.plugins.modelica.FormatContext;
import com.modelicaformatter.plugins.modelica.FormatStage;

/**
 * Ordered whole-text substitutions for spacing. The order matters: the minus rules assume the
 * operator rule has already run, and the blank-line rules come last so they see final line content.
 * Strings, quoted identifiers and comments are masked while the rules run. No rule matches across a
 * line break.
 */
public class TokenNormalizer implements FormatStage {

    static final RewriteRule WITHIN_CLAUSE = RewriteRule.computed("within-clause",
            "\\bwithin(?:[ \\t]+([^;\\n]*?))?[ \\t]*;",
            (text, match) -> {
                String name = match.group(1) == null ? "" : match.group(1).replaceAll("\\s+", "");
                return name.isEmpty() ? "within;" : "within " + name + ";";
            });

    // blank runs are matched by a single character class; a repeated group would recurse per line
    static final RewriteRule BLANK_AFTER_WITHIN = RewriteRule.computed("blank-after-within",
            "(\\bwithin\\b[^;\\n]*;)[ \\t]*\\n([ \\t\\n]*\\n)?",
            TokenNormalizer::_oneBlankLineAfter);

    static final RewriteRule SPACE_AFTER_COMMA = RewriteRule.of("space-after-comma", ",(?=\\S)", ", ");

    // compound operators first so ":=" or "<=" are never split
    static final RewriteRule BINARY_OPERATORS = RewriteRule.computed("binary-operators",
            "([ \\t]*)(:=|==|<=|>=|<>|\\.[*/+]|[+*/=<>])[ \\t]*",
            TokenNormalizer::_spaceOperator);

    static final RewriteRule SUBTRACTION = RewriteRule.of("subtraction",
            "([\\w)\\]}])[ \\t]*-[ \\t]*", "$1 - ");

    static final RewriteRule NEGATIVE_LITERAL = RewriteRule.of("negative-literal",
            "(?m)(^|[,(\\[{=]|(?<![\\w)\\]}])[ \\t])-[ \\t]+(\\d)", "$1-$2");

    static final RewriteRule NEGATED_OPERAND = RewriteRule.of("negated-operand",
            "([*/+])[ \\t]*-[ \\t]+(\\d)", "$1 -$2");

    static final RewriteRule EXPONENT_SIGN = RewriteRule.of("exponent-sign",
            "(\\b\\d+(?:\\.\\d*)?[eE])[ \\t]*-[ \\t]*(\\d)", "$1-$2");

    static final RewriteRule ANNOTATION = RewriteRule.of("annotation",
            "\\bannotation[ \\t]*\\([ \\t]*", "annotation(");

    static final RewriteRule EMPTY_SLICE = RewriteRule.of("empty-slice", "\\[[ \\t]*:[ \\t]*\\]", "[:]");

    static final RewriteRule RANGE_COLON = RewriteRule.of("range-colon",
            "([\\w)])[ \\t]*:[ \\t]*([\\w(])", "$1:$2");

    static final RewriteRule INDEX_RANGE = RewriteRule.of("index-range",
            "(\\w+)[ \\t]*\\[[ \\t]*(\\d+)[ \\t]*:[ \\t]*(\\d+)[ \\t]*\\]", "$1[$2:$3]");

    static final RewriteRule WHOLE_SLICE = RewriteRule.of("whole-slice",
            "(\\w+)[ \\t]*\\[[ \\t]*:[ \\t]*\\]", "$1[:]");

    static final RewriteRule FOR_RANGE = RewriteRule.of("for-range",
            "\\bfor[ \\t]+(\\w+)[ \\t]+in[ \\t]+(\\d+)[ \\t]*:[ \\t]*(\\d+)", "for $1 in $2:$3");

    static final RewriteRule NEGATIVE_IN_BRACKET = RewriteRule.of("negative-in-bracket",
            "\\[[ \\t]*-[ \\t]*(\\d+)", "[-$1");

    static final RewriteRule NEGATIVE_IN_BRACE = RewriteRule.of("negative-in-brace",
            "\\{[ \\t]*-[ \\t]*(\\d+)", "{-$1");

    static final RewriteRule PREFIX_KEYWORDS = RewriteRule.of("prefix-keywords",
            "\\b(parameter|input|output|constant)\\b[ \\t]*(?=\\S)", "$1 ");

    static final RewriteRule TRAILING_WHITESPACE = RewriteRule.of("trailing-whitespace", "(?m)[ \\t]+$", "");

    static final RewriteRule BLANK_LINE_RUNS = RewriteRule.of("blank-line-runs", "\\n{3,}", "\n\n");

    static final RewriteRule BLANK_AFTER_SECTION = RewriteRule.computed("blank-after-section",
            "(?m)^([ \\t]*(?:initial equation|initial algorithm|equation|algorithm|public|protected))"
                    + "\\n([ \\t\\n]*\\n)?",
            TokenNormalizer::_oneBlankLineAfter);

    static final List<RewriteRule> RULES = List.of(
            WITHIN_CLAUSE,
            BLANK_AFTER_WITHIN,
            SPACE_AFTER_COMMA,
            BINARY_OPERATORS,
            SUBTRACTION,
            NEGATIVE_LITERAL,
            NEGATED_OPERAND,
            EXPONENT_SIGN,
            ANNOTATION,
            EMPTY_SLICE,
            RANGE_COLON,
            INDEX_RANGE,
            WHOLE_SLICE,
            FOR_RANGE,
            NEGATIVE_IN_BRACKET,
            NEGATIVE_IN_BRACE,
            PREFIX_KEYWORDS,
            TRAILING_WHITESPACE,
            BLANK_LINE_RUNS,
            BLANK_AFTER_SECTION);

    @Override
    public String name() {
        return "normalize";
    }

    @Override
    public String apply(String text, FormatContext context) {
        ProtectedRegions regions = ProtectedRegions.mask(text);
        String result = regions.text();
        for (RewriteRule rule : RULES) {
            result = rule.apply(result);
        }
        return regions.restore(result);
    }

    public static List<RewriteRule> getRules() {
        return RULES;
    }

    /**
     * One space on each side of the operator. At the start of a line the indentation is kept, and
     * when the previous match already supplied the separating space none is added.
     */
    private static String _spaceOperator(String text, MatchResult match) {
        int start = match.start();
        String leading = match.group(1);
        String operator = match.group(2);

        String prefix;
        if (start == 0 || text.charAt(start - 1) == '\n') {
            prefix = leading;
        } else if (leading.isEmpty() && _isBlank(text.charAt(start - 1))) {
            prefix = "";
        } else {
            prefix = " ";
        }
        return prefix + operator + " ";
    }

    /**
     * Replaces the line break and blank lines after group 1 with exactly one blank line. Nothing
     * changes when only whitespace follows up to the end of the text.
     */
    private static String _oneBlankLineAfter(String text, MatchResult match) {
        int end = match.end();
        while (end < text.length() && _isBlank(text.charAt(end))) {
            end++;
        }
        if (end == text.length()) {
            return match.group();
        }
        return match.group(1) + "\n\n";
    }

    private static boolean _isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
