package com.modelicaformatter.plugins.modelica.stages;

import java.util.List;

import com.modelicaformatter.plugins.modelica.FormatContext;
import com.modelicaformatter.plugins.modelica.FormatStage;

/**
 * Last stage: repairs comment markers once more, re-tightens signs of negative literals and
 * exponents, and re-applies the identifier-tightening table that the subtraction rule undid.
 */
public class FinalCleanup implements FormatStage {

    static final RewriteRule SPACE_BEFORE_NEGATIVE = RewriteRule.of("space-before-negative",
            "(?<=\\S)[ \\t]+-(\\d)", " -$1");

    static final RewriteRule NEGATIVE_AFTER_PAREN = RewriteRule.of("negative-after-paren",
            "\\([ \\t]*-[ \\t]*(\\d)", "(-$1");

    static final RewriteRule NEGATIVE_AFTER_BRACKET = RewriteRule.of("negative-after-bracket",
            "\\[[ \\t]*-[ \\t]*(\\d)", "[-$1");

    static final RewriteRule NEGATIVE_AFTER_COMMA = RewriteRule.of("negative-after-comma",
            ",[ \\t]*-[ \\t]*(\\d)", ", -$1");

    static final RewriteRule NEGATIVE_AFTER_EQUALS = RewriteRule.of("negative-after-equals",
            "=[ \\t]*-[ \\t]*(\\d)", "= -$1");

    static final RewriteRule EXPONENT = RewriteRule.of("exponent",
            "(\\b\\d+(?:\\.\\d*)?[eE])[ \\t]*([-+])[ \\t]*(\\d)", "$1$2$3");

    static final List<RewriteRule> SIGN_RULES = List.of(
            SPACE_BEFORE_NEGATIVE,
            NEGATIVE_AFTER_PAREN,
            NEGATIVE_AFTER_BRACKET,
            NEGATIVE_AFTER_COMMA,
            NEGATIVE_AFTER_EQUALS,
            EXPONENT);

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public String apply(String text, FormatContext context) {
        String result = Preprocessor.COMMENT_MARKER.apply(text);

        ProtectedRegions regions = ProtectedRegions.mask(result);
        result = regions.text();
        for (RewriteRule rule : SIGN_RULES) {
            result = rule.apply(result);
        }
        result = context.getTightening().apply(result);
        return regions.restore(result);
    }
}
