package com.modelicaformatter.plugins.modelica.stages;

import com.modelicaformatter.plugins.modelica.FormatContext;
import com.modelicaformatter.plugins.modelica.FormatStage;

/**
 * First stage: line terminators become {@code \n}, comment markers split by whitespace are
 * rejoined, and the identifier-tightening table is applied.
 */
public class Preprocessor implements FormatStage {

    static final RewriteRule LINE_ENDINGS = RewriteRule.of("line-endings", "\\r\\n?", "\n");

    // "/ /" left behind by editors or earlier tools; "/ /*" is a division followed by a block comment
    static final RewriteRule COMMENT_MARKER = RewriteRule.of("comment-marker", "/[ \\t]+/(?!\\*)", "//");

    @Override
    public String name() {
        return "preprocess";
    }

    @Override
    public String apply(String text, FormatContext context) {
        String result = LINE_ENDINGS.apply(text);
        result = COMMENT_MARKER.apply(result);
        return context.getTightening().apply(result);
    }
}
