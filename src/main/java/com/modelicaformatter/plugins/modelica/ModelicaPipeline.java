package com.modelicaformatter.plugins.modelica;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import com.modelicaformatter.api.AppliedRewrite;
import com.modelicaformatter.config.FormatOptions;
import com.modelicaformatter.plugins.modelica.indent.ModelicaKeywords;
import com.modelicaformatter.plugins.modelica.stages.CorrectiveReindenter;
import com.modelicaformatter.plugins.modelica.stages.FinalCleanup;
import com.modelicaformatter.plugins.modelica.stages.IdentifierTightening;
import com.modelicaformatter.plugins.modelica.stages.IndentationEngine;
import com.modelicaformatter.plugins.modelica.stages.Preprocessor;
import com.modelicaformatter.plugins.modelica.stages.TokenNormalizer;
import com.modelicaformatter.util.LoggerUtil;

/**
 * Runs the formatting stages in order, each on the complete output of the previous one.
 * A pipeline holds no per-call state and can be shared between threads.
 */
public class ModelicaPipeline {
    private static final Logger logger = LoggerUtil.getLogger(ModelicaPipeline.class);

    private final List<FormatStage> stages;

    public ModelicaPipeline(List<FormatStage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * preprocess, indent, normalize, realign control keywords, clean up.
     */
    public static ModelicaPipeline standard() {
        return withKeywords(ModelicaKeywords.STANDARD);
    }

    /**
     * The standard stages with the extended keyword set for both indentation passes.
     */
    public static ModelicaPipeline extended() {
        return withKeywords(ModelicaKeywords.EXTENDED);
    }

    private static ModelicaPipeline withKeywords(ModelicaKeywords keywords) {
        return new ModelicaPipeline(List.of(
                new Preprocessor(),
                new IndentationEngine(keywords),
                new TokenNormalizer(),
                new CorrectiveReindenter(keywords),
                new FinalCleanup()));
    }

    public List<FormatStage> getStages() {
        return stages;
    }

    public String formatText(String text, FormatOptions options) {
        return format(text, options).getText();
    }

    public PipelineResult format(String text, FormatOptions options) {
        return format(text, new FormatContext(options, IdentifierTightening.defaults()));
    }

    public PipelineResult format(String text, FormatContext context) {
        Objects.requireNonNull(text, "text");
        List<AppliedRewrite> rewrites = new ArrayList<>();

        String current = text;
        for (FormatStage stage : stages) {
            String next = stage.apply(current, context);
            AppliedRewrite rewrite = describeChange(stage.name(), current, next);
            if (rewrite != null) {
                rewrites.add(rewrite);
            }
            current = next;
        }

        logger.fine(() -> "Formatted " + text.length() + " chars with " + rewrites.size()
                + " changing stage(s) and " + context.getDiagnostics().size() + " diagnostic(s)");
        return new PipelineResult(current, context.getDiagnostics(), rewrites);
    }

    /**
     * Line span that differs between two texts, found by trimming the common prefix and suffix.
     */
    static AppliedRewrite describeChange(String stage, String before, String after) {
        if (before.equals(after)) {
            return null;
        }
        String[] oldLines = before.split("\n", -1);
        String[] newLines = after.split("\n", -1);

        int prefix = 0;
        while (prefix < oldLines.length && prefix < newLines.length && oldLines[prefix].equals(newLines[prefix])) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < oldLines.length - prefix && suffix < newLines.length - prefix
                && oldLines[oldLines.length - 1 - suffix].equals(newLines[newLines.length - 1 - suffix])) {
            suffix++;
        }

        int startLine = prefix + 1;
        int endLine = Math.max(startLine, newLines.length - suffix);
        int changed = Math.max(oldLines.length, newLines.length) - prefix - suffix;
        return new AppliedRewrite(stage, startLine, endLine, Math.max(1, changed));
    }
}
