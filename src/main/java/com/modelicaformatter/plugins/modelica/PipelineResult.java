package com.modelicaformatter.plugins.modelica;

import java.util.List;

import com.modelicaformatter.api.AppliedRewrite;
import com.modelicaformatter.api.error.FormatterError;

/**
 * Formatted text together with the diagnostics and per-stage changes collected on the way.
 */
public class PipelineResult {
    private final String text;
    private final List<FormatterError> diagnostics;
    private final List<AppliedRewrite> rewrites;

    public PipelineResult(String text, List<FormatterError> diagnostics, List<AppliedRewrite> rewrites) {
        this.text = text;
        this.diagnostics = List.copyOf(diagnostics);
        this.rewrites = List.copyOf(rewrites);
    }

    public String getText() {
        return text;
    }

    public List<FormatterError> getDiagnostics() {
        return diagnostics;
    }

    public List<AppliedRewrite> getRewrites() {
        return rewrites;
    }
}
