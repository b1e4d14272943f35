package com.modelicaformatter.plugins.modelica;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.config.FormatOptions;
import com.modelicaformatter.plugins.modelica.stages.IdentifierTightening;

/**
 * Options and collected diagnostics for a single formatting invocation. Not shared between
 * invocations, so not thread-safe.
 */
public class FormatContext {
    private final FormatOptions options;
    private final IdentifierTightening tightening;
    private final List<FormatterError> diagnostics = new ArrayList<>();

    public FormatContext(FormatOptions options, IdentifierTightening tightening) {
        this.options = Objects.requireNonNull(options, "options");
        this.tightening = Objects.requireNonNull(tightening, "tightening");
    }

    public static FormatContext withDefaults() {
        return new FormatContext(FormatOptions.defaults(), IdentifierTightening.defaults());
    }

    public FormatOptions getOptions() {
        return options;
    }

    public IdentifierTightening getTightening() {
        return tightening;
    }

    public void report(FormatterError diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<FormatterError> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
