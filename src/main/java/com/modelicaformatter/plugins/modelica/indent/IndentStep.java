package com.modelicaformatter.plugins.modelica.indent;

import java.util.List;

import com.modelicaformatter.api.error.FormatterError;

/**
 * Output of processing one line: the re-indented line, the context for the next line, and any
 * diagnostics raised on the way.
 */
public final class IndentStep {
    private final String emitted;
    private final IndentContext next;
    private final List<FormatterError> diagnostics;

    public IndentStep(String emitted, IndentContext next, List<FormatterError> diagnostics) {
        this.emitted = emitted;
        this.next = next;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getEmitted() {
        return emitted;
    }

    public IndentContext getNext() {
        return next;
    }

    public List<FormatterError> getDiagnostics() {
        return diagnostics;
    }
}
