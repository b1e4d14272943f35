package com.modelicaformatter.plugins.modelica;

/**
 * One full-text transformation of the Modelica formatting pipeline.
 * Stages keep no state between calls; everything per-invocation lives in the {@link FormatContext}.
 */
public interface FormatStage {
    String name();

    String apply(String text, FormatContext context);
}
