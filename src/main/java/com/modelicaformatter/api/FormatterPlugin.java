package com.modelicaformatter.api;

import java.nio.file.Path;

import com.modelicaformatter.config.FormatterConfig;

/**
 * A language-specific formatter registered with the service for one file type.
 */
public interface FormatterPlugin {
    /**
     * Called once on registration, before any {@link #format} call.
     */
    void initialize(FormatterConfig config);

    /**
     * Formats the full text of one file. Implementations must be safe to call concurrently.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
