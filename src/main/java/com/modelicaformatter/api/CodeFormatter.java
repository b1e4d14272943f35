package com.modelicaformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point used by the CLI: formats single sources or whole directory trees.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
