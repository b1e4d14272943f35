package com.modelicaformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.api.error.Severity;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorFormatter Tests")
class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    @DisplayName("Should render severity, code, message and line")
    void shouldFormatError() {
        FormatterError error = FormatterError.warning("UNMATCHED_BRANCH", "else without if", 3);

        assertThat(plain.formatError(error)).isEqualTo("WARNING [UNMATCHED_BRANCH]: else without if (Line 3)");
    }

    @Test
    @DisplayName("Should add the suggestion on its own line")
    void shouldFormatSuggestion() {
        FormatterError error = new FormatterError(Severity.ERROR, "bad input", 2, 1, "fix it");

        assertThat(plain.formatError(error)).isEqualTo("ERROR: bad input (Line 2)\n  Suggestion: fix it");
    }

    @Test
    @DisplayName("Should count diagnostics per file and in total")
    void shouldSummarize() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Paths.get("lib/A.mo"), List.of(
                FormatterError.warning("UNMATCHED_BRANCH", "x", 3),
                FormatterError.warning("UNMATCHED_BLOCK_END", "y", 4)));
        errors.put(Paths.get("lib/B.mo"), List.of(FormatterError.fatal("boom")));
        errors.put(Paths.get("lib/C.mo"), List.of());

        String summary = plain.formatErrorSummary(errors);

        assertThat(summary).isEqualTo("Diagnostic Summary:\n"
                + "A.mo: 2 warning\n"
                + "B.mo: 1 fatal\n"
                + "\nTotal: 1 fatal, 2 warning");
    }

    @Test
    @DisplayName("Should say so when there are no diagnostics")
    void shouldSummarizeNothing() {
        assertThat(plain.formatErrorSummary(Map.of())).endsWith("Total: no diagnostics");
    }

    @Test
    @DisplayName("Should group diagnostics by severity")
    void shouldGroupBySeverity() {
        FormatterError warning = FormatterError.warning("UNCLOSED_BLOCK", "open", 9);
        FormatterError fatal = FormatterError.fatal("boom");

        Map<Severity, List<FormatterError>> grouped = plain.groupBySeverity(List.of(warning, fatal));

        assertThat(grouped.keySet()).containsExactly(Severity.FATAL, Severity.WARNING);
        assertThat(grouped.get(Severity.WARNING)).containsExactly(warning);
    }

    @Test
    @DisplayName("Should wrap text in ANSI codes only when colors are on")
    void shouldColorize() {
        ErrorFormatter colored = new ErrorFormatter(true);

        assertThat(colored.colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }
}
