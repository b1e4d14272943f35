package com.modelicaformatter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.modelicaformatter.api.error.FormatterError;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormatterResult Tests")
class FormatterResultTest {

    @Test
    @DisplayName("Should report a change only for successful results with different text")
    void shouldDetectChanges() {
        FormatterResult changed = FormatterResult.builder().successful(true).formattedCode("x = 1;").build();
        FormatterResult failed = FormatterResult.builder().successful(false).formattedCode("x = 1;").build();

        assertThat(changed.changes("x=1;")).isTrue();
        assertThat(changed.changes("x = 1;")).isFalse();
        assertThat(failed.changes("x=1;")).isFalse();
    }

    @Test
    @DisplayName("Should expose read-only lists")
    void shouldExposeReadOnlyLists() {
        FormatterResult result = FormatterResult.builder()
                .successful(true)
                .addError(FormatterError.warning("UNCLOSED_BLOCK", "open", 2))
                .appliedRewrites(List.of(new AppliedRewrite("indent", 2, 4, 3)))
                .build();

        assertThat(result.getAppliedRewrites().get(0).getDescription())
                .isEqualTo("indent changed 3 line(s) between lines 2 and 4");
        assertThatThrownBy(() -> result.getErrors().add(FormatterError.fatal("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
