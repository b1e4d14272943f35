package com.modelicaformatter.plugins.modelica.stages;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProtectedRegions Tests")
class ProtectedRegionsTest {

    @Test
    @DisplayName("Should mask strings, quoted identifiers and comments")
    void shouldMaskRegions() {
        String text = "s = \"a//b\"; // tail\nq = 'x y' + 1; /* a\nb */ z = 2;";

        ProtectedRegions regions = ProtectedRegions.mask(text);

        assertThat(regions.getRegions())
                .containsExactly("\"a//b\"", "// tail", "'x y'", "/* a\nb */");
        assertThat(regions.text()).doesNotContain("a//b", "tail", "x y");
        assertThat(regions.text()).contains("q = ", " + 1; ", " z = 2;");
        assertThat(regions.restore(regions.text())).isEqualTo(text);
    }

    @Test
    @DisplayName("Should keep escaped quotes inside strings")
    void shouldHandleEscapedQuotes() {
        String text = "s = \"say \\\"hi\\\"\" + t;";

        ProtectedRegions regions = ProtectedRegions.mask(text);

        assertThat(regions.getRegions()).containsExactly("\"say \\\"hi\\\"\"");
        assertThat(regions.text()).endsWith(" + t;");
    }

    @Test
    @DisplayName("Should protect an unterminated string up to the end of the text")
    void shouldProtectUnterminatedString() {
        ProtectedRegions regions = ProtectedRegions.mask("x = \"open\ny = 1;");

        assertThat(regions.getRegions()).containsExactly("\"open\ny = 1;");
    }

    @Test
    @DisplayName("Should leave a lone single quote in place")
    void shouldIgnoreLoneQuote() {
        ProtectedRegions regions = ProtectedRegions.mask("x = a';\ny = b';");

        assertThat(regions.getRegions()).isEmpty();
        assertThat(regions.text()).isEqualTo("x = a';\ny = b';");
    }

    @Test
    @DisplayName("Should restore placeholders moved by rewrites")
    void shouldRestoreAfterRewrite() {
        ProtectedRegions regions = ProtectedRegions.mask("a=\"s\";");
        String rewritten = regions.text().replace("=", " = ");

        assertThat(regions.restore(rewritten)).isEqualTo("a = \"s\";");
    }

    @Test
    @DisplayName("Should not mask text that already contains placeholder characters")
    void shouldSkipTextWithPlaceholderCharacters() {
        String text = "x = \"a\" " + ProtectedRegions.OPEN + ";";

        ProtectedRegions regions = ProtectedRegions.mask(text);

        assertThat(regions.getRegions()).isEmpty();
        assertThat(regions.restore(regions.text())).isEqualTo(text);
    }

    @Test
    @DisplayName("Should number more than ten regions correctly")
    void shouldHandleManyRegions() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            text.append("s").append(i).append(" = \"v").append(i).append("\";\n");
        }

        ProtectedRegions regions = ProtectedRegions.mask(text.toString());

        assertThat(regions.getRegions()).hasSize(25);
        assertThat(regions.restore(regions.text())).isEqualTo(text.toString());
    }
}
