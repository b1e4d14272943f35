package com.modelicaformatter.plugins.modelica.stages;

import static org.assertj.core.api.Assertions.assertThat;

import com.modelicaformatter.plugins.modelica.FormatContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FinalCleanup Tests")
class FinalCleanupTest {

    private final FinalCleanup cleanup = new FinalCleanup();

    private String clean(String text) {
        return cleanup.apply(text, FormatContext.withDefaults());
    }

    @Test
    @DisplayName("Should re-tighten identifiers spread out by the subtraction rule")
    void shouldRetightenIdentifiers() {
        assertThat(clean("    n = nUniHea - 1;")).isEqualTo("    n = nUniHea-1;");
    }

    @Test
    @DisplayName("Should re-tighten negative literal signs")
    void shouldRetightenSigns() {
        assertThat(clean("y = f( - 2);")).isEqualTo("y = f(-2);");
        assertThat(clean("y = v[ - 2];")).isEqualTo("y = v[-2];");
        assertThat(clean("y = {1,  - 2};")).isEqualTo("y = {1, -2};");
        assertThat(clean("x =  - 3;")).isEqualTo("x = -3;");
        assertThat(clean("y = a  -2;")).isEqualTo("y = a -2;");
    }

    @Test
    @DisplayName("Should re-tighten exponent signs")
    void shouldRetightenExponents() {
        assertThat(clean("x = 1e - 5;")).isEqualTo("x = 1e-5;");
        assertThat(clean("x = 2.0E + 3;")).isEqualTo("x = 2.0E+3;");
    }

    @Test
    @DisplayName("Should not tighten ordinary subtraction")
    void shouldKeepSubtraction() {
        assertThat(clean("x = 1 - 2;")).isEqualTo("x = 1 - 2;");
        assertThat(clean("x = time - 1;")).isEqualTo("x = time - 1;");
    }

    @Test
    @DisplayName("Should repair comment markers but leave strings alone")
    void shouldRepairCommentsOnly() {
        assertThat(clean("x = 1; / / c")).isEqualTo("x = 1; // c");
        assertThat(clean("s = \"( - 1)\";")).isEqualTo("s = \"( - 1)\";");
    }
}
