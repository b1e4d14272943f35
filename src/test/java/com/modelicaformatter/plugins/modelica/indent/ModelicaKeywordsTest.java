package com.modelicaformatter.plugins.modelica.indent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ModelicaKeywords Tests")
class ModelicaKeywordsTest {

    @Nested
    @DisplayName("Standard keyword set")
    class Standard {

        private final ModelicaKeywords keywords = ModelicaKeywords.STANDARD;

        @Test
        @DisplayName("Should recognize only the seven class kinds followed by a space")
        void shouldRecognizeClassHeaders() {
            assertThat(keywords.opensClass("model Pump")).isTrue();
            assertThat(keywords.opensClass("block Controller")).isTrue();
            assertThat(keywords.opensClass("package Lib")).isTrue();
            assertThat(keywords.opensClass("function f")).isTrue();
            assertThat(keywords.opensClass("record R")).isTrue();
            assertThat(keywords.opensClass("connector Port")).isTrue();
            assertThat(keywords.opensClass("class C")).isTrue();

            assertThat(keywords.opensClass("partial model Pump")).isFalse();
            assertThat(keywords.opensClass("type Voltage = Real(unit=\"V\");")).isFalse();
            assertThat(keywords.opensClass("modelName = 3;")).isFalse();
            assertThat(keywords.opensClass("model")).isFalse();
        }

        @Test
        @DisplayName("Should never treat a class header as self-contained")
        void shouldNotDetectSelfContainedClasses() {
            assertThat(keywords.isSelfContainedClass("model M2 = M(k=2);")).isFalse();
            assertThat(keywords.isSelfContainedClass("record R Real x; end R;")).isFalse();
        }

        @Test
        @DisplayName("Should treat every end line except end if, end when and end for as a class end")
        void shouldSeparateClassEndsFromControlEnds() {
            assertThat(keywords.isClassEnd("end Pump;")).isTrue();
            assertThat(keywords.isClassEnd("end while;")).isTrue();
            assertThat(keywords.isClassEnd("end if;")).isFalse();
            assertThat(keywords.isClassEnd("end when;")).isFalse();
            assertThat(keywords.isClassEnd("end for;")).isFalse();
            assertThat(keywords.isClassEnd("end;")).isFalse();

            assertThat(keywords.closedBlock("end if;")).isEqualTo(ControlBlockKind.IF);
            assertThat(keywords.closedBlock("end when;")).isEqualTo(ControlBlockKind.WHEN);
            assertThat(keywords.closedBlock("end for;")).isEqualTo(ControlBlockKind.FOR);
            assertThat(keywords.closedBlock("end while;")).isNull();
            assertThat(keywords.closedBlock("end iffy;")).isNull();
        }

        @Test
        @DisplayName("Should recognize if, when and for openers by keyword and terminator")
        void shouldRecognizeOpeners() {
            assertThat(keywords.openedBlock("if x > 0 then")).isEqualTo(ControlBlockKind.IF);
            assertThat(keywords.openedBlock("when sample(0, 1) then")).isEqualTo(ControlBlockKind.WHEN);
            assertThat(keywords.openedBlock("for i in 1:n loop")).isEqualTo(ControlBlockKind.FOR);
            assertThat(keywords.openedBlock("while err > tol loop")).isNull();

            // if-expressions on one line are not blocks
            assertThat(keywords.openedBlock("if b then 1 else 2;")).isNull();
            assertThat(keywords.openedBlock("y = if b then 1 else 2;")).isNull();
            assertThat(keywords.openedBlock("for i in 1:n")).isNull();
        }

        @Test
        @DisplayName("Should recognize else and elseif as branches")
        void shouldRecognizeBranches() {
            assertThat(keywords.isBranch("else")).isTrue();
            assertThat(keywords.isBranch("elseif x < 0 then")).isTrue();

            assertThat(keywords.isBranch("elsewhen initial() then")).isFalse();
            assertThat(keywords.isBranch("elseValue = 2;")).isFalse();
            assertThat(keywords.isBranch("else;")).isFalse();
        }

        @Test
        @DisplayName("Should recognize line comments only")
        void shouldRecognizeComments() {
            assertThat(keywords.isComment("// note")).isTrue();
            assertThat(keywords.isComment("/* block */")).isFalse();
            assertThat(keywords.isComment("x = 1; // note")).isFalse();
        }
    }

    @Nested
    @DisplayName("Extended keyword set")
    class Extended {

        private final ModelicaKeywords keywords = ModelicaKeywords.EXTENDED;

        @Test
        @DisplayName("Should recognize class headers with prefixes")
        void shouldRecognizeClassHeaders() {
            assertThat(keywords.opensClass("partial block Controller")).isTrue();
            assertThat(keywords.opensClass("encapsulated package Lib")).isTrue();
            assertThat(keywords.opensClass("operator record Complex")).isTrue();
            assertThat(keywords.opensClass("type Voltage = Real(unit=\"V\");")).isTrue();

            assertThat(keywords.opensClass("Real x;")).isFalse();
        }

        @Test
        @DisplayName("Should treat short and one-line class definitions as self-contained")
        void shouldDetectSelfContainedClasses() {
            assertThat(keywords.isSelfContainedClass("type Voltage = Real(unit=\"V\");")).isTrue();
            assertThat(keywords.isSelfContainedClass("model M2 = M(k=2);")).isTrue();
            assertThat(keywords.isSelfContainedClass("record R Real x; end R;")).isTrue();

            assertThat(keywords.isSelfContainedClass("model Pump")).isFalse();
            assertThat(keywords.isSelfContainedClass("model Pump \"A pump\"")).isFalse();
        }

        @Test
        @DisplayName("Should add while loops, elsewhen and block comments")
        void shouldAddExtraControlSyntax() {
            assertThat(keywords.openedBlock("while err > tol loop")).isEqualTo(ControlBlockKind.WHILE);
            assertThat(keywords.closedBlock("end while;")).isEqualTo(ControlBlockKind.WHILE);
            assertThat(keywords.isClassEnd("end while;")).isFalse();
            assertThat(keywords.isBranch("elsewhen initial() then")).isTrue();
            assertThat(keywords.isComment("/* block */")).isTrue();
        }
    }

    @Test
    @DisplayName("Should tell the two keyword sets apart")
    void shouldTellKeywordSetsApart() {
        assertThat(ModelicaKeywords.EXTENDED.isExtended()).isTrue();
        assertThat(ModelicaKeywords.STANDARD.isExtended()).isFalse();
    }

    @Test
    @DisplayName("Should recognize section boundaries")
    void shouldRecognizeSectionBoundaries() {
        assertThat(ModelicaKeywords.isSectionBoundary("end")).isTrue();
        assertThat(ModelicaKeywords.isSectionBoundary("end;")).isTrue();
        assertThat(ModelicaKeywords.isSectionBoundary("public")).isTrue();
        assertThat(ModelicaKeywords.isSectionBoundary("protected")).isTrue();
        assertThat(ModelicaKeywords.isSectionBoundary("end Pump;")).isFalse();

        assertThat(ModelicaKeywords.isBareEnd("end;")).isTrue();
        assertThat(ModelicaKeywords.isBareEnd("protected")).isFalse();
    }

    @Test
    @DisplayName("Should detect continuation after an open parenthesis or comma")
    void shouldDetectContinuation() {
        assertThat(ModelicaKeywords.continuesAfter("    y = f(")).isTrue();
        assertThat(ModelicaKeywords.continuesAfter("  a,   ")).isTrue();
        assertThat(ModelicaKeywords.continuesAfter("  y = 1;")).isFalse();
        assertThat(ModelicaKeywords.continuesAfter(null)).isFalse();
    }
}
