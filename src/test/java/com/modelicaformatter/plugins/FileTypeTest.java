package com.modelicaformatter.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileType Tests")
class FileTypeTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        FileType.clearCache();
    }

    @Test
    @DisplayName("Should detect Modelica files by extension")
    void shouldDetectByExtension() {
        assertThat(FileType.detect(Paths.get("lib/Pump.mo"))).isEqualTo(FileType.MODELICA);
        assertThat(FileType.detect(Paths.get("lib/PUMP.MO"))).isEqualTo(FileType.MODELICA);
        assertThat(FileType.detect(Paths.get("lib/package.order"))).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.detect(Paths.get("lib/notes.mos"))).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    @DisplayName("Should sniff extension-less files for Modelica content")
    void shouldDetectByContent() throws IOException {
        Path modelica = tempDir.resolve("Pump");
        Files.writeString(modelica, "// header\nwithin Lib;\nmodel Pump\nend Pump;\n");
        Path other = tempDir.resolve("README");
        Files.writeString(other, "Just some notes about the model.\n");

        assertThat(FileType.detect(modelica)).isEqualTo(FileType.MODELICA);
        assertThat(FileType.detect(other)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    @DisplayName("Should cache detection results")
    void shouldCacheResults() {
        FileType.clearCache();

        FileType.detect(Paths.get("A.mo"));
        FileType.detect(Paths.get("A.mo"));

        assertThat(FileType.getCacheSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should describe each type")
    void shouldDescribeTypes() {
        assertThat(FileType.MODELICA.getDescription()).isEqualTo("Modelica source file");
        assertThat(FileType.MODELICA.getExtension()).isEqualTo("mo");
    }
}
