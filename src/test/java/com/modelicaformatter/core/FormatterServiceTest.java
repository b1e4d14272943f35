package com.modelicaformatter.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.modelicaformatter.api.FormatterPlugin;
import com.modelicaformatter.api.FormatterResult;
import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.api.error.Severity;
import com.modelicaformatter.config.ConfigurationLoader;
import com.modelicaformatter.config.FormatterConfig;
import com.modelicaformatter.plugins.FileType;
import com.modelicaformatter.plugins.modelica.ModelicaFormatter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FormatterService Tests")
class FormatterServiceTest {

    @TempDir
    Path tempDir;

    private FormatterService service;

    @BeforeEach
    void setUp() {
        service = new FormatterService(ConfigurationLoader.loadDefaultConfig());
        service.registerPlugin(FileType.MODELICA, new ModelicaFormatter());
    }

    @AfterEach
    void tearDown() throws Exception {
        service.close();
        FileType.clearCache();
    }

    @Test
    @DisplayName("Should dispatch Modelica files to the registered plugin")
    void shouldFormatModelicaFile() {
        FormatterResult result = service.formatFile(Paths.get("A.mo"), "model A\nequation\nx=1;\nend A;\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).contains("    x = 1;");
        assertThat(service.getProcessedFileCount()).isEqualTo(1);
        assertThat(service.getSuccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail files without a plugin and keep their text")
    void shouldRejectUnknownFiles() {
        FormatterResult result = service.formatFile(Paths.get("notes.txt"), "x=1");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("x=1");
        assertThat(result.getErrors()).extracting(e -> e.getSeverity()).containsExactly(Severity.ERROR);
    }

    @Test
    @DisplayName("Should turn plugin exceptions into fatal results")
    void shouldContainPluginFailures() {
        service.registerPlugin(FileType.MODELICA, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("boom");
            }
        });

        FormatterResult result = service.formatFile(Paths.get("A.mo"), "model A\nend A;");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("model A\nend A;");
        assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(result.getErrors().get(0).getMessage()).contains("boom");
        assertThat(service.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should turn a stack overflow in a plugin into a fatal result")
    void shouldContainStackOverflow() {
        registerFailingPlugin(file -> {
            throw new StackOverflowError("regex recursion");
        });

        FormatterResult result = service.formatFile(Paths.get("A.mo"), "model A\nend A;");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("model A\nend A;");
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.FATAL);
        assertThat(result.getErrors().get(0).getMessage()).contains("regex recursion");
        assertThat(service.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should give a fatal result to a file whose worker died with an error")
    void shouldReportErrorsThrownInWorkers() throws IOException {
        Path good = Files.writeString(tempDir.resolve("Good.mo"), "model Good\nend Good;\n");
        Path bad = Files.writeString(tempDir.resolve("Bad.mo"), "model Bad\nend Bad;\n");
        registerFailingPlugin(file -> {
            if (file.getFileName().toString().equals("Bad.mo")) {
                throw new AssertionError("invariant broken");
            }
        });

        Map<Path, FormatterResult> results = service.formatFiles(List.of(good, bad), 2);

        assertThat(results).containsOnlyKeys(good, bad);
        assertThat(results.get(good).isSuccessful()).isTrue();
        assertThat(results.get(bad).isSuccessful()).isFalse();
        assertThat(results.get(bad).getErrors()).extracting(FormatterError::getSeverity)
                .containsExactly(Severity.FATAL);
        assertThat(results.get(bad).getErrors().get(0).getMessage()).contains("invariant broken");
        assertThat(service.getErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should format every Modelica file in a directory tree")
    void shouldFormatDirectory() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("Lib/Sub"));
        Files.writeString(tempDir.resolve("Lib/A.mo"), "model A\nequation\nx=1;\nend A;\n");
        Files.writeString(pkg.resolve("B.mo"), "model B\nequation\ny=2;\nend B;\n");
        Files.writeString(pkg.resolve("notes.txt"), "ignored");

        Map<Path, FormatterResult> results = service.formatDirectory(tempDir, 2);

        assertThat(results).hasSize(2);
        assertThat(results.values()).allMatch(FormatterResult::isSuccessful);
        assertThat(results.get(pkg.resolve("B.mo")).getFormattedCode()).contains("    y = 2;");
        // read only, nothing is written back
        assertThat(Files.readString(pkg.resolve("B.mo"))).isEqualTo("model B\nequation\ny=2;\nend B;\n");
    }

    @Test
    @DisplayName("Should report unreadable files as fatal results")
    void shouldReportUnreadableFiles() {
        Path missing = tempDir.resolve("Missing.mo");

        Map<Path, FormatterResult> results = service.formatFiles(List.of(missing), 1);

        assertThat(results.get(missing).isSuccessful()).isFalse();
        assertThat(results.get(missing).getErrors().get(0).getSeverity()).isEqualTo(Severity.FATAL);
    }

    @Test
    @DisplayName("Should return no results for a path that is not a directory")
    void shouldIgnoreNonDirectories() {
        assertThat(service.formatDirectory(tempDir.resolve("nope"))).isEmpty();
    }

    /**
     * Registers a Modelica plugin that runs {@code action} and otherwise returns the text unchanged.
     */
    private void registerFailingPlugin(Consumer<Path> action) {
        service.registerPlugin(FileType.MODELICA, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                action.accept(filePath);
                return FormatterResult.builder().successful(true).formattedCode(sourceCode).build();
            }
        });
    }

    @Test
    @DisplayName("Should drop plugins on close")
    void shouldDropPluginsOnClose() throws Exception {
        assertThat(service.hasPluginFor(FileType.MODELICA)).isTrue();

        service.close();

        assertThat(service.getPluginCount()).isZero();
    }
}
