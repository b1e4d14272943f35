package com.modelicaformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.modelicaformatter.api.CodeFormatter;
import com.modelicaformatter.api.FormatterPlugin;
import com.modelicaformatter.api.FormatterResult;
import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.api.error.Severity;
import com.modelicaformatter.config.FormatterConfig;
import com.modelicaformatter.plugins.FileType;
import com.modelicaformatter.util.LoggerUtil;

/**
 * Dispatches files to the plugin registered for their {@link FileType} and formats directory
 * trees on a fixed thread pool. Plugin failures are turned into unsuccessful results carrying the
 * original text, never propagated.
 */
public class FormatterService implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(FormatterService.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public FormatterService(FormatterConfig config) {
        this.config = config;
    }

    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException | StackOverflowError e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(FormatterError.fatal("Unexpected error: " + e.getMessage()))
                    .build();
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every file under {@code directory} that has a registered plugin. Files are read
     * but not written back; the caller decides what to do with the results.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detect(path)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return formatFiles(filesToProcess, threadCount);
    }

    /**
     * Reads and formats the given files on a pool of {@code threadCount} workers. Files without a
     * registered plugin get an unsuccessful result, as does every file whose task died with an
     * error or did not finish in time.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        Map<Path, Future<?>> tasks = new LinkedHashMap<>();
        try {
            for (Path file : files) {
                tasks.put(file, executor.submit(() -> results.put(file, _readAndFormat(file))));
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        for (Map.Entry<Path, Future<?>> task : tasks.entrySet()) {
            if (!results.containsKey(task.getKey())) {
                results.put(task.getKey(), _failedTask(task.getKey(), task.getValue()));
            }
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private FormatterResult _failedTask(Path file, Future<?> task) {
        errorCount.incrementAndGet();
        String message;
        if (task.isDone() && !task.isCancelled()) {
            try {
                task.get();
                message = "Formatting produced no result";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                logger.log(Level.SEVERE, "Formatting task failed for file: " + file, cause);
                message = "Unexpected error: " + cause;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                message = "Processing interrupted";
            }
        } else {
            logger.warning("Formatting did not complete for file: " + file);
            message = "Formatting did not complete";
        }
        return FormatterResult.builder()
                .successful(false)
                .addError(FormatterError.fatal(message))
                .build();
    }

    private FormatterResult _readAndFormat(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            errorCount.incrementAndGet();
            return FormatterResult.builder()
                    .successful(false)
                    .addError(FormatterError.fatal("Failed to read file: " + e.getMessage()))
                    .build();
        }
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes every plugin that holds resources. The first failure is rethrown after all plugins
     * have been given the chance to close.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
