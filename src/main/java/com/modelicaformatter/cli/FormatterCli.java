package com.modelicaformatter.cli;

import com.modelicaformatter.api.FormatterResult;
import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.api.error.Severity;
import com.modelicaformatter.config.ConfigurationLoader;
import com.modelicaformatter.config.FormatterConfig;
import com.modelicaformatter.core.FormatterService;
import com.modelicaformatter.plugins.FileType;
import com.modelicaformatter.plugins.modelica.ModelicaFormatter;
import com.modelicaformatter.util.ErrorFormatter;
import com.modelicaformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line interface for the Modelica formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".modelicaformatter.yml";
    static final String STDIN_PATH = "-";

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final Path workingDirectory;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(PrintStream out, PrintStream err, InputStream in, Path workingDirectory) {
        this.out = out;
        this.err = err;
        this.in = in;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.out, System.err, System.in, Paths.get("")).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code: 0 on success, 1 when a file needs
     * formatting (check), a file failed, or the arguments are invalid.
     */
    public int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        }

        try {
            String command = args[0];
            switch (command) {
                case "format":
                    return _formatFiles(args);
                case "check":
                    return _checkFiles(args);
                case "analyze":
                    return _analyzeFiles(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (IllegalArgumentException e) {
            _printError("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace(err);
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return 1;
        }
    }

    private void _printVersion() {
        out.println("Modelica Formatter version " + VERSION);
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Modelica Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  modelica-format init [--force]      - Initialize configuration file");
        out.println("  modelica-format format <path>|-     - Format files in path, or stdin to stdout");
        out.println("  modelica-format check <path>        - Check files without formatting");
        out.println("  modelica-format analyze <path>      - Report unbalanced control structures");
        out.println("  modelica-format --help|-h           - Show this help");
        out.println("  modelica-format --version|-v        - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                     - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --tab-width=<n>                     - Spaces per indentation level");
        out.println("  --print-width=<n>                   - Preferred line width");
        out.println("  --verbose                           - Show detailed output");
        out.println("  --ci                                - CI friendly output (simplified)");
        out.println("  --no-color                          - Disable colored output");
        out.println("  --include=<glob>                    - Only include files matching pattern");
        out.println("  --threads=<num>                     - Number of threads to use (default: available processors)");
        out.println("  --force                             - Force overwrite (with init command)");
    }

    private int _formatFiles(String[] args) throws Exception {
        if (args.length < 2) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        FormatterConfig config = _loadConfig(args);
        if (STDIN_PATH.equals(args[1])) {
            return _formatStdin(config);
        }

        Path path = _resolve(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");

        try (FormatterService formatter = _createFormatter(config)) {
            List<Path> filesToFormat = _findFiles(path,
                    config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                    _getOptionValue(args, "--include"));

            _printInfo("Found " + filesToFormat.size() + " files to format");
            Instant start = Instant.now();

            Map<Path, FormatterResult> results = formatter.formatFiles(filesToFormat, _threadCount(args));
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int successCount = 0;
            int errorCount = 0;
            long totalLines = 0;

            for (Path file : filesToFormat) {
                FormatterResult result = results.get(file);
                try {
                    String source = Files.readString(file, StandardCharsets.UTF_8);
                    totalLines += source.split("\n", -1).length;

                    if (result != null && result.isSuccessful()) {
                        if (result.changes(source)) {
                            Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                            _printSuccess("Formatted: " + file);

                            if (!ciMode && verbose) {
                                result.getAppliedRewrites().forEach(r -> _printInfo("    - " + r.getDescription()));
                            }
                        } else if (verbose) {
                            _printInfo("  Already formatted: " + file);
                        }
                        if (!result.getErrors().isEmpty()) {
                            errorsByFile.put(file, result.getErrors());
                        }
                        successCount++;
                    } else {
                        _printError("Failed to format: " + file);
                        List<FormatterError> errors = result != null ? result.getErrors()
                                : List.of(FormatterError.fatal("File was not processed"));
                        errorsByFile.put(file, errors);
                        errors.forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                        errorCount++;
                    }
                } catch (IOException e) {
                    _printError("Error processing file: " + file);
                    _printError("  " + e.getMessage());
                    logger.log(Level.SEVERE, "Error processing file: " + file, e);
                    errorsByFile.put(file, List.of(new FormatterError(
                            Severity.FATAL, "Exception: " + e.getMessage(), 1, 1,
                            "Check the log file for details")));
                    errorCount++;
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            out.println("\nFormatting complete in " + _formatDuration(duration) + ":");
            out.println("  Processed files: " + filesToFormat.size());
            out.println("  Successfully formatted: " + successCount);
            out.println("  Files with errors: " + errorCount);
            out.println("  Total lines processed: " + totalLines);

            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            return errorCount > 0 ? 1 : 0;
        }
    }

    /**
     * Formats standard input to standard output. Diagnostics go to the error stream so the
     * output stays usable as a filter.
     */
    private int _formatStdin(FormatterConfig config) throws Exception {
        String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);

        try (FormatterService formatter = _createFormatter(config)) {
            FormatterResult result = formatter.formatFile(Paths.get("stdin.mo"), source);
            out.print(result.getFormattedCode() != null ? result.getFormattedCode() : source);
            out.flush();

            for (FormatterError error : result.getErrors()) {
                err.println(errorFormatter.formatError(error));
            }
            return result.isSuccessful() ? 0 : 1;
        }
    }

    private int _checkFiles(String[] args) throws Exception {
        if (args.length < 2) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = _resolve(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (FormatterService formatter = _createFormatter(config)) {
            List<Path> filesToCheck = _findFiles(path,
                    config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                    _getOptionValue(args, "--include"));

            _printInfo("Found " + filesToCheck.size() + " files to check");
            Instant start = Instant.now();

            Map<Path, FormatterResult> results = formatter.formatFiles(filesToCheck, _threadCount(args));
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int nonCompliantCount = 0;
            int errorCount = 0;

            for (Path file : filesToCheck) {
                FormatterResult result = results.get(file);
                try {
                    String source = Files.readString(file, StandardCharsets.UTF_8);

                    if (result == null || !result.isSuccessful()) {
                        _printError("Failed to check: " + file);
                        if (result != null) {
                            errorsByFile.put(file, result.getErrors());
                            result.getErrors().forEach(e -> _printError("    " + errorFormatter.formatError(e)));
                        }
                        errorCount++;
                    } else if (result.changes(source)) {
                        _printWarning("File needs formatting: " + file);
                        nonCompliantCount++;

                        if (verbose) {
                            result.getAppliedRewrites().forEach(r -> _printInfo("    - " + r.getDescription()));
                        }
                    } else if (verbose) {
                        _printSuccess("  OK: " + file);
                    }

                    if (result != null && result.isSuccessful() && !result.getErrors().isEmpty()) {
                        errorsByFile.put(file, result.getErrors());
                    }
                } catch (IOException e) {
                    _printError("Error checking file: " + file);
                    _printError("  " + e.getMessage());
                    logger.log(Level.SEVERE, "Error checking file: " + file, e);
                    errorCount++;
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            out.println("\nCheck complete in " + _formatDuration(duration) + ":");
            out.println("  Checked files: " + filesToCheck.size());
            out.println("  Files needing formatting: " + nonCompliantCount);
            out.println("  Files with processing errors: " + errorCount);

            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            return nonCompliantCount > 0 || errorCount > 0 ? 1 : 0;
        }
    }

    private int _analyzeFiles(String[] args) throws Exception {
        if (args.length < 2) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = _resolve(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        // analyze exists to report unbalanced blocks, whatever the configuration says
        FormatterConfig config = _loadConfig(args)
                .withPlugin(FormatterConfig.MODELICA_PLUGIN, "reportUnbalancedBlocks", true);

        try (FormatterService formatter = _createFormatter(config)) {
            List<Path> filesToCheck = _findFiles(path,
                    config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                    _getOptionValue(args, "--include"));

            _printInfo("Found " + filesToCheck.size() + " files to analyze");
            Instant start = Instant.now();

            Map<Path, FormatterResult> results = formatter.formatFiles(filesToCheck, _threadCount(args));
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int issueCount = 0;

            for (Path file : filesToCheck) {
                FormatterResult result = results.get(file);
                List<FormatterError> errors = result != null ? result.getErrors()
                        : List.of(FormatterError.fatal("File was not processed"));

                if (errors.isEmpty()) {
                    if (verbose) {
                        _printSuccess("  No issues found: " + file);
                    }
                    continue;
                }

                errorsByFile.put(file, errors);
                issueCount += errors.size();

                if (!ciMode) {
                    out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, file + ":"));
                    Map<Severity, List<FormatterError>> errorsBySeverity = errorFormatter.groupBySeverity(errors);
                    for (Severity severity : Severity.values()) {
                        _printErrorsBySeverity(errorsBySeverity, severity);
                    }
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            out.println("\nAnalysis complete in " + _formatDuration(duration) + ":");

            long filesWithErrors = _countFilesWith(errorsByFile, Severity.FATAL, Severity.ERROR);
            long filesWithWarnings = _countFilesWith(errorsByFile, Severity.WARNING);
            long filesWithInfo = _countFilesWith(errorsByFile, Severity.INFO);

            out.println("  Files analyzed: " + filesToCheck.size());
            out.println("  Total issues found: " + issueCount);
            out.println("  Files with errors: " + filesWithErrors);
            out.println("  Files with warnings: " + filesWithWarnings);
            out.println("  Files with notes: " + filesWithInfo);

            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }

            if (ciMode) {
                out.println("RESULT:files=" + filesToCheck.size() +
                        ";errors=" + filesWithErrors +
                        ";warnings=" + filesWithWarnings +
                        ";info=" + filesWithInfo +
                        ";issues=" + issueCount);
            }

            return filesWithErrors > 0 ? 1 : 0;
        }
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configOption = _getOptionValue(args, "--config");
        Path configPath = _resolve(configOption != null ? configOption : CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return 0;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    /**
     * Loads the configuration file and applies the command-line overrides on top of it.
     */
    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config;
        if (configFile != null) {
            config = ConfigurationLoader.loadConfig(_resolve(configFile));
        } else {
            config = ConfigurationLoader.loadConfig(_resolve(CONFIG_FILE_NAME));
        }

        String tabWidth = _getOptionValue(args, "--tab-width");
        if (tabWidth != null) {
            config = config.withGeneral("tabWidth", _parsePositive("--tab-width", tabWidth));
        }
        String printWidth = _getOptionValue(args, "--print-width");
        if (printWidth != null) {
            config = config.withGeneral("printWidth", _parsePositive("--print-width", printWidth));
        }
        return config;
    }

    private FormatterService _createFormatter(FormatterConfig config) {
        FormatterService formatter = new FormatterService(config);
        formatter.registerPlugin(FileType.MODELICA, new ModelicaFormatter());
        logger.fine("Initialized formatter with Modelica plugin");
        return formatter;
    }

    private List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> FileType.detect(p) != FileType.UNKNOWN)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            return fileName.matches(_globToRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                if (relativePath.endsWith(pattern.substring(3))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 3))) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _globToRegex(String glob) {
        return glob.replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
    }

    private int _threadCount(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return Math.max(1, threads);
    }

    private static int _parsePositive(String option, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(option + " must be at least 1, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got " + value, e);
        }
    }

    private Path _resolve(String path) {
        return workingDirectory.resolve(path);
    }

    static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static long _countFilesWith(Map<Path, List<FormatterError>> errorsByFile, Severity... severities) {
        List<Severity> wanted = Arrays.asList(severities);
        return errorsByFile.values().stream()
                .filter(errors -> errors.stream().anyMatch(e -> wanted.contains(e.getSeverity())))
                .count();
    }

    private void _printErrorsBySeverity(Map<Severity, List<FormatterError>> errorsBySeverity, Severity severity) {
        List<FormatterError> errors = errorsBySeverity.get(severity);
        if (errors == null) {
            return;
        }
        for (FormatterError error : errors) {
            switch (severity) {
                case FATAL:
                case ERROR:
                    _printError("  " + errorFormatter.formatError(error));
                    break;
                case WARNING:
                    _printWarning("  " + errorFormatter.formatError(error));
                    break;
                case INFO:
                    _printInfo("  " + errorFormatter.formatError(error));
                    break;
            }
        }
    }

    static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
