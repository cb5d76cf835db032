package com.cppformatter.cli;

import com.cppformatter.api.FormatterResult;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.Severity;
import com.cppformatter.config.ConfigurationLoader;
import com.cppformatter.config.FormatterConfig;
import com.cppformatter.core.CppSourceFormatter;
import com.cppformatter.plugins.FileType;
import com.cppformatter.util.ErrorFormatter;
import com.cppformatter.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line interface for the C/C++ source formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".cppformat.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args) {
        boolean useColors = !_hasOption(args, "--no-color") && !_hasOption(args, "--ci");
        errorFormatter = new ErrorFormatter(useColors);

        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }

        String command = args[0];
        try {
            switch (command) {
                case "format":
                    return _processFiles(args, true);
                case "check":
                    return _processFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (_hasOption(args, "--verbose")) {
                e.printStackTrace();
            } else {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private static void _printVersion() {
        System.out.println("C/C++ Source Formatter version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "C/C++ Source Formatter CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  cppformat init [--force]          - Write the default configuration file");
        System.out.println("  cppformat format <path>           - Format files in path");
        System.out.println("  cppformat check <path>            - Report files that would change");
        System.out.println("  cppformat --help|-h               - Show this help");
        System.out.println("  cppformat --version|-v            - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (no colors, summary line)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include file names matching pattern");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    /**
     * Formats or checks every file under the path argument. In check mode
     * nothing is written and the exit code is 1 when any file would change.
     */
    private static int _processFiles(String[] args, boolean write) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String includePattern = _getOptionValue(args, "--include");
        int threads = _threadCount(_getOptionValue(args, "--threads"));
        FormatterConfig config = _loadConfig(_getOptionValue(args, "--config"));

        List<Path> files = _findFiles(path, config.getIgnorePatterns(), includePattern);
        _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));

        Instant start = Instant.now();
        Map<Path, FormatterResult> results;
        try (CppSourceFormatter formatter = CppSourceFormatter.withDefaultPlugins(config)) {
            results = formatter.formatFiles(files, threads);
        }

        int changed = 0;
        int unchanged = 0;
        int failed = 0;
        Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

        for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
            Path file = entry.getKey();
            FormatterResult result = entry.getValue();
            if (!result.getErrors().isEmpty()) {
                errorsByFile.put(file, result.getErrors());
            }

            if (!result.isSuccessful()) {
                _printError((write ? "Failed to format: " : "Cannot check: ") + file);
                result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                failed++;
                continue;
            }

            result.getErrors().forEach(e -> _printWarning("  " + file + " " + errorFormatter.formatError(e)));

            String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                _printError("Error reading file: " + file + " - " + e.getMessage());
                logger.log(Level.SEVERE, "Error reading file: " + file, e);
                failed++;
                continue;
            }

            if (source.equals(result.getFormattedCode())) {
                unchanged++;
                if (verbose) {
                    _printInfo("  Already formatted: " + file);
                }
                continue;
            }

            changed++;
            if (write) {
                try {
                    _writeAtomically(file, result.getFormattedCode());
                    _printSuccess("Formatted: " + file);
                } catch (IOException e) {
                    _printError("Error writing file: " + file + " - " + e.getMessage());
                    logger.log(Level.SEVERE, "Error writing file: " + file, e);
                    changed--;
                    failed++;
                    continue;
                }
            } else {
                _printWarning("File needs formatting: " + file);
            }

            if (verbose && !ciMode) {
                result.getAppliedRefactorings().forEach(r ->
                        _printInfo("    - " + errorFormatter.formatRefactoring(r)));
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        System.out.println("\n" + (write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
        System.out.println("  Processed files: " + results.size());
        System.out.println("  " + (write ? "Reformatted: " : "Files needing formatting: ") + changed);
        System.out.println("  Already formatted: " + unchanged);
        System.out.println("  Files with errors: " + failed);

        if (!errorsByFile.isEmpty() && !ciMode) {
            System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
        }
        if (ciMode) {
            long warnings = errorsByFile.values().stream()
                    .flatMap(List::stream)
                    .filter(e -> e.getSeverity() == Severity.WARNING)
                    .count();
            System.out.println("RESULT:files=" + results.size() + ";changed=" + changed
                    + ";failed=" + failed + ";warnings=" + warnings);
        }

        if (failed > 0 || (!write && changed > 0)) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static FormatterConfig _loadConfig(String configFile) {
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static int _threadCount(String threadsStr) {
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                int requested = Integer.parseInt(threadsStr);
                if (requested > 0) {
                    return requested;
                }
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads;
    }

    /**
     * Writes through a sibling temporary file and a move, so a reader sees
     * either the old or the new content.
     */
    static void _writeAtomically(Path file, String content) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported for " + file + ", replacing in place");
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(FormatterCli::_isSupported)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    private static boolean _isSupported(Path file) {
        return FileType.detect(file) != FileType.UNKNOWN;
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
        return matcher.matches(file.getFileName());
    }

    /**
     * Matches the path relative to the scanned directory against the
     * {@code ignoreFiles} globs. A leading {@code **}{@code /} also matches
     * at the top level.
     */
    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        Path relativePath = basePath.relativize(file);

        for (String pattern : ignorePatterns) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (matcher.matches(relativePath)) {
                return true;
            }
            if (pattern.startsWith("**/")) {
                PathMatcher topLevel = FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3));
                if (topLevel.matches(relativePath)) {
                    return true;
                }
            }
        }

        return false;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
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

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
