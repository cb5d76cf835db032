package com.cppformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.cppformatter.api.CodeFormatter;
import com.cppformatter.api.FormatterPlugin;
import com.cppformatter.api.FormatterResult;
import com.cppformatter.api.error.DiagnosticKind;
import com.cppformatter.api.error.FormatterError;
import com.cppformatter.api.error.Severity;
import com.cppformatter.config.FormatterConfig;
import com.cppformatter.plugins.FileType;
import com.cppformatter.plugins.cpp.CppFormatter;
import com.cppformatter.util.LoggerUtil;

/**
 * Thread-safe formatting service. Picks the plugin registered for a file's
 * type, runs it and keeps counters; directories and file lists are
 * processed on a fixed thread pool.
 */
public class CppSourceFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(CppSourceFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public CppSourceFormatter(FormatterConfig config) {
        this.config = config;
        logger.fine("Formatter initialized with " + config.getFormatConfiguration());
    }

    /**
     * A service with one {@link CppFormatter} registered for every C and C++ file type.
     */
    public static CppSourceFormatter withDefaultPlugins(FormatterConfig config) {
        CppSourceFormatter formatter = new CppSourceFormatter(config);
        CppFormatter plugin = new CppFormatter();
        for (FileType type : FileType.values()) {
            if (type != FileType.UNKNOWN) {
                formatter.registerPlugin(type, plugin);
            }
        }
        return formatter;
    }

    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
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
                    .addError(new FormatterError(
                            Severity.ERROR,
                            DiagnosticKind.INTERNAL_ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(FormatterError::toString)
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return failure(DiagnosticKind.INTERNAL_ERROR, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Formats every C or C++ file below {@code directory}.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return new ConcurrentHashMap<>();
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
            return new ConcurrentHashMap<>();
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return formatFiles(filesToProcess, threadCount);
    }

    @Override
    public Map<Path, FormatterResult> formatFiles(List<Path> files) {
        return formatFiles(files, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Reads and formats {@code files} on {@code threadCount} threads. The
     * returned map iterates in the order of {@code files}; nothing is
     * written back.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return new LinkedHashMap<>();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, formatFile(file, content));
                    } catch (IOException e) {
                        logger.log(Level.WARNING, "Failed to read file: " + file, e);
                        results.put(file, failure(DiagnosticKind.INTERNAL_ERROR,
                                "Failed to read file: " + e.getMessage()));
                    } catch (RuntimeException e) {
                        logger.log(Level.SEVERE, "Unexpected error processing file: " + file, e);
                        results.put(file, failure(DiagnosticKind.INTERNAL_ERROR,
                                "Unexpected error: " + e.getMessage()));
                    }
                });
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        logger.fine("Processed " + results.size() + " files");

        Map<Path, FormatterResult> ordered = new LinkedHashMap<>();
        for (Path file : files) {
            FormatterResult result = results.get(file);
            if (result != null) {
                ordered.put(file, result);
            }
        }
        return ordered;
    }

    private static FormatterResult failure(DiagnosticKind kind, String message) {
        return FormatterResult.builder()
                .successful(false)
                .addError(new FormatterError(Severity.FATAL, kind, message, 1, 1))
                .build();
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

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (FormatterPlugin plugin : new java.util.HashSet<>(plugins.values())) {
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin " + plugin.getClass().getSimpleName(), e);
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
