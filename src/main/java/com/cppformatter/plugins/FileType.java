package com.cppformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.cppformatter.util.LoggerUtil;

/**
 * C and C++ file types, detected by extension with a content check for
 * files that have none. Detection results are cached per path.
 */
public enum FileType {
    C_SOURCE(List.of("c"), false),
    C_HEADER(List.of("h"), true),
    CPP_SOURCE(List.of("cc", "cpp", "cxx", "c++"), false),
    CPP_HEADER(List.of("hh", "hpp", "hxx", "h++", "ipp", "inl", "tpp"), true),
    UNKNOWN(List.of(), false);

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final List<String> extensions;
    private final boolean header;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int SNIFF_BYTES = 4096;

    // extension-less C++ standard library style headers, e.g. <vector>
    private static final Pattern CPP_PATTERN = Pattern.compile(
            "(?m)(?:^\\s*#\\s*include\\s*<[a-z_]+>|^\\s*namespace\\s+\\w+|^\\s*template\\s*<|\\bstd::|^\\s*class\\s+\\w+)");

    private static final Pattern C_PATTERN = Pattern.compile(
            "(?m)(?:^\\s*#\\s*(?:include|define|ifndef|pragma)\\b|^\\s*(?:typedef|struct)\\s+\\w+)");

    FileType(List<String> extensions, boolean header) {
        this.extensions = extensions;
        this.header = header;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isHeader() {
        return header;
    }

    /**
     * Detects the file type of {@code filePath}, reading the start of the
     * file only when the name has no known extension.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType typeByExtension = detectByExtension(filePath);
        if (typeByExtension != UNKNOWN) {
            typeCache.put(filePath, typeByExtension);
            return typeByExtension;
        }

        FileType detectedType = detectByContent(filePath);
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return UNKNOWN;
        }

        // .C and .H are C++ by convention
        String extension = fileName.substring(dot + 1);
        if (extension.equals("C")) {
            return CPP_SOURCE;
        }
        if (extension.equals("H")) {
            return CPP_HEADER;
        }

        extension = extension.toLowerCase(Locale.ROOT);
        for (FileType type : values()) {
            if (type.extensions.contains(extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Only files without any extension are sniffed; {@code notes.txt} stays
     * unknown whatever it contains.
     */
    private static FileType detectByContent(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null || name.toString().contains(".") || !Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            String content = readHead(filePath);
            if (content.isEmpty() || content.indexOf('\0') >= 0) {
                return UNKNOWN;
            }
            if (CPP_PATTERN.matcher(content).find()) {
                return CPP_HEADER;
            }
            if (C_PATTERN.matcher(content).find()) {
                return C_HEADER;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    private static String readHead(Path filePath) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] bytes = in.readNBytes(SNIFF_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case C_SOURCE -> "C source file";
            case C_HEADER -> "C header file";
            case CPP_SOURCE -> "C++ source file";
            case CPP_HEADER -> "C++ header file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
