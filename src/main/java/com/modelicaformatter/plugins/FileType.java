package com.modelicaformatter.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.modelicaformatter.util.LoggerUtil;

/**
 * File types the formatter knows about, detected by extension and, for extension-less files,
 * by looking at the first lines.
 */
public enum FileType {
    MODELICA("mo"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int MAX_SNIFF_LINES = 20;

    private static final Pattern MODELICA_PATTERN = Pattern.compile(
            "^\\s*(?:within\\b|(?:(?:encapsulated|partial|expandable)\\s+)*"
                    + "(?:model|package|block|connector|record|function)\\s+\\w+)",
            Pattern.MULTILINE);

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = detectByExtension(filePath);
        if (type == UNKNOWN && _hasNoExtension(filePath) && Files.isRegularFile(filePath)) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    public static FileType detectByExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        String extension = name.substring(dot + 1);
        for (FileType type : values()) {
            if (type != UNKNOWN && type.extension.equals(extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Recognizes Modelica text by a {@code within} clause or a class header in its first lines.
     */
    static FileType detectByContent(Path filePath) {
        StringBuilder head = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String line;
            int count = 0;
            while (count < MAX_SNIFF_LINES && (line = reader.readLine()) != null) {
                head.append(line).append('\n');
                count++;
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not read file for type detection: " + filePath, e);
            return UNKNOWN;
        }
        return MODELICA_PATTERN.matcher(head).find() ? MODELICA : UNKNOWN;
    }

    public static void clearCache() {
        typeCache.clear();
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    public String getDescription() {
        return switch (this) {
            case MODELICA -> "Modelica source file";
            case UNKNOWN -> "Unknown file type";
        };
    }

    private static boolean _hasNoExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName != null && fileName.toString().indexOf('.') < 0;
    }
}
