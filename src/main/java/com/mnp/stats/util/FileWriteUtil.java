package com.mnp.stats.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Replaces characters that are unsafe in file names with underscores.
     */
    public static String safeFileName(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        return name.strip().replaceAll("[\\\\/:*?\"<>|\\s]+", "_");
    }
}
