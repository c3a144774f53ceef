package com.abidump.validator.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for dump file access with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }

    /**
     * Tells apart a missing file, an existing but empty file, and a file with content.
     */
    public static FileState stateOf(Path filePath) throws IOException {
        if (filePath == null || !Files.exists(filePath)) {
            return FileState.MISSING;
        }
        return Files.size(filePath) > 0 ? FileState.PRESENT : FileState.EMPTY;
    }

    public static String readString(Path filePath) throws IOException {
        return Files.readString(filePath, StandardCharsets.UTF_8);
    }

    public enum FileState {
        MISSING,
        EMPTY,
        PRESENT
    }
}
