package com.modulestack.resolver.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File writes that create missing parent directories.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }
}
