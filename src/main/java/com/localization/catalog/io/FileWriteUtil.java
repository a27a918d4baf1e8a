package com.localization.catalog.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     * The content is written to a sibling temporary file that is then moved over the target.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }

        Path temp = Files.createTempFile(parentDir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
