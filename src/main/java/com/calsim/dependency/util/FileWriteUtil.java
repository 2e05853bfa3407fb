package com.calsim.dependency.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.experimental.UtilityClass;

/**
 * File output helpers.
 */
@UtilityClass
public class FileWriteUtil {

    /**
     * Writes {@code content} as UTF-8, creating missing parent directories and
     * replacing an existing file.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }
}
