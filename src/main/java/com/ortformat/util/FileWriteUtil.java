package com.ortformat.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for UTF-8 file operations used by the facade and the converters.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    public static String readString(Path filePath) throws IOException {
        return Files.readString(filePath, StandardCharsets.UTF_8);
    }

    /**
     * Computes the output path of a conversion: the input with its extension replaced, or
     * the input's file stem inside {@code outputDir} when one is given.
     */
    public static Path deriveOutputPath(Path input, Path outputDir, String extension) {
        String stem = fileStem(input);
        if (outputDir != null) {
            return outputDir.resolve(stem + "." + extension);
        }
        Path parent = input.getParent();
        return parent != null ? parent.resolve(stem + "." + extension) : Path.of(stem + "." + extension);
    }

    public static String fileStem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
