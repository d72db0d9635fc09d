package com.ortformat.cli.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a single file conversion.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private Path inputPath;
    private Path outputPath;
    private int charactersRead;
    private int charactersWritten;

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
