package com.ortformat.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Resolved paths for one conversion. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path inputPath;
    Path outputPath;
}
