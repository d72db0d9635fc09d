package com.ortformat.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ortformat.cli.exception.OptionsValidationException;
import com.ortformat.cli.model.ConvertOptions;
import com.ortformat.cli.model.ValidatedConvertOptions;
import com.ortformat.util.FileWriteUtil;

/**
 * Checks converter options and resolves the output path. All problems found in one pass
 * are reported together.
 */
public class ConvertOptionsValidator {

    public ValidatedConvertOptions validate(ConvertOptions o, String command, String targetExtension) {
        List<String> errors = new ArrayList<>();

        Path input = o.getInput();
        if (input == null) {
            errors.add("Input file is required.");
        } else if (!Files.isRegularFile(input)) {
            errors.add("Input file does not exist or is not a regular file: " + input);
        }

        Path outputDir = o.getOutputDir();
        if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            errors.add("Output path exists but is not a directory: " + outputDir);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(command, errors);
        }

        Path normalizedInput = input.toAbsolutePath().normalize();
        Path normalizedOutputDir = outputDir == null ? null : outputDir.toAbsolutePath().normalize();
        Path outputPath = FileWriteUtil.deriveOutputPath(normalizedInput, normalizedOutputDir, targetExtension);

        if (outputPath.equals(normalizedInput)) {
            throw OptionsValidationException.of(command, "Refusing to overwrite the input file: " + normalizedInput);
        }

        return new ValidatedConvertOptions(normalizedInput, outputPath);
    }
}
