package com.ortformat.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options shared by the conversion commands. No validation, no execution logic.
 */
@Getter
public class ConvertOptions {

    @Parameters(index = "0", paramLabel = "INPUT", description = "File to convert")
    private Path input;

    @Option(names = {"--output-dir", "-o"}, description = "Directory for the converted file (defaults to the input's directory)")
    private Path outputDir;
}
