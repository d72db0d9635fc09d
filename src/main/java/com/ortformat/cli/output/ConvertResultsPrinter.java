package com.ortformat.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ortformat.cli.model.ConversionResult;
import com.ortformat.cli.model.ValidatedConvertOptions;

/**
 * Responsible only for printing CLI output for the conversion commands.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(String command, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("ORT {}", command);
        log.info("=================================================");
        log.info("Input:  {}", v.getInputPath());
        log.info("Output: {}", v.getOutputPath());
    }

    public void printSuccess(ConversionResult result) {
        log.info("Converted {} characters into {} characters", result.getCharactersRead(), result.getCharactersWritten());
        log.info("Wrote {}", result.getOutputPath());
    }

    public void printFailure(ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }
}
