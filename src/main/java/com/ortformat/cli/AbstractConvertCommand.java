package com.ortformat.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ortformat.cli.exception.OptionsValidationException;
import com.ortformat.cli.model.ConversionResult;
import com.ortformat.cli.model.ConvertOptions;
import com.ortformat.cli.model.ValidatedConvertOptions;
import com.ortformat.cli.output.ConvertResultsPrinter;
import com.ortformat.cli.validation.ConvertOptionsValidator;
import com.ortformat.parser.OrtParseException;
import com.ortformat.util.FileWriteUtil;

import picocli.CommandLine.Mixin;

/**
 * Reads one file, converts its text and writes the result next to it (or into the
 * output directory). Subclasses supply the conversion and the target extension.
 */
public abstract class AbstractConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractConvertCommand.class);

    @Mixin
    protected ConvertOptions options;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    protected abstract String name();

    protected abstract String targetExtension();

    protected abstract String convert(String source) throws IOException;

    @Override
    public Integer call() {
        try {
            ValidatedConvertOptions validated = validator.validate(options, name(), targetExtension());
            printer.printBanner(name(), validated);

            String source = FileWriteUtil.readString(validated.getInputPath());
            String output = convert(source);
            FileWriteUtil.safeWriteString(validated.getOutputPath(), output);

            printer.printSuccess(ConversionResult.builder()
                    .success(true)
                    .inputPath(validated.getInputPath())
                    .outputPath(validated.getOutputPath())
                    .charactersRead(source.length())
                    .charactersWritten(output.length())
                    .build());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}: {}", e.getCommand(), error));
            return 1;
        } catch (OrtParseException e) {
            printer.printFailure(ConversionResult.failure("Failed to parse ORT: " + e.getMessage()));
            return 1;
        } catch (JsonProcessingException e) {
            printer.printFailure(ConversionResult.failure("Failed to parse JSON: " + e.getOriginalMessage()));
            return 1;
        } catch (IOException e) {
            log.error("{} failed with exception", name(), e);
            return 1;
        }
    }
}
