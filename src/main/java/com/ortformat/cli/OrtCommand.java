package com.ortformat.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Root command; the work is done by its subcommands.
 */
@Command(
        name = "ort",
        mixinStandardHelpOptions = true,
        version = "ort 1.0.0",
        description = "Converts between ORT and JSON documents.",
        subcommands = {Ort2JsonCommand.class, Json2OrtCommand.class}
)
public class OrtCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand: ort2json or json2ort");
    }
}
