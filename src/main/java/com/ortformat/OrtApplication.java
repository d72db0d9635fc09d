package com.ortformat;

import com.ortformat.cli.OrtCommand;
import picocli.CommandLine;

/**
 * Main entry point for the ORT command line tools.
 */
public class OrtApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OrtCommand()).execute(args);
        System.exit(exitCode);
    }
}
