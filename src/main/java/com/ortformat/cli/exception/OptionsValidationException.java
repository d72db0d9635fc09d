package com.ortformat.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Every problem found in one converter's options, reported together before any file is
 * touched. The message reads {@code <command>: <problem>}, one problem per line.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super(command + ": " + String.join(System.lineSeparator() + command + ": ", errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }

    public static OptionsValidationException of(String command, String error) {
        return new OptionsValidationException(command, List.of(error));
    }
}
