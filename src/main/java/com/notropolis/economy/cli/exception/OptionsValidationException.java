package com.notropolis.economy.cli.exception;

import java.util.List;

/**
 * Every problem found in the tick command's options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String describe(List<String> errors) {
        StringBuilder sb = new StringBuilder("Invalid tick options (").append(errors.size()).append("):");
        for (String error : errors) {
            sb.append(System.lineSeparator()).append("  - ").append(error);
        }
        return sb.toString();
    }
}
