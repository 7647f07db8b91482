package com.dbus.deviation.cli.exception;

import java.util.List;

/**
 * Carries every problem found in the command-line options at once, so the
 * user can fix them all in one go.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid options: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
