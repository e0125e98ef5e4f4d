package com.cppmodel.generator.cli.exception;

import java.util.List;

/**
 * Thrown when {@code generate} options fail validation. Every problem found
 * is kept, so the user can fix them in one go.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
