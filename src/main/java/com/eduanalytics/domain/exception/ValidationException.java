package com.eduanalytics.domain.exception;

import java.util.List;

/**
 * Malformed input. Carries structured error and warning lists for upload validation.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;
    private final List<String> warnings;

    public ValidationException(String message) {
        this(message, List.of(message), List.of());
    }

    public ValidationException(String message, List<String> errors, List<String> warnings) {
        super(message);
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
