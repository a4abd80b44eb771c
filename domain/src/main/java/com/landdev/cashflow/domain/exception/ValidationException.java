package com.landdev.cashflow.domain.exception;

import java.util.Collections;
import java.util.List;

/**
 * Malformed input records
 */
public class ValidationException extends ProjectionException {

    private final List<String> errors;

    public ValidationException(String error) {
        this(List.of(error));
    }

    public ValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
