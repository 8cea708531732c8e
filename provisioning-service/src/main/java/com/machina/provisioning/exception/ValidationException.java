package com.machina.provisioning.exception;

import lombok.Getter;

/**
 * Malformed or missing request fields, raised before any side effect.
 * Maps to HTTP 400 VALIDATION_ERROR.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(message);
        this.field = field;
    }
}
