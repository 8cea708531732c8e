package com.machina.provisioning.exception;

/**
 * Exception for HTTP 409 Conflict status.
 *
 * Used for:
 * - An active deployment already owns the target machine
 * - Provider accounts still referenced by machines
 * - Optimistic locking conflicts
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
