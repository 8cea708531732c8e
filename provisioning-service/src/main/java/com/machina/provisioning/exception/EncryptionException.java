package com.machina.provisioning.exception;

/**
 * Exception thrown when encryption or master key handling fails.
 * Maps to HTTP 500.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public EncryptionException(String message) {
        super(message);
    }
}
