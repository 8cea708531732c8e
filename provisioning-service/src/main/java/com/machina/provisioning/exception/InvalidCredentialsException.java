package com.machina.provisioning.exception;

/**
 * Provider rejected the supplied credentials, or they failed local sanity checks.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
