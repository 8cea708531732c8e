package com.machina.provisioning.exception;

/**
 * Action attempted against a deployment or machine whose state forbids it,
 * e.g. approving a deployment that is not awaiting approval.
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
