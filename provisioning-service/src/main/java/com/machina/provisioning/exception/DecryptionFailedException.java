package com.machina.provisioning.exception;

/**
 * Vault could not authenticate or decrypt a secret (bad tag, wrong key, wrong binding).
 * Always fatal to the operation in progress.
 */
public class DecryptionFailedException extends RuntimeException {

    public DecryptionFailedException(String message) {
        super(message);
    }

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
