package com.machina.provisioning.provider;

import java.time.Instant;

/**
 * Outcome of a credential check. Adapters return it; callers decide what to persist.
 */
public record CredentialValidation(boolean valid, String message, Instant checkedAt) {

    public static CredentialValidation valid(String message) {
        return new CredentialValidation(true, message, Instant.now());
    }

    public static CredentialValidation invalid(String message) {
        return new CredentialValidation(false, message, Instant.now());
    }
}
