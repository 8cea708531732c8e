package com.machina.provisioning.exception;

import lombok.Getter;

/**
 * Upstream cloud API failure. statusCode is the provider's HTTP status, 0 when no response arrived.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final int statusCode;

    public ProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
