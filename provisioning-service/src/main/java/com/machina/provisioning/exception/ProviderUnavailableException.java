package com.machina.provisioning.exception;

/**
 * Transient provider failure (5xx, timeout, connection refused). Retried and recorded by the
 * circuit breaker, unlike a plain {@link ProviderException} which reports a client-side error.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
