package com.machina.provisioning.dto.response;

import lombok.Builder;

import java.time.Instant;

/**
 * Error body returned by every endpoint. code is stable, message is human-readable.
 */
@Builder
public record ErrorResponse(
    Error error,
    String timestamp
) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(new Error(code, message, null, null), Instant.now().toString());
    }

    @Builder
    public record Error(
        String code,
        String message,
        String field,
        Object details
    ) {}
}
