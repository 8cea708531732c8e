package com.machina.provisioning.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.CredentialStatus;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;

import java.time.Instant;
import java.util.UUID;

/**
 * Credentials are never part of the response.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderAccountResponse(
    UUID providerAccountId,
    ProviderType providerType,
    String label,
    CredentialStatus credentialStatus,
    Instant lastVerifiedAt,
    Instant createdAt,
    Instant updatedAt
) {

    public static ProviderAccountResponse from(ProviderAccount account) {
        return new ProviderAccountResponse(
            account.getId(),
            account.getProviderType(),
            account.getLabel(),
            account.getCredentialStatus(),
            account.getLastVerifiedAt(),
            account.getCreatedAt(),
            account.getUpdatedAt()
        );
    }
}
