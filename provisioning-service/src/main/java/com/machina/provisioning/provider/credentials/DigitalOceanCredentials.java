package com.machina.provisioning.provider.credentials;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ValidationException;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DigitalOceanCredentials(String apiToken) implements ProviderCredentials {

    static final int MIN_TOKEN_LENGTH = 10;

    @Override
    public ProviderType providerType() {
        return ProviderType.DIGITALOCEAN;
    }

    /**
     * Trims the token and strips anything outside printable ASCII (pasted tokens often
     * carry zero-width or newline characters).
     */
    @Override
    public DigitalOceanCredentials validated() {
        if (apiToken == null || apiToken.isBlank()) {
            throw new ValidationException("api_token is required for DigitalOcean", "credentials.api_token");
        }
        String sanitized = apiToken.trim().replaceAll("[^\\x20-\\x7E]", "");
        if (sanitized.length() < MIN_TOKEN_LENGTH) {
            throw new ValidationException("Invalid API token format", "credentials.api_token");
        }
        return new DigitalOceanCredentials(sanitized);
    }

    @Override
    public String toString() {
        return "DigitalOceanCredentials[apiToken=" + ProviderCredentials.mask(apiToken) + "]";
    }
}
