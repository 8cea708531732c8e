package com.machina.provisioning.provider.credentials;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ValidationException;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HetznerCredentials(String apiToken) implements ProviderCredentials {

    @Override
    public ProviderType providerType() {
        return ProviderType.HETZNER;
    }

    @Override
    public HetznerCredentials validated() {
        if (apiToken == null || apiToken.isBlank()) {
            throw new ValidationException("api_token is required for Hetzner", "credentials.api_token");
        }
        return new HetznerCredentials(apiToken.trim());
    }

    @Override
    public String toString() {
        return "HetznerCredentials[apiToken=" + ProviderCredentials.mask(apiToken) + "]";
    }
}
