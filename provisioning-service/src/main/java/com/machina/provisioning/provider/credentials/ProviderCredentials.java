package com.machina.provisioning.provider.credentials;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.UnsupportedProviderException;

/**
 * Provider-specific credential payload. The owning account's {@link ProviderType} is the tag
 * that selects the variant; there is no shared state between variants.
 */
public interface ProviderCredentials {

    ProviderType providerType();

    /**
     * Returns a normalized copy or throws {@code ValidationException} naming the missing field.
     */
    ProviderCredentials validated();

    static Class<? extends ProviderCredentials> variantFor(ProviderType providerType) {
        return switch (providerType) {
            case DIGITALOCEAN -> DigitalOceanCredentials.class;
            case AWS -> AwsCredentials.class;
            case GCP -> GcpCredentials.class;
            case HETZNER -> HetznerCredentials.class;
            case BAREMETAL -> throw new UnsupportedProviderException(providerType, "stored credentials");
        };
    }

    static String mask(String secret) {
        if (secret == null || secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
