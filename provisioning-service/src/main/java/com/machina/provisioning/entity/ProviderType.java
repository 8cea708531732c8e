package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supported cloud provider families.
 */
public enum ProviderType {

    DIGITALOCEAN("digitalocean", "DigitalOcean"),
    AWS("aws", "Amazon Web Services"),
    GCP("gcp", "Google Cloud Platform"),
    HETZNER("hetzner", "Hetzner"),
    BAREMETAL("baremetal", "Bare Metal / BYO Server");

    private final String value;
    private final String displayName;

    ProviderType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ProviderType fromValue(String value) {
        for (ProviderType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }
}
