package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether the Terraform state of a machine still matches what the provider reports.
 */
public enum TerraformStateStatus {

    IN_SYNC("in_sync"),
    DRIFTED("drifted"),
    PENDING("pending"),
    UNKNOWN("unknown");

    private final String value;

    TerraformStateStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
