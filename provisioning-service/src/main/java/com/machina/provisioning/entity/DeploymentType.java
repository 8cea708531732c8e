package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of infrastructure change a deployment attempts.
 */
public enum DeploymentType {

    CREATE("create"),
    UPDATE("update"),
    DESTROY("destroy"),
    REBOOT("reboot"),
    RESTART_SERVICE("restart_service"),
    REFRESH("refresh");

    private final String value;

    DeploymentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Types executed through Terraform plan/apply. Reboot goes through the provider
     * API and restart_service through the machine agent.
     */
    public boolean usesTerraform() {
        return this == CREATE || this == UPDATE || this == DESTROY || this == REFRESH;
    }

    @JsonCreator
    public static DeploymentType fromValue(String value) {
        for (DeploymentType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown deployment type: " + value);
    }
}
