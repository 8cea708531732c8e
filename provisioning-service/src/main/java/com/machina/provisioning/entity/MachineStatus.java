package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized machine status vocabulary shared by every provider adapter.
 */
public enum MachineStatus {

    PENDING("pending"),
    PROVISIONING("provisioning"),
    RUNNING("running"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    REBOOTING("rebooting"),
    TERMINATING("terminating"),
    TERMINATED("terminated"),
    ERROR("error");

    private final String value;

    MachineStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Settled states are ones a provider reports when nothing is in flight.
     */
    public boolean isSettled() {
        return this == RUNNING || this == STOPPED || this == TERMINATED;
    }

    @JsonCreator
    public static MachineStatus fromValue(String value) {
        for (MachineStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown machine status: " + value);
    }
}
