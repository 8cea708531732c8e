package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Deployment lifecycle.
 *
 * Happy path: QUEUED → PLANNING → (AWAITING_APPROVAL) → APPLYING → SUCCEEDED.
 * FAILED and CANCELLED are reachable from any non-terminal state.
 */
public enum DeploymentState {

    QUEUED("queued"),
    PLANNING("planning"),
    AWAITING_APPROVAL("awaiting_approval"),
    APPLYING("applying"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    CANCELLED("cancelled");

    public static final Set<DeploymentState> ACTIVE =
        EnumSet.of(QUEUED, PLANNING, AWAITING_APPROVAL, APPLYING);

    public static final Set<DeploymentState> TERMINAL =
        EnumSet.of(SUCCEEDED, FAILED, CANCELLED);

    private final String value;

    DeploymentState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * States in which nothing has touched real infrastructure yet.
     */
    public boolean isCleanlyCancellable() {
        return this == QUEUED || this == AWAITING_APPROVAL;
    }

    @JsonCreator
    public static DeploymentState fromValue(String value) {
        for (DeploymentState state : values()) {
            if (state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown deployment state: " + value);
    }
}
