package com.machina.provisioning.reconciliation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of reconciling one machine.
 */
public enum ReconciliationAction {

    NO_CHANGE("no_change"),
    UPDATED("updated"),
    MARKED_TERMINATED_NOT_FOUND("marked_terminated_not_found"),
    MARKED_ERROR_NO_RESOURCE_ID("marked_error_no_resource_id"),
    SKIPPED_ACTIVE_DEPLOYMENT("skipped_active_deployment"),
    SKIPPED_NO_CREDENTIALS("skipped_no_credentials"),
    SKIPPED_UNSUPPORTED_PROVIDER("skipped_unsupported_provider"),
    ERROR("error");

    private final String value;

    ReconciliationAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether the machine record was written.
     */
    public boolean isChange() {
        return this == UPDATED || this == MARKED_TERMINATED_NOT_FOUND || this == MARKED_ERROR_NO_RESOURCE_ID;
    }
}
