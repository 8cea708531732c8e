package com.machina.provisioning.audit;

public enum AuditAction {
    MACHINE_CREATE_REQUESTED,
    DEPLOYMENT_SUBMITTED,
    DEPLOYMENT_APPROVED,
    DEPLOYMENT_CANCELLED,
    DEPLOYMENT_SUCCEEDED,
    DEPLOYMENT_FAILED,
    DEPLOYMENT_INTERRUPTED,
    APPROVAL_TIMED_OUT,
    MACHINE_DRIFT_DETECTED,
    MACHINE_STATUS_RECONCILED,
    PROVIDER_ACCOUNT_CREATED,
    PROVIDER_ACCOUNT_UPDATED,
    PROVIDER_ACCOUNT_DELETED,
    CREDENTIALS_VERIFIED,
    WORKSPACE_REMOVED
}
