package com.machina.provisioning.deployment;

import com.machina.provisioning.terraform.PlanSummary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * A plan auto-approves when it destroys nothing and touches at most
 * {@code provisioning.approval.auto-approve-max-resources} resources. Everything else waits for an operator.
 */
@Component
public class ApprovalPolicy {

    private final int autoApproveMaxResources;

    public ApprovalPolicy(@Value("${provisioning.approval.auto-approve-max-resources:10}") int autoApproveMaxResources) {
        this.autoApproveMaxResources = autoApproveMaxResources;
    }

    public boolean autoApproves(PlanSummary summary) {
        return !summary.hasDestroys() && summary.totalChanges() <= autoApproveMaxResources;
    }
}
