package com.machina.provisioning.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.terraform.PlanSummary;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Deployment as returned by the API. Parameters are omitted: they may carry user data scripts.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeploymentResponse(
    UUID deploymentId,
    DeploymentType type,
    DeploymentState state,
    UUID machineId,
    String terraformWorkspace,
    PlanSummary planSummary,
    String rawPlan,
    Map<String, Object> outputs,
    Long initiatedBy,
    Long approvedBy,
    Instant approvedAt,
    String errorMessage,
    boolean cancelRequested,
    Instant startedAt,
    Instant finishedAt,
    Instant createdAt,
    Instant updatedAt
) {

    public static DeploymentResponse from(Deployment deployment) {
        return DeploymentResponse.builder()
            .deploymentId(deployment.getId())
            .type(deployment.getType())
            .state(deployment.getState())
            .machineId(deployment.getMachineId())
            .terraformWorkspace(deployment.getTerraformWorkspace())
            .planSummary(deployment.getPlanSummary())
            .rawPlan(deployment.getRawPlan())
            .outputs(deployment.getOutputs())
            .initiatedBy(deployment.getInitiatedBy())
            .approvedBy(deployment.getApprovedBy())
            .approvedAt(deployment.getApprovedAt())
            .errorMessage(deployment.getErrorMessage())
            .cancelRequested(deployment.isCancelRequested())
            .startedAt(deployment.getStartedAt())
            .finishedAt(deployment.getFinishedAt())
            .createdAt(deployment.getCreatedAt())
            .updatedAt(deployment.getUpdatedAt())
            .build();
    }
}
