package com.machina.provisioning.scheduler;

import com.machina.provisioning.deployment.DeploymentService;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.repository.DeploymentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalTimeoutSchedulerTest {

    @Mock
    private DeploymentRepository deploymentRepository;
    @Mock
    private DeploymentService deploymentService;

    @Test
    void expiresDeploymentsOlderThanTimeout() {
        ApprovalTimeoutScheduler scheduler =
            new ApprovalTimeoutScheduler(deploymentRepository, deploymentService, Duration.ofMinutes(60));
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        Deployment stale = Deployment.builder().id(UUID.randomUUID()).build();
        Deployment raced = Deployment.builder().id(UUID.randomUUID()).build();
        when(deploymentRepository.findStaleInState(DeploymentState.AWAITING_APPROVAL, Instant.parse("2026-03-01T11:00:00Z")))
            .thenReturn(List.of(stale, raced));
        when(deploymentService.expireApproval(stale.getId())).thenReturn(true);
        when(deploymentService.expireApproval(raced.getId())).thenReturn(false);

        int expired = scheduler.expireStaleApprovals(now);

        assertThat(expired).isEqualTo(1);
    }

    @Test
    void sweepSurvivesRepositoryFailure() {
        ApprovalTimeoutScheduler scheduler =
            new ApprovalTimeoutScheduler(deploymentRepository, deploymentService, Duration.ofMinutes(60));
        when(deploymentRepository.findStaleInState(eq(DeploymentState.AWAITING_APPROVAL), any()))
            .thenThrow(new IllegalStateException("database unavailable"));

        scheduler.sweep();

        verify(deploymentRepository).findStaleInState(eq(DeploymentState.AWAITING_APPROVAL), any());
    }
}
