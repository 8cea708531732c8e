package com.machina.provisioning.scheduler;

import com.machina.provisioning.deployment.DeploymentService;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.repository.DeploymentRepository;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Cancels deployments that have waited for approval longer than the configured timeout.
 */
@Component
@Slf4j
public class ApprovalTimeoutScheduler {

    private final DeploymentRepository deploymentRepository;
    private final DeploymentService deploymentService;
    private final Duration approvalTimeout;

    public ApprovalTimeoutScheduler(
        DeploymentRepository deploymentRepository,
        DeploymentService deploymentService,
        @Value("${provisioning.approval.timeout:60m}") Duration approvalTimeout
    ) {
        this.deploymentRepository = deploymentRepository;
        this.deploymentService = deploymentService;
        this.approvalTimeout = approvalTimeout;
    }

    @Scheduled(fixedDelayString = "${provisioning.approval.sweep-interval:PT1M}")
    @SchedulerLock(name = "approvalTimeoutSweep", lockAtMostFor = "5m", lockAtLeastFor = "10s")
    public void sweep() {
        MDC.put("correlationId", "SCHEDULER-APPROVAL-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            int expired = expireStaleApprovals(Instant.now());
            if (expired > 0) {
                log.info("Cancelled {} deployments whose approval timed out", expired);
            }
        } catch (Exception e) {
            log.error("Error in approval timeout sweep: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }

    public int expireStaleApprovals(Instant now) {
        List<Deployment> stale = deploymentRepository.findStaleInState(
            DeploymentState.AWAITING_APPROVAL, now.minus(approvalTimeout));
        int expired = 0;
        for (Deployment deployment : stale) {
            if (deploymentService.expireApproval(deployment.getId())) {
                expired++;
            }
        }
        return expired;
    }
}
