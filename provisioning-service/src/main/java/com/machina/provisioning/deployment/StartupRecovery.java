package com.machina.provisioning.deployment;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ExecutionFailedException;
import com.machina.provisioning.exception.InvalidStateException;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.terraform.WorkspaceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Restores deployment bookkeeping after a restart.
 *
 * Order matters: interrupted deployments are failed first, workspaces are scanned while
 * no job is running, and queued deployments are re-dispatched last.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "provisioning.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class StartupRecovery {

    static final String INTERRUPTED_MESSAGE = "Interrupted by orchestrator restart";
    private static final String WORKSPACE_PREFIX = "machine-";

    private final DeploymentRepository deploymentRepository;
    private final MachineRepository machineRepository;
    private final DeploymentStateStore stateStore;
    private final DeploymentService deploymentService;
    private final MachineLockRegistry locks;
    private final DeploymentLogBroadcaster broadcaster;
    private final WorkspaceManager workspaceManager;
    private final AuditService auditService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        MDC.put("correlationId", "RECOVERY-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            recover();
        } catch (Exception e) {
            log.error("Startup recovery failed: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }

    public void recover() {
        int interrupted = failInterrupted();
        int workspaces = sweepWorkspaces();
        int awaiting = relockAwaitingApproval();
        int requeued = redispatchQueued();
        log.info("Startup recovery: {} interrupted, {} workspaces removed, {} awaiting approval, {} re-dispatched",
            interrupted, workspaces, awaiting, requeued);
    }

    private int failInterrupted() {
        List<Deployment> running = deploymentRepository.findByStateInOrderByCreatedAtAsc(
            EnumSet.of(DeploymentState.PLANNING, DeploymentState.APPLYING));
        int count = 0;
        for (Deployment deployment : running) {
            try {
                broadcaster.append(deployment.getId(), LogLevel.ERROR, LogSource.SYSTEM, INTERRUPTED_MESSAGE);
                stateStore.finish(deployment.getId(), DeploymentState.FAILED, INTERRUPTED_MESSAGE, null,
                    machine -> machine.setTerraformStateStatus(TerraformStateStatus.UNKNOWN));
                broadcaster.complete(deployment.getId(), DeploymentState.FAILED);
                auditService.failure(AuditAction.DEPLOYMENT_INTERRUPTED, null, AuditService.TARGET_DEPLOYMENT,
                    deployment.getId(), Map.of("state", deployment.getState().getValue()));
                count++;
            } catch (InvalidStateException e) {
                log.debug("Deployment {} already final: {}", deployment.getId(), e.getMessage());
            }
        }
        return count;
    }

    /**
     * Temporary files are dropped from every workspace; a workspace is deleted outright when
     * its machine is gone or terminated and no deployment for it is still active.
     */
    int sweepWorkspaces() {
        int removed = 0;
        for (String name : workspaceManager.listWorkspaces()) {
            Optional<UUID> machineId = machineIdOf(name);
            if (machineId.isEmpty()) {
                log.warn("Ignoring unrecognized workspace directory {}", name);
                continue;
            }
            Optional<Machine> machine = machineRepository.findById(machineId.get());
            boolean terminated = machine.map(m -> m.getActualStatus() == MachineStatus.TERMINATED).orElse(true);
            boolean owned = !deploymentRepository.findByMachineIdAndStateIn(machineId.get(), DeploymentState.ACTIVE).isEmpty();
            try {
                if (terminated && !owned) {
                    workspaceManager.remove(name);
                    auditService.success(AuditAction.WORKSPACE_REMOVED, null, AuditService.TARGET_WORKSPACE, name,
                        Map.of("machine_id", machineId.get().toString()));
                    removed++;
                } else {
                    workspaceManager.cleanup(name);
                }
            } catch (ExecutionFailedException e) {
                log.error("Failed to recover workspace {}: {}", name, e.getMessage());
            }
        }
        return removed;
    }

    private int relockAwaitingApproval() {
        List<Deployment> awaiting = deploymentRepository.findByStateInOrderByCreatedAtAsc(
            EnumSet.of(DeploymentState.AWAITING_APPROVAL));
        for (Deployment deployment : awaiting) {
            if (!locks.tryAcquire(deployment.getMachineId(), deployment.getId())) {
                log.error("Machine {} has more than one active deployment; {} not re-locked",
                    deployment.getMachineId(), deployment.getId());
            }
        }
        return awaiting.size();
    }

    private int redispatchQueued() {
        List<Deployment> queued = deploymentRepository.findByStateInOrderByCreatedAtAsc(EnumSet.of(DeploymentState.QUEUED));
        int count = 0;
        for (Deployment deployment : queued) {
            if (!locks.tryAcquire(deployment.getMachineId(), deployment.getId())) {
                log.error("Machine {} has more than one active deployment; {} not re-dispatched",
                    deployment.getMachineId(), deployment.getId());
                continue;
            }
            try {
                deploymentService.dispatch(deployment);
                count++;
            } catch (RejectedExecutionException e) {
                log.error("Queued deployment {} could not be re-dispatched: worker queue full", deployment.getId());
            }
        }
        return count;
    }

    private static Optional<UUID> machineIdOf(String workspaceName) {
        if (!workspaceName.startsWith(WORKSPACE_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(workspaceName.substring(WORKSPACE_PREFIX.length())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
