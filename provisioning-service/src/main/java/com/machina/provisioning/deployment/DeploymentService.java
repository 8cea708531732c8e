package com.machina.provisioning.deployment;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ConflictException;
import com.machina.provisioning.exception.InvalidStateException;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.metrics.DeploymentMetrics;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.terraform.ExecutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Public contract of the deployment state machine: submit, approve, cancel and log access.
 *
 * Validation and lock conflicts are thrown to the caller. Everything that goes wrong after
 * a deployment is queued is recorded on the deployment instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentService {

    private static final Pattern SERVICE_NAME = Pattern.compile("[A-Za-z0-9@._-]{1,128}");

    private final DeploymentStateStore stateStore;
    private final DeploymentRepository deploymentRepository;
    private final MachineRepository machineRepository;
    private final MachineLockRegistry locks;
    private final ExecutionRegistry executions;
    private final DeploymentDispatcher dispatcher;
    private final DeploymentLogBroadcaster broadcaster;
    private final AuditService auditService;
    private final DeploymentMetrics metrics;

    /**
     * Submit a deployment against an existing machine.
     *
     * @throws ValidationException    if parameters required by the type are missing
     * @throws ResourceNotFoundException if the machine does not exist
     * @throws InvalidStateException  if the machine's state forbids the operation
     * @throws ConflictException      if another deployment is active for the machine
     */
    public Deployment submit(DeploymentType type, UUID machineId, Map<String, Object> parameters, Long initiatedBy) {
        if (type == DeploymentType.CREATE) {
            throw new ValidationException("Create deployments are submitted by creating a machine", "type");
        }
        Map<String, Object> params = parameters == null ? new HashMap<>() : new HashMap<>(parameters);
        validateParameters(type, params);

        Machine machine = machineRepository.findById(machineId)
            .orElseThrow(() -> new ResourceNotFoundException("Machine", machineId));
        checkMachineState(type, machine);

        if (type.usesTerraform()) {
            params = withCreationOptions(machineId, params);
        }

        Deployment deployment = Deployment.builder()
            .id(UUID.randomUUID())
            .type(type)
            .machineId(machineId)
            .terraformWorkspace(type.usesTerraform() ? machine.getTerraformWorkspace() : null)
            .parameters(params)
            .initiatedBy(initiatedBy)
            .build();
        return enqueue(deployment, null);
    }

    /**
     * Persist a new machine together with its create deployment, then dispatch it.
     */
    public Deployment submitCreate(Machine machine, Map<String, Object> parameters, Long initiatedBy) {
        Deployment deployment = Deployment.builder()
            .id(UUID.randomUUID())
            .type(DeploymentType.CREATE)
            .machineId(machine.getId())
            .terraformWorkspace(machine.getTerraformWorkspace())
            .parameters(parameters == null ? new HashMap<>() : new HashMap<>(parameters))
            .initiatedBy(initiatedBy)
            .build();
        return enqueue(deployment, machine);
    }

    /**
     * @throws InvalidStateException unless the deployment is awaiting approval
     */
    public Deployment approve(UUID deploymentId, Long approverId) {
        UUID machineId = stateStore.get(deploymentId).getMachineId();
        boolean heldBefore = locks.ownerOf(machineId).map(deploymentId::equals).orElse(false);
        if (!locks.tryAcquire(machineId, deploymentId)) {
            log.error("Deployment {} awaits approval but machine {} is held by {}", deploymentId, machineId,
                locks.ownerOf(machineId).map(UUID::toString).orElse("nobody"));
            throw new ConflictException("Machine " + machineId + " is held by another operation");
        }
        Deployment deployment;
        try {
            deployment = stateStore.transition(deploymentId, EnumSet.of(DeploymentState.AWAITING_APPROVAL),
                DeploymentState.APPLYING, d -> {
                    d.setApprovedBy(approverId);
                    d.setApprovedAt(Instant.now());
                });
        } catch (RuntimeException e) {
            if (!heldBefore) {
                locks.release(machineId, deploymentId);
            }
            throw e;
        }
        broadcaster.append(deploymentId, LogLevel.INFO,
            LogSource.SYSTEM, "Plan approved by user " + approverId);
        auditService.success(AuditAction.DEPLOYMENT_APPROVED, approverId, AuditService.TARGET_DEPLOYMENT,
            deploymentId, Map.of("type", deployment.getType().getValue()));
        dispatch(deployment);
        return deployment;
    }

    /**
     * Queued and awaiting-approval deployments are cancelled at once. For planning and
     * applying ones the request is recorded, the running process is signalled, and the
     * returned deployment is still active; its job finalizes it.
     *
     * @throws InvalidStateException if the deployment is already terminal
     */
    public Deployment cancel(UUID deploymentId, Long actorId) {
        Deployment deployment = stateStore.cancel(deploymentId, actorId);
        if (deployment.getState() == DeploymentState.CANCELLED) {
            broadcaster.append(deploymentId, LogLevel.WARN,
                LogSource.SYSTEM, "Deployment cancelled");
            locks.release(deployment.getMachineId(), deploymentId);
            broadcaster.complete(deploymentId, DeploymentState.CANCELLED);
            metrics.recordFinished(deployment.getType(), DeploymentState.CANCELLED, null);
        } else {
            executions.find(deploymentId).ifPresent(ExecutionContext::cancel);
        }
        auditService.success(AuditAction.DEPLOYMENT_CANCELLED, actorId, AuditService.TARGET_DEPLOYMENT,
            deploymentId, Map.of("state", deployment.getState().getValue()));
        return deployment;
    }

    /**
     * Cancel a deployment that waited too long for approval. Returns false if it moved on meanwhile.
     */
    public boolean expireApproval(UUID deploymentId) {
        Deployment deployment;
        try {
            deployment = stateStore.transition(deploymentId, EnumSet.of(DeploymentState.AWAITING_APPROVAL),
                DeploymentState.CANCELLED, d -> d.setErrorMessage("Approval timed out"));
        } catch (InvalidStateException e) {
            log.debug("Deployment {} is no longer awaiting approval", deploymentId);
            return false;
        }
        broadcaster.append(deploymentId, LogLevel.WARN,
            LogSource.SYSTEM, "Approval timed out");
        locks.release(deployment.getMachineId(), deploymentId);
        broadcaster.complete(deploymentId, DeploymentState.CANCELLED);
        metrics.recordFinished(deployment.getType(), DeploymentState.CANCELLED, null);
        auditService.success(AuditAction.APPROVAL_TIMED_OUT, null, AuditService.TARGET_DEPLOYMENT,
            deploymentId, Map.of("machine_id", String.valueOf(deployment.getMachineId())));
        return true;
    }

    public Deployment get(UUID deploymentId) {
        return stateStore.get(deploymentId);
    }

    public Page<Deployment> list(UUID machineId, DeploymentType type, DeploymentState state,
                                 Instant createdAfter, Instant createdBefore, Pageable pageable) {
        return deploymentRepository.search(machineId, type, state, createdAfter, createdBefore, pageable);
    }

    public List<DeploymentLogLine> getLogs(UUID deploymentId) {
        stateStore.get(deploymentId);
        return broadcaster.history(deploymentId);
    }

    public DeploymentLogBroadcaster.Subscription subscribeLogs(UUID deploymentId, DeploymentLogListener listener) {
        stateStore.get(deploymentId);
        return broadcaster.subscribe(deploymentId, listener);
    }

    /**
     * Hand a persisted deployment to the worker pool. A full pool fails the deployment and
     * releases its machine before the rejection propagates.
     */
    void dispatch(Deployment deployment) {
        try {
            dispatcher.dispatch(deployment.getId());
        } catch (RejectedExecutionException e) {
            metrics.recordRejected();
            try {
                stateStore.finish(deployment.getId(), DeploymentState.FAILED,
                    "Orchestrator is at capacity; retry later", null, null);
            } catch (InvalidStateException alreadyFinal) {
                log.debug("Rejected deployment {} was already final", deployment.getId());
            }
            locks.release(deployment.getMachineId(), deployment.getId());
            broadcaster.complete(deployment.getId(), DeploymentState.FAILED);
            throw e;
        }
    }

    private Deployment enqueue(Deployment deployment, Machine newMachine) {
        UUID machineId = deployment.getMachineId();
        if (!locks.tryAcquire(machineId, deployment.getId())) {
            if (locks.isHeldByReconciliation(machineId)) {
                throw new ConflictException("Machine " + machineId + " is being reconciled; retry shortly");
            }
            throw new ConflictException("Machine " + machineId + " already has an active deployment");
        }
        Deployment saved;
        try {
            saved = stateStore.createQueued(deployment, newMachine);
        } catch (DataIntegrityViolationException e) {
            locks.release(machineId, deployment.getId());
            throw new ConflictException("Machine " + machineId + " already has an active deployment", e);
        } catch (RuntimeException e) {
            locks.release(machineId, deployment.getId());
            throw e;
        }
        log.info("Deployment {} ({}) queued for machine {}", saved.getId(), saved.getType().getValue(), machineId);
        auditService.success(AuditAction.DEPLOYMENT_SUBMITTED, saved.getInitiatedBy(), AuditService.TARGET_DEPLOYMENT,
            saved.getId(), Map.of("type", saved.getType().getValue(), "machine_id", machineId.toString()));
        dispatch(saved);
        return saved;
    }

    private Map<String, Object> withCreationOptions(UUID machineId, Map<String, Object> params) {
        return deploymentRepository.findFirstByMachineIdAndTypeOrderByCreatedAtAsc(machineId, DeploymentType.CREATE)
            .map(create -> {
                Map<String, Object> merged = new HashMap<>(create.getParameters());
                merged.putAll(params);
                return merged;
            })
            .orElse(params);
    }

    private void validateParameters(DeploymentType type, Map<String, Object> params) {
        switch (type) {
            case UPDATE -> {
                if (!params.containsKey("size") && !params.containsKey("image") && !params.containsKey("tags")) {
                    throw new ValidationException("Update requires at least one of size, image or tags", "parameters");
                }
                Object tags = params.get("tags");
                if (tags != null && !(tags instanceof Map)) {
                    throw new ValidationException("tags must be an object of key/value pairs", "parameters.tags");
                }
            }
            case RESTART_SERVICE -> {
                Object serviceName = params.get("service_name");
                if (serviceName == null || !SERVICE_NAME.matcher(serviceName.toString()).matches()) {
                    throw new ValidationException("service_name is required", "parameters.service_name");
                }
            }
            default -> {
                // no required parameters
            }
        }
    }

    private void checkMachineState(DeploymentType type, Machine machine) {
        MachineStatus status = machine.getActualStatus();
        if (machine.getTerraformStateStatus() == TerraformStateStatus.UNKNOWN
            && type != DeploymentType.DESTROY && type != DeploymentType.REFRESH) {
            throw new InvalidStateException("Machine " + machine.getId()
                + " has an unknown infrastructure state after a failed change; sync or refresh it first");
        }
        switch (type) {
            case REBOOT -> {
                if (status != MachineStatus.RUNNING || machine.getProviderResourceId() == null) {
                    throw new InvalidStateException("Machine must be running to reboot (current: " + status.getValue() + ")");
                }
            }
            case RESTART_SERVICE -> {
                if (status != MachineStatus.RUNNING) {
                    throw new InvalidStateException(
                        "Machine must be running to restart a service (current: " + status.getValue() + ")");
                }
            }
            case UPDATE, REFRESH -> {
                if (status == MachineStatus.TERMINATED) {
                    throw new InvalidStateException("Machine " + machine.getId() + " is terminated");
                }
            }
            default -> {
                // destroy is allowed from any state, including after the resource vanished
            }
        }
    }
}
