package com.machina.provisioning.deployment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ExecutionFailedException;
import com.machina.provisioning.exception.InvalidCredentialsException;
import com.machina.provisioning.exception.InvalidStateException;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.metrics.DeploymentMetrics;
import com.machina.provisioning.provider.FirewallRule;
import com.machina.provisioning.provider.ObservedResource;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.ResourceSpec;
import com.machina.provisioning.provider.credentials.ProviderCredentials;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.terraform.ExecutionCancelledException;
import com.machina.provisioning.terraform.ExecutionContext;
import com.machina.provisioning.terraform.LogSink;
import com.machina.provisioning.terraform.PlanMode;
import com.machina.provisioning.terraform.PlanResult;
import com.machina.provisioning.terraform.PlanSummary;
import com.machina.provisioning.terraform.ResourceChange;
import com.machina.provisioning.terraform.TerraformExecutor;
import com.machina.provisioning.terraform.Workspace;
import com.machina.provisioning.terraform.WorkspaceManager;
import com.machina.provisioning.vault.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives one deployment from its current state to the next resting point:
 * a terminal state, or awaiting_approval.
 *
 * Errors never escape {@link #execute(UUID)}; they end up in the deployment's log and
 * terminal state. The machine lock is released here once the deployment is terminal.
 */
@Component
@Slf4j
public class DeploymentJob {

    private final DeploymentStateStore stateStore;
    private final MachineRepository machineRepository;
    private final ProviderAdapterRegistry adapters;
    private final CredentialStore credentialStore;
    private final TerraformExecutor terraform;
    private final WorkspaceManager workspaceManager;
    private final ApprovalPolicy approvalPolicy;
    private final ExecutionRegistry executions;
    private final MachineLockRegistry locks;
    private final DeploymentLogBroadcaster broadcaster;
    private final AgentGateway agentGateway;
    private final AuditService auditService;
    private final DeploymentMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String serverUrl;
    private final Duration rebootPollInterval;
    private final int rebootMaxAttempts;

    public DeploymentJob(
        DeploymentStateStore stateStore,
        MachineRepository machineRepository,
        ProviderAdapterRegistry adapters,
        CredentialStore credentialStore,
        TerraformExecutor terraform,
        WorkspaceManager workspaceManager,
        ApprovalPolicy approvalPolicy,
        ExecutionRegistry executions,
        MachineLockRegistry locks,
        DeploymentLogBroadcaster broadcaster,
        AgentGateway agentGateway,
        AuditService auditService,
        DeploymentMetrics metrics,
        ObjectMapper objectMapper,
        @Value("${provisioning.server-url:http://localhost:8085}") String serverUrl,
        @Value("${provisioning.reboot.poll-interval:5s}") Duration rebootPollInterval,
        @Value("${provisioning.reboot.max-attempts:30}") int rebootMaxAttempts
    ) {
        this.stateStore = stateStore;
        this.machineRepository = machineRepository;
        this.adapters = adapters;
        this.credentialStore = credentialStore;
        this.terraform = terraform;
        this.workspaceManager = workspaceManager;
        this.approvalPolicy = approvalPolicy;
        this.executions = executions;
        this.locks = locks;
        this.broadcaster = broadcaster;
        this.agentGateway = agentGateway;
        this.auditService = auditService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.serverUrl = serverUrl;
        this.rebootPollInterval = rebootPollInterval;
        this.rebootMaxAttempts = rebootMaxAttempts;
    }

    public void execute(UUID deploymentId) {
        MDC.put("deploymentId", deploymentId.toString());
        ExecutionContext context;
        try {
            context = executions.register(deploymentId, broadcaster.sinkFor(deploymentId));
        } catch (IllegalStateException e) {
            log.warn("Deployment {} is already executing on this instance", deploymentId);
            MDC.remove("deploymentId");
            return;
        }
        try {
            run(deploymentId, context);
        } finally {
            executions.unregister(deploymentId);
            releaseIfTerminal(deploymentId);
            MDC.remove("deploymentId");
        }
    }

    private void run(UUID deploymentId, ExecutionContext context) {
        Deployment deployment;
        try {
            deployment = stateStore.get(deploymentId);
        } catch (ResourceNotFoundException e) {
            log.error("Dispatched deployment {} does not exist", deploymentId);
            return;
        }
        if (deployment.getState().isTerminal()) {
            return;
        }
        if (deployment.isCancelRequested()) {
            context.cancel();
        }

        try {
            switch (deployment.getState()) {
                case QUEUED -> start(deployment, context);
                case APPLYING -> resumeApproved(deployment, context);
                default -> log.warn("Deployment {} is {}; nothing to execute",
                    deploymentId, deployment.getState().getValue());
            }
        } catch (ExecutionCancelledException e) {
            finishCancelled(deploymentId, context);
        } catch (InvalidStateException e) {
            if (stateStore.get(deploymentId).getState().isTerminal()) {
                log.info("Deployment {} was finalized concurrently: {}", deploymentId, e.getMessage());
            } else {
                finishFailed(deploymentId, context, e);
            }
        } catch (Exception e) {
            if (context.isCancelled()) {
                finishCancelled(deploymentId, context);
            } else {
                finishFailed(deploymentId, context, e);
            }
        }
    }

    private void start(Deployment queued, ExecutionContext context) {
        UUID id = queued.getId();
        Deployment deployment = stateStore.transition(id, EnumSet.of(DeploymentState.QUEUED),
            DeploymentState.PLANNING, d -> d.setStartedAt(Instant.now()));
        context.getLogSink().info("Starting " + deployment.getType().getValue() + " deployment");

        switch (deployment.getType()) {
            case CREATE, UPDATE, DESTROY, REFRESH -> planAndContinue(deployment, context);
            case REBOOT -> reboot(deployment, context);
            case RESTART_SERVICE -> restartService(deployment, context);
        }
    }

    private void planAndContinue(Deployment deployment, ExecutionContext context) {
        Machine machine = loadMachine(deployment);
        ProviderAdapter adapter = adapters.getSupported(machine.getProviderType());
        ProviderCredentials credentials = credentialsFor(machine);
        Map<String, Object> variables = adapter.terraformVariables(credentials, resourceSpec(machine, deployment));
        PlanMode mode = planModeFor(deployment.getType());

        Workspace workspace = terraform.open(machine.getTerraformWorkspace(), adapter.terraformModule());
        try {
            terraform.init(workspace, context);
            checkCancelled(context);
            PlanResult plan = terraform.plan(workspace, variables, mode, context);
            stateStore.update(deployment.getId(), d -> {
                d.setPlanSummary(plan.summary());
                d.setRawPlan(plan.rawPlan());
                d.setTerraformWorkspace(workspace.getName());
            });
            checkCancelled(context);

            if (deployment.getType() != DeploymentType.DESTROY && approvalPolicy.autoApproves(plan.summary())) {
                context.getLogSink().info("Plan auto-approved");
                stateStore.transition(deployment.getId(), EnumSet.of(DeploymentState.PLANNING),
                    DeploymentState.APPLYING, null);
                applyAndFinish(deployment, adapter, workspace, context);
            } else {
                stateStore.transition(deployment.getId(), EnumSet.of(DeploymentState.PLANNING),
                    DeploymentState.AWAITING_APPROVAL, null);
                context.getLogSink().info("Plan requires approval before it is applied");
            }
        } finally {
            terraform.cleanup(workspace);
        }
    }

    /**
     * Plan files do not survive the wait for approval, so the plan is recomputed and must
     * match what was approved before anything is applied.
     */
    private void resumeApproved(Deployment deployment, ExecutionContext context) {
        Machine machine = loadMachine(deployment);
        ProviderAdapter adapter = adapters.getSupported(machine.getProviderType());
        ProviderCredentials credentials = credentialsFor(machine);
        Map<String, Object> variables = adapter.terraformVariables(credentials, resourceSpec(machine, deployment));

        Workspace workspace = terraform.open(machine.getTerraformWorkspace(), adapter.terraformModule());
        try {
            context.getLogSink().info("Approved; re-planning before apply");
            terraform.init(workspace, context);
            checkCancelled(context);
            PlanResult plan = terraform.plan(workspace, variables, planModeFor(deployment.getType()), context);
            if (!sameChanges(deployment.getPlanSummary(), plan.summary())) {
                throw new ExecutionFailedException(
                    "Plan changed since approval; submit a new deployment", -1, List.of());
            }
            applyAndFinish(deployment, adapter, workspace, context);
        } finally {
            terraform.cleanup(workspace);
        }
    }

    private void applyAndFinish(Deployment deployment, ProviderAdapter adapter, Workspace workspace,
                                ExecutionContext context) {
        checkCancelled(context);
        if (deployment.getType() == DeploymentType.DESTROY) {
            terraform.destroy(workspace, context);
            finishSucceeded(deployment, context, Map.of(), Machine::markDestroyed);
            removeWorkspace(workspace.getName());
            return;
        }

        Map<String, Object> outputs = terraform.apply(workspace, context);
        finishSucceeded(deployment, context, outputs, machine -> applyOutputs(machine, deployment, adapter, outputs));
    }

    private void reboot(Deployment deployment, ExecutionContext context) {
        Machine machine = loadMachine(deployment);
        if (machine.getProviderResourceId() == null) {
            throw new InvalidStateException("Machine " + machine.getId() + " has no provider resource to reboot");
        }
        ProviderAdapter adapter = adapters.getSupported(machine.getProviderType());
        ProviderCredentials credentials = credentialsFor(machine);
        LogSink sink = context.getLogSink();

        stateStore.transition(deployment.getId(), EnumSet.of(DeploymentState.PLANNING), DeploymentState.APPLYING, null);
        sink.info("Requesting reboot of " + machine.getProviderType().getValue() + " resource "
            + machine.getProviderResourceId());
        adapter.rebootResource(credentials, machine.getProviderResourceId());

        for (int attempt = 1; attempt <= rebootMaxAttempts; attempt++) {
            pause(context);
            Optional<ObservedResource> observed = adapter.describeResource(credentials, machine.getProviderResourceId());
            if (observed.isEmpty()) {
                throw new ExecutionFailedException("Resource disappeared during reboot", -1, List.of());
            }
            ObservedResource resource = observed.get();
            if (resource.status() == MachineStatus.RUNNING) {
                sink.info("Machine is running again");
                finishSucceeded(deployment, context, Map.of("status", resource.providerStatus()), m -> {
                    m.setActualStatus(MachineStatus.RUNNING);
                    m.setLastSyncedAt(Instant.now());
                    if (resource.publicIp() != null) {
                        m.setPublicIp(resource.publicIp());
                    }
                });
                return;
            }
            sink.info(String.format("Waiting for machine to come back (%d/%d): %s",
                attempt, rebootMaxAttempts, resource.providerStatus()));
        }
        throw new ExecutionFailedException(
            "Machine did not return to running after " + rebootMaxAttempts + " checks", -1, List.of());
    }

    private void restartService(Deployment deployment, ExecutionContext context) {
        Machine machine = loadMachine(deployment);
        String serviceName = deployment.getStringParameter("service_name");
        stateStore.transition(deployment.getId(), EnumSet.of(DeploymentState.PLANNING), DeploymentState.APPLYING, null);
        context.getLogSink().info("Restarting service " + serviceName + " through the machine agent");
        agentGateway.restartService(machine, serviceName, context.getLogSink());
        finishSucceeded(deployment, context, Map.of("service_name", serviceName), null);
    }

    private void finishSucceeded(Deployment deployment, ExecutionContext context, Map<String, Object> outputs,
                                 Consumer<Machine> machineMutator) {
        Deployment done = stateStore.finish(deployment.getId(), DeploymentState.SUCCEEDED, null, outputs, machineMutator);
        context.getLogSink().info("Deployment succeeded");
        auditService.success(AuditAction.DEPLOYMENT_SUCCEEDED, deployment.getInitiatedBy(),
            AuditService.TARGET_DEPLOYMENT, deployment.getId(),
            Map.of("type", deployment.getType().getValue(), "machine_id", String.valueOf(deployment.getMachineId())));
        metrics.recordFinished(done.getType(), DeploymentState.SUCCEEDED, durationOf(done));
    }

    private void finishFailed(UUID deploymentId, ExecutionContext context, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("Deployment {} failed: {}", deploymentId, message);
        context.getLogSink().error("Deployment failed: " + message);
        try {
            boolean touchedInfrastructure = stateStore.get(deploymentId).getState() == DeploymentState.APPLYING;
            Deployment done = stateStore.finish(deploymentId, DeploymentState.FAILED, message, null,
                touchedInfrastructure ? this::markStateUnknown : null);
            auditService.failure(AuditAction.DEPLOYMENT_FAILED, done.getInitiatedBy(),
                AuditService.TARGET_DEPLOYMENT, deploymentId, Map.of("error", message));
            metrics.recordFinished(done.getType(), DeploymentState.FAILED, durationOf(done));
        } catch (InvalidStateException e) {
            log.info("Deployment {} was finalized concurrently: {}", deploymentId, e.getMessage());
        }
    }

    private void finishCancelled(UUID deploymentId, ExecutionContext context) {
        context.getLogSink().warn("Deployment cancelled");
        try {
            Deployment current = stateStore.get(deploymentId);
            boolean touchedInfrastructure = current.getState() == DeploymentState.APPLYING;
            Deployment done = stateStore.finish(deploymentId, DeploymentState.CANCELLED, "Cancelled by user", null,
                touchedInfrastructure ? this::markStateUnknown : null);
            auditService.success(AuditAction.DEPLOYMENT_CANCELLED, done.getInitiatedBy(),
                AuditService.TARGET_DEPLOYMENT, deploymentId, Map.of("during", current.getState().getValue()));
            metrics.recordFinished(done.getType(), DeploymentState.CANCELLED, durationOf(done));
        } catch (InvalidStateException e) {
            log.info("Deployment {} was finalized concurrently: {}", deploymentId, e.getMessage());
        }
    }

    private void releaseIfTerminal(UUID deploymentId) {
        try {
            Deployment deployment = stateStore.get(deploymentId);
            if (deployment.getState().isTerminal()) {
                locks.release(deployment.getMachineId(), deploymentId);
                broadcaster.complete(deploymentId, deployment.getState());
            }
        } catch (RuntimeException e) {
            log.error("Failed to finalize deployment {}", deploymentId, e);
        }
    }

    /**
     * The resource may be half-changed; only reconciliation may say what it is now.
     */
    private void markStateUnknown(Machine machine) {
        machine.setTerraformStateStatus(TerraformStateStatus.UNKNOWN);
    }

    private void applyOutputs(Machine machine, Deployment deployment, ProviderAdapter adapter,
                              Map<String, Object> outputs) {
        String resourceId = stringOutput(outputs, "resource_id");
        if (resourceId != null) {
            machine.setProviderResourceId(resourceId);
        }
        String publicIp = stringOutput(outputs, "public_ip");
        if (publicIp != null) {
            machine.setPublicIp(publicIp);
        }
        String privateIp = stringOutput(outputs, "private_ip");
        if (privateIp != null) {
            machine.setPrivateIp(privateIp);
        }
        String firewallId = stringOutput(outputs, "firewall_id");
        if (firewallId != null) {
            machine.setFirewallId(firewallId);
        }
        String status = stringOutput(outputs, "status");
        if (status != null) {
            machine.setActualStatus(adapter.mapStatus(status));
        }
        if (deployment.getType() == DeploymentType.UPDATE) {
            Optional.ofNullable(deployment.getStringParameter("size")).ifPresent(machine::setSize);
            Optional.ofNullable(deployment.getStringParameter("image")).ifPresent(machine::setImage);
            Map<String, String> tags = tagsParameter(deployment);
            if (tags != null) {
                machine.setTags(tags);
            }
        }
        machine.setTerraformStateStatus(TerraformStateStatus.IN_SYNC);
        machine.setLastSyncedAt(Instant.now());
    }

    private void removeWorkspace(String name) {
        try {
            workspaceManager.remove(name);
        } catch (ExecutionFailedException e) {
            log.error("Destroyed machine's workspace {} could not be removed; startup recovery will retry", name, e);
        }
    }

    ResourceSpec resourceSpec(Machine machine, Deployment deployment) {
        Map<String, String> tags = tagsParameter(deployment);
        Object enabled = deployment.getParameters().get("firewall_enabled");
        return ResourceSpec.builder()
            .machineId(machine.getId())
            .name(machine.getName())
            .region(machine.getRegion())
            .size(Optional.ofNullable(deployment.getStringParameter("size")).orElse(machine.getSize()))
            .image(Optional.ofNullable(deployment.getStringParameter("image")).orElse(machine.getImage()))
            .tags(tags != null ? tags : machine.getTags())
            .sshKeyIds(listParameter(deployment, "ssh_key_ids"))
            .userData(renderUserData(deployment.getStringParameter("user_data"), machine))
            .firewallEnabled(enabled == null || Boolean.parseBoolean(enabled.toString()))
            .firewallRules(firewallRules(deployment))
            .build();
    }

    private String renderUserData(String template, Machine machine) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        return template
            .replace("{{MACHINE_ID}}", machine.getId().toString())
            .replace("{{SERVER_URL}}", serverUrl);
    }

    private List<FirewallRule> firewallRules(Deployment deployment) {
        Object raw = deployment.getParameters().get("firewall_rules");
        if (raw == null) {
            return List.of();
        }
        try {
            return objectMapper.convertValue(raw, new TypeReference<List<FirewallRule>>() { });
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid firewall rules", "firewall_rules");
        }
    }

    private List<String> listParameter(Deployment deployment, String key) {
        Object raw = deployment.getParameters().get(key);
        if (!(raw instanceof List<?> values)) {
            return List.of();
        }
        return values.stream().map(String::valueOf).toList();
    }

    private Map<String, String> tagsParameter(Deployment deployment) {
        Object raw = deployment.getParameters().get("tags");
        if (!(raw instanceof Map<?, ?> values)) {
            return null;
        }
        Map<String, String> tags = new HashMap<>();
        values.forEach((k, v) -> tags.put(String.valueOf(k), String.valueOf(v)));
        return tags;
    }

    private Machine loadMachine(Deployment deployment) {
        return machineRepository.findById(deployment.getMachineId())
            .orElseThrow(() -> new ResourceNotFoundException("Machine", deployment.getMachineId()));
    }

    private ProviderCredentials credentialsFor(Machine machine) {
        return credentialStore.find(machine.getProviderAccountId(), machine.getProviderType())
            .orElseThrow(() -> new InvalidCredentialsException(
                "No credentials stored for provider account " + machine.getProviderAccountId()));
    }

    static PlanMode planModeFor(DeploymentType type) {
        return switch (type) {
            case DESTROY -> PlanMode.DESTROY;
            case REFRESH -> PlanMode.REFRESH_ONLY;
            default -> PlanMode.NORMAL;
        };
    }

    static boolean sameChanges(PlanSummary approved, PlanSummary current) {
        if (approved == null) {
            return false;
        }
        return changeKeys(approved).equals(changeKeys(current));
    }

    private static Set<String> changeKeys(PlanSummary summary) {
        return summary.resourceChanges().stream()
            .map(rc -> rc.address() + "|" + rc.action().getValue())
            .collect(Collectors.toSet());
    }

    private static String stringOutput(Map<String, Object> outputs, String key) {
        Object value = outputs.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static Duration durationOf(Deployment deployment) {
        if (deployment.getStartedAt() == null || deployment.getFinishedAt() == null) {
            return null;
        }
        return Duration.between(deployment.getStartedAt(), deployment.getFinishedAt());
    }

    private static void checkCancelled(ExecutionContext context) {
        if (context.isCancelled()) {
            throw new ExecutionCancelledException("Deployment " + context.getDeploymentId() + " was cancelled");
        }
    }

    private void pause(ExecutionContext context) {
        checkCancelled(context);
        if (rebootPollInterval.isZero()) {
            return;
        }
        try {
            Thread.sleep(rebootPollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted while waiting for reboot");
        }
        checkCancelled(context);
    }
}
