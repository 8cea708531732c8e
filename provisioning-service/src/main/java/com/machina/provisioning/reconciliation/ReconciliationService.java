package com.machina.provisioning.reconciliation;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.deployment.MachineLockRegistry;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.DecryptionFailedException;
import com.machina.provisioning.exception.ProviderException;
import com.machina.provisioning.exception.UnsupportedProviderException;
import com.machina.provisioning.metrics.DeploymentMetrics;
import com.machina.provisioning.provider.ObservedResource;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.credentials.ProviderCredentials;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.vault.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Compares every machine not owned by an active deployment with what its provider reports.
 *
 * Provider calls are made once per account, before any machine is locked. A machine is
 * only written when something observable differs, so a second run with no provider-side
 * change writes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final MachineRepository machineRepository;
    private final DeploymentRepository deploymentRepository;
    private final ProviderAdapterRegistry adapters;
    private final CredentialStore credentialStore;
    private final MachineLockRegistry locks;
    private final AuditService auditService;
    private final DeploymentMetrics metrics;

    public SyncSummary reconcileAll() {
        List<Machine> machines = machineRepository.findByActualStatusNotOrderByCreatedAtAsc(MachineStatus.TERMINATED);
        Map<UUID, List<Machine>> byAccount = machines.stream()
            .collect(Collectors.groupingBy(Machine::getProviderAccountId, LinkedHashMap::new, Collectors.toList()));

        List<MachineSyncResult> results = new ArrayList<>();
        byAccount.forEach((accountId, accountMachines) -> results.addAll(reconcileAccount(accountId, accountMachines)));

        SyncSummary summary = SyncSummary.of(results);
        metrics.recordReconciliation("completed");
        log.info("Reconciliation finished: {} machines checked, {} updated", results.size(), summary.synced());
        return summary;
    }

    private List<MachineSyncResult> reconcileAccount(UUID accountId, List<Machine> machines) {
        Machine first = machines.get(0);
        Map<String, ObservedResource> observed;
        try {
            ProviderAdapter adapter = adapters.getSupported(first.getProviderType());
            Optional<ProviderCredentials> credentials = credentialStore.find(accountId, first.getProviderType());
            if (credentials.isEmpty()) {
                return allUnchanged(machines, ReconciliationAction.SKIPPED_NO_CREDENTIALS, null);
            }
            observed = adapter.describeResources(credentials.get());
        } catch (UnsupportedProviderException e) {
            return allUnchanged(machines, ReconciliationAction.SKIPPED_UNSUPPORTED_PROVIDER, e.getMessage());
        } catch (ProviderException | DecryptionFailedException e) {
            log.error("Reconciliation of provider account {} failed: {}", accountId, e.getMessage());
            metrics.recordReconciliation("account_error");
            return allUnchanged(machines, ReconciliationAction.ERROR, e.getMessage());
        }

        List<MachineSyncResult> results = new ArrayList<>();
        for (Machine machine : machines) {
            results.add(reconcileMachine(machine, observed));
        }
        return results;
    }

    private MachineSyncResult reconcileMachine(Machine machine, Map<String, ObservedResource> observed) {
        Optional<UUID> token = locks.tryAcquireForReconciliation(machine.getId());
        if (token.isEmpty()) {
            return MachineSyncResult.unchanged(machine, ReconciliationAction.SKIPPED_ACTIVE_DEPLOYMENT, null);
        }
        try {
            if (!deploymentRepository.findByMachineIdAndStateIn(machine.getId(), DeploymentState.ACTIVE).isEmpty()) {
                return MachineSyncResult.unchanged(machine, ReconciliationAction.SKIPPED_ACTIVE_DEPLOYMENT, null);
            }
            return compareAndUpdate(machine, observed);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Machine {} changed during reconciliation; will retry next run", machine.getId());
            return MachineSyncResult.unchanged(machine, ReconciliationAction.ERROR, "Concurrent modification");
        } finally {
            locks.releaseReconciliation(machine.getId(), token.get());
        }
    }

    private MachineSyncResult compareAndUpdate(Machine machine, Map<String, ObservedResource> observed) {
        MachineStatus previous = machine.getActualStatus();

        if (machine.getProviderResourceId() == null) {
            if (previous == MachineStatus.PROVISIONING || previous == MachineStatus.PENDING) {
                machine.setActualStatus(MachineStatus.ERROR);
                machine.setTerraformStateStatus(TerraformStateStatus.UNKNOWN);
                machine.setLastSyncedAt(Instant.now());
                machineRepository.save(machine);
                audit(machine, previous, AuditAction.MACHINE_STATUS_RECONCILED, "no provider resource id");
                return result(machine, previous, ReconciliationAction.MARKED_ERROR_NO_RESOURCE_ID);
            }
            return MachineSyncResult.unchanged(machine, ReconciliationAction.NO_CHANGE, null);
        }

        ObservedResource resource = observed.get(machine.getProviderResourceId());
        if (resource == null) {
            machine.setActualStatus(MachineStatus.TERMINATED);
            machine.setTerraformStateStatus(TerraformStateStatus.DRIFTED);
            machine.setLastSyncedAt(Instant.now());
            machineRepository.save(machine);
            metrics.recordDrift();
            audit(machine, previous, AuditAction.MACHINE_DRIFT_DETECTED, "resource no longer exists at provider");
            return result(machine, previous, ReconciliationAction.MARKED_TERMINATED_NOT_FOUND);
        }

        MachineStatus newStatus = resource.status();
        String publicIp = resource.publicIp() != null ? resource.publicIp() : machine.getPublicIp();
        String privateIp = resource.privateIp() != null ? resource.privateIp() : machine.getPrivateIp();
        TerraformStateStatus newStateStatus = stateStatusFor(machine, newStatus);

        boolean changed = newStatus != previous
            || !Objects.equals(publicIp, machine.getPublicIp())
            || !Objects.equals(privateIp, machine.getPrivateIp())
            || newStateStatus != machine.getTerraformStateStatus();
        if (!changed) {
            return MachineSyncResult.unchanged(machine, ReconciliationAction.NO_CHANGE, null);
        }

        boolean drifted = newStateStatus == TerraformStateStatus.DRIFTED
            && machine.getTerraformStateStatus() != TerraformStateStatus.DRIFTED;
        machine.setActualStatus(newStatus);
        machine.setPublicIp(publicIp);
        machine.setPrivateIp(privateIp);
        machine.setTerraformStateStatus(newStateStatus);
        machine.setLastSyncedAt(Instant.now());
        machineRepository.save(machine);

        if (drifted) {
            metrics.recordDrift();
            audit(machine, previous, AuditAction.MACHINE_DRIFT_DETECTED, "provider reports " + resource.providerStatus());
        } else {
            audit(machine, previous, AuditAction.MACHINE_STATUS_RECONCILED, "provider reports " + resource.providerStatus());
        }
        return result(machine, previous, ReconciliationAction.UPDATED);
    }

    /**
     * A machine that settled in a status other than the one asked for was changed outside
     * this system. Matching status clears an earlier drift, and a settled observation
     * resolves an unknown state left by a failed or interrupted change. Pending stays as
     * it is until a deployment writes the Terraform state.
     */
    private static TerraformStateStatus stateStatusFor(Machine machine, MachineStatus observed) {
        if (observed.isSettled() && observed != machine.getDesiredStatus()) {
            return TerraformStateStatus.DRIFTED;
        }
        TerraformStateStatus current = machine.getTerraformStateStatus();
        if (current == TerraformStateStatus.DRIFTED) {
            return TerraformStateStatus.IN_SYNC;
        }
        if (current == TerraformStateStatus.UNKNOWN && observed.isSettled()) {
            return TerraformStateStatus.IN_SYNC;
        }
        return current;
    }

    private void audit(Machine machine, MachineStatus previous, AuditAction action, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous_status", previous.getValue());
        details.put("new_status", machine.getActualStatus().getValue());
        details.put("terraform_state_status", machine.getTerraformStateStatus().getValue());
        details.put("reason", reason);
        auditService.success(action, null, AuditService.TARGET_MACHINE, machine.getId(), details);
    }

    private static MachineSyncResult result(Machine machine, MachineStatus previous, ReconciliationAction action) {
        return new MachineSyncResult(machine.getId(), machine.getName(), previous, machine.getActualStatus(), action, null);
    }

    private static List<MachineSyncResult> allUnchanged(List<Machine> machines, ReconciliationAction action,
                                                        String message) {
        return machines.stream().map(m -> MachineSyncResult.unchanged(m, action, message)).toList();
    }
}
