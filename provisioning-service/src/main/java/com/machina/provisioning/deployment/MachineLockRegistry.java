package com.machina.provisioning.deployment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one deployment owns a machine at any time. Acquisition never blocks:
 * a caller that loses the race gets {@code false} and reports CONFLICT.
 */
@Component
@Slf4j
public class MachineLockRegistry {

    private final Map<UUID, UUID> owners = new ConcurrentHashMap<>();
    private final Set<UUID> reconciliationOwners = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the lock is now held by {@code deploymentId} (re-entrant for the same owner)
     */
    public boolean tryAcquire(UUID machineId, UUID deploymentId) {
        UUID owner = owners.putIfAbsent(machineId, deploymentId);
        boolean acquired = owner == null || owner.equals(deploymentId);
        if (acquired) {
            log.debug("Machine {} locked by deployment {}", machineId, deploymentId);
        }
        return acquired;
    }

    /**
     * Release only if still owned by {@code deploymentId}.
     */
    public void release(UUID machineId, UUID deploymentId) {
        if (machineId != null && owners.remove(machineId, deploymentId)) {
            log.debug("Machine {} released by deployment {}", machineId, deploymentId);
        }
    }

    /**
     * Hold a machine for one reconciliation check.
     *
     * @return the owner token to release with, or empty if the machine is already held
     */
    public Optional<UUID> tryAcquireForReconciliation(UUID machineId) {
        UUID token = UUID.randomUUID();
        reconciliationOwners.add(token);
        if (tryAcquire(machineId, token)) {
            return Optional.of(token);
        }
        reconciliationOwners.remove(token);
        return Optional.empty();
    }

    public void releaseReconciliation(UUID machineId, UUID token) {
        release(machineId, token);
        reconciliationOwners.remove(token);
    }

    public boolean isHeldByReconciliation(UUID machineId) {
        UUID owner = owners.get(machineId);
        return owner != null && reconciliationOwners.contains(owner);
    }

    public boolean isLocked(UUID machineId) {
        return owners.containsKey(machineId);
    }

    public Optional<UUID> ownerOf(UUID machineId) {
        return Optional.ofNullable(owners.get(machineId));
    }
}
