package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.exception.InvalidStateException;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.terraform.ExecutionCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The only writer of deployment state.
 *
 * Every method runs one short transaction while holding the deployment's stripe lock,
 * so transitions of one deployment never interleave and each is committed before the
 * caller observes its result. No external process or provider call runs in here.
 */
@Service
@Slf4j
public class DeploymentStateStore {

    private static final int STRIPES = 64;

    private final DeploymentRepository deploymentRepository;
    private final MachineRepository machineRepository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public DeploymentStateStore(
        DeploymentRepository deploymentRepository,
        MachineRepository machineRepository,
        PlatformTransactionManager transactionManager
    ) {
        this.deploymentRepository = deploymentRepository;
        this.machineRepository = machineRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Persist a new queued deployment, together with the machine it creates when {@code newMachine} is set.
     */
    public Deployment createQueued(Deployment deployment, Machine newMachine) {
        return locked(deployment.getId(), () -> {
            if (newMachine != null) {
                machineRepository.saveAndFlush(newMachine);
            }
            deployment.setState(DeploymentState.QUEUED);
            return deploymentRepository.saveAndFlush(deployment);
        });
    }

    public Deployment get(UUID deploymentId) {
        return deploymentRepository.findById(deploymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Deployment", deploymentId));
    }

    /**
     * Move a deployment from one of {@code from} to {@code to}, applying {@code mutator} in the same transaction.
     *
     * @throws InvalidStateException if the current state is not in {@code from}
     * @throws ExecutionCancelledException if a cancel was requested and {@code to} is not terminal
     */
    public Deployment transition(UUID deploymentId, Set<DeploymentState> from, DeploymentState to,
                                 Consumer<Deployment> mutator) {
        return locked(deploymentId, () -> {
            Deployment deployment = load(deploymentId);
            if (!from.contains(deployment.getState())) {
                throw new InvalidStateException(String.format(
                    "Deployment %s is %s; expected one of %s",
                    deploymentId, deployment.getState().getValue(), from));
            }
            if (deployment.isCancelRequested() && !to.isTerminal()) {
                throw new ExecutionCancelledException("Deployment " + deploymentId + " was cancelled");
            }
            DeploymentState previous = deployment.getState();
            deployment.setState(to);
            if (to.isTerminal()) {
                deployment.setFinishedAt(Instant.now());
            }
            if (mutator != null) {
                mutator.accept(deployment);
            }
            Deployment saved = deploymentRepository.save(deployment);
            log.info("Deployment {} {} -> {}", deploymentId, previous.getValue(), to.getValue());
            return saved;
        });
    }

    /**
     * Apply a non-transitional update to an active deployment (plan summary, raw plan, workspace).
     */
    public Deployment update(UUID deploymentId, Consumer<Deployment> mutator) {
        return locked(deploymentId, () -> {
            Deployment deployment = load(deploymentId);
            if (deployment.getState().isTerminal()) {
                throw new InvalidStateException("Deployment " + deploymentId + " is already "
                    + deployment.getState().getValue());
            }
            mutator.accept(deployment);
            return deploymentRepository.save(deployment);
        });
    }

    /**
     * Cancel a deployment in one step.
     *
     * Queued and awaiting-approval deployments become CANCELLED immediately. Planning and
     * applying ones only get the advisory flag; their job finalizes them once the running
     * process exits. Repeated requests on a flagged deployment return it unchanged.
     *
     * @throws InvalidStateException if the deployment is already terminal
     */
    public Deployment cancel(UUID deploymentId, Long actorId) {
        return locked(deploymentId, () -> {
            Deployment deployment = load(deploymentId);
            DeploymentState state = deployment.getState();
            if (state.isTerminal()) {
                throw new InvalidStateException("Deployment " + deploymentId + " is already " + state.getValue());
            }
            if (state.isCleanlyCancellable()) {
                deployment.setState(DeploymentState.CANCELLED);
                deployment.setFinishedAt(Instant.now());
                deployment.setErrorMessage("Cancelled by user");
                log.info("Deployment {} {} -> cancelled by {}", deploymentId, state.getValue(), actorId);
            } else if (!deployment.isCancelRequested()) {
                deployment.setCancelRequested(true);
                log.info("Cancel requested for deployment {} in state {} by {}", deploymentId, state.getValue(), actorId);
            } else {
                return deployment;
            }
            return deploymentRepository.save(deployment);
        });
    }

    /**
     * Finalize a deployment and write its machine in the same transaction, so the machine
     * is never observable in its new state before the deployment is terminal.
     *
     * @param machineMutator applied to the target machine when it still exists; may be null
     */
    public Deployment finish(UUID deploymentId, DeploymentState terminal, String errorMessage,
                             Map<String, Object> outputs, Consumer<Machine> machineMutator) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        return locked(deploymentId, () -> {
            Deployment deployment = load(deploymentId);
            if (deployment.getState().isTerminal()) {
                throw new InvalidStateException("Deployment " + deploymentId + " is already "
                    + deployment.getState().getValue());
            }
            if (machineMutator != null && deployment.getMachineId() != null) {
                machineRepository.findById(deployment.getMachineId()).ifPresent(machine -> {
                    machineMutator.accept(machine);
                    machineRepository.save(machine);
                });
            }
            DeploymentState previous = deployment.getState();
            deployment.setState(terminal);
            deployment.setFinishedAt(Instant.now());
            deployment.setErrorMessage(errorMessage);
            if (outputs != null) {
                deployment.setOutputs(outputs);
            }
            Deployment saved = deploymentRepository.save(deployment);
            log.info("Deployment {} {} -> {}", deploymentId, previous.getValue(), terminal.getValue());
            return saved;
        });
    }

    private Deployment load(UUID deploymentId) {
        return deploymentRepository.findById(deploymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Deployment", deploymentId));
    }

    private <T> T locked(UUID deploymentId, Supplier<T> work) {
        ReentrantLock lock = stripes[Math.floorMod(deploymentId.hashCode(), STRIPES)];
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }
}
