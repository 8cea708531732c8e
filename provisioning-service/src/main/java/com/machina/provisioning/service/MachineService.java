package com.machina.provisioning.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.deployment.DeploymentService;
import com.machina.provisioning.dto.request.CreateMachineRequest;
import com.machina.provisioning.dto.request.UpdateMachineRequest;
import com.machina.provisioning.dto.response.DeploymentResponse;
import com.machina.provisioning.dto.response.MachineCreatedResponse;
import com.machina.provisioning.dto.response.MachineResponse;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.reconciliation.ReconciliationService;
import com.machina.provisioning.reconciliation.SyncSummary;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.repository.ProviderAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Machine records and the lifecycle actions users trigger on them.
 * Every action becomes a deployment; nothing here talks to a provider directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MachineService {

    private final MachineRepository machineRepository;
    private final ProviderAccountRepository providerAccountRepository;
    private final ProviderAdapterRegistry adapters;
    private final DeploymentService deploymentService;
    private final ReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;

    /**
     * Create the machine record and its create deployment. The machine starts as
     * provisioning with a pending Terraform state.
     */
    public MachineCreatedResponse createMachine(CreateMachineRequest request, Long userId) {
        ProviderAccount account = providerAccountRepository.findById(request.providerAccountId())
            .orElseThrow(() -> new ResourceNotFoundException("Provider account", request.providerAccountId()));
        ProviderAdapter adapter = adapters.getSupported(account.getProviderType());
        checkCatalog(adapter, request);

        UUID machineId = UUID.randomUUID();
        Machine machine = Machine.builder()
            .id(machineId)
            .name(request.name())
            .providerType(account.getProviderType())
            .providerAccountId(account.getId())
            .region(request.region())
            .size(request.size())
            .image(request.image())
            .desiredStatus(MachineStatus.RUNNING)
            .actualStatus(MachineStatus.PROVISIONING)
            .terraformStateStatus(TerraformStateStatus.PENDING)
            .terraformWorkspace(Machine.workspaceNameFor(machineId))
            .tags(request.tags() == null ? new HashMap<>() : new HashMap<>(request.tags()))
            .createdBy(userId)
            .build();

        Deployment deployment = deploymentService.submitCreate(machine, creationParameters(request), userId);
        log.info("User {} requested machine {} ({}) on {}", userId, machineId, request.name(),
            account.getProviderType().getValue());
        return new MachineCreatedResponse(MachineResponse.from(machine), DeploymentResponse.from(deployment));
    }

    @Transactional(readOnly = true)
    public Page<MachineResponse> listMachines(MachineStatus status, ProviderType providerType, String region,
                                              String search, Pageable pageable) {
        String namePattern = search == null || search.isBlank() ? "%" : "%" + search.trim().toLowerCase() + "%";
        return machineRepository.search(status, providerType, region, namePattern, pageable)
            .map(MachineResponse::from);
    }

    @Transactional(readOnly = true)
    public MachineResponse getMachine(UUID machineId) {
        return MachineResponse.from(machineRepository.findById(machineId)
            .orElseThrow(() -> new ResourceNotFoundException("Machine", machineId)));
    }

    public DeploymentResponse reboot(UUID machineId, Long userId) {
        return submit(DeploymentType.REBOOT, machineId, Map.of(), userId);
    }

    public DeploymentResponse destroy(UUID machineId, Long userId) {
        return submit(DeploymentType.DESTROY, machineId, Map.of(), userId);
    }

    public DeploymentResponse refresh(UUID machineId, Long userId) {
        return submit(DeploymentType.REFRESH, machineId, Map.of(), userId);
    }

    public DeploymentResponse restartService(UUID machineId, String serviceName, Long userId) {
        return submit(DeploymentType.RESTART_SERVICE, machineId, Map.of("service_name", serviceName), userId);
    }

    public DeploymentResponse update(UUID machineId, UpdateMachineRequest request, Long userId) {
        Map<String, Object> params = new HashMap<>();
        if (request.size() != null) {
            params.put("size", request.size());
        }
        if (request.image() != null) {
            params.put("image", request.image());
        }
        if (request.tags() != null) {
            params.put("tags", new HashMap<>(request.tags()));
        }
        return submit(DeploymentType.UPDATE, machineId, params, userId);
    }

    public SyncSummary sync() {
        return reconciliationService.reconcileAll();
    }

    private DeploymentResponse submit(DeploymentType type, UUID machineId, Map<String, Object> params, Long userId) {
        return DeploymentResponse.from(deploymentService.submit(type, machineId, params, userId));
    }

    private void checkCatalog(ProviderAdapter adapter, CreateMachineRequest request) {
        boolean knownRegion = adapter.listRegions().stream().anyMatch(r -> r.slug().equals(request.region()));
        if (!knownRegion) {
            throw new ValidationException("Unknown region: " + request.region(), "region");
        }
        boolean knownSize = adapter.listSizes().stream().anyMatch(s -> s.slug().equals(request.size()));
        if (!knownSize) {
            throw new ValidationException("Unknown size: " + request.size(), "size");
        }
    }

    private Map<String, Object> creationParameters(CreateMachineRequest request) {
        Map<String, Object> params = new HashMap<>();
        if (request.sshKeyIds() != null && !request.sshKeyIds().isEmpty()) {
            params.put("ssh_key_ids", List.copyOf(request.sshKeyIds()));
        }
        if (request.userData() != null && !request.userData().isBlank()) {
            params.put("user_data", request.userData());
        }
        params.put("firewall_enabled", request.firewallEnabled() == null || request.firewallEnabled());
        if (request.firewallRules() != null && !request.firewallRules().isEmpty()) {
            params.put("firewall_rules", objectMapper.convertValue(request.firewallRules(),
                new TypeReference<List<Map<String, Object>>>() { }));
        }
        return params;
    }
}
