package com.machina.provisioning.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.deployment.DeploymentService;
import com.machina.provisioning.dto.request.CreateMachineRequest;
import com.machina.provisioning.dto.request.UpdateMachineRequest;
import com.machina.provisioning.dto.response.MachineCreatedResponse;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.provider.FirewallRule;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.RegionOption;
import com.machina.provisioning.provider.SizeOption;
import com.machina.provisioning.reconciliation.ReconciliationService;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.repository.ProviderAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MachineServiceTest {

    @Mock
    private MachineRepository machineRepository;
    @Mock
    private ProviderAccountRepository providerAccountRepository;
    @Mock
    private ProviderAdapterRegistry adapters;
    @Mock
    private ProviderAdapter adapter;
    @Mock
    private DeploymentService deploymentService;
    @Mock
    private ReconciliationService reconciliationService;

    private MachineService service;
    private final UUID accountId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new MachineService(machineRepository, providerAccountRepository, adapters,
            deploymentService, reconciliationService, new ObjectMapper());

        ProviderAccount account = ProviderAccount.builder()
            .id(accountId)
            .providerType(ProviderType.DIGITALOCEAN)
            .label("Main")
            .build();
        lenient().when(providerAccountRepository.findById(accountId)).thenReturn(Optional.of(account));
        lenient().when(adapters.getSupported(ProviderType.DIGITALOCEAN)).thenReturn(adapter);
        lenient().when(adapter.listRegions()).thenReturn(List.of(new RegionOption("nyc1", "New York 1")));
        lenient().when(adapter.listSizes()).thenReturn(List.of(
            SizeOption.monthly("s-1vcpu-1gb", "Basic", 1, 1024, 25, 6.0)));
        lenient().when(deploymentService.submitCreate(any(), anyMap(), any())).thenAnswer(inv ->
            Deployment.builder()
                .id(UUID.randomUUID())
                .type(DeploymentType.CREATE)
                .state(DeploymentState.QUEUED)
                .machineId(inv.<Machine>getArgument(0).getId())
                .build());
    }

    @Test
    void createMachineStartsProvisioningWithPendingState() {
        MachineCreatedResponse response = service.createMachine(request("nyc1", "s-1vcpu-1gb", null), 42L);

        ArgumentCaptor<Machine> machine = ArgumentCaptor.forClass(Machine.class);
        verify(deploymentService).submitCreate(machine.capture(), anyMap(), eq(42L));
        assertThat(machine.getValue().getActualStatus()).isEqualTo(MachineStatus.PROVISIONING);
        assertThat(machine.getValue().getDesiredStatus()).isEqualTo(MachineStatus.RUNNING);
        assertThat(machine.getValue().getTerraformStateStatus()).isEqualTo(TerraformStateStatus.PENDING);
        assertThat(machine.getValue().getTerraformWorkspace()).isEqualTo("machine-" + machine.getValue().getId());
        assertThat(response.machine().machineId()).isEqualTo(machine.getValue().getId());
        assertThat(response.deployment().machineId()).isEqualTo(machine.getValue().getId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void createMachinePassesFirewallAndUserDataAsParameters() {
        FirewallRule http = new FirewallRule("tcp", "80", List.of("0.0.0.0/0"));
        service.createMachine(request("nyc1", "s-1vcpu-1gb", List.of(http)), 42L);

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(deploymentService).submitCreate(any(), params.capture(), eq(42L));
        assertThat(params.getValue())
            .containsEntry("firewall_enabled", true)
            .containsEntry("user_data", "#!/bin/sh\necho {{MACHINE_ID}}")
            .containsEntry("ssh_key_ids", List.of("101"));
        List<Map<String, Object>> rules = (List<Map<String, Object>>) params.getValue().get("firewall_rules");
        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule).containsEntry("port_range", "80");
            assertThat(rule).containsEntry("protocol", "tcp");
        });
    }

    @Test
    void unknownRegionOrSizeIsRejectedBeforeAnyDeployment() {
        assertThatThrownBy(() -> service.createMachine(request("mars1", "s-1vcpu-1gb", null), 42L))
            .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getField()).isEqualTo("region"));
        assertThatThrownBy(() -> service.createMachine(request("nyc1", "huge", null), 42L))
            .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getField()).isEqualTo("size"));

        verify(deploymentService, never()).submitCreate(any(), anyMap(), any());
    }

    @Test
    void unknownProviderAccountIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(providerAccountRepository.findById(missing)).thenReturn(Optional.empty());

        CreateMachineRequest request = new CreateMachineRequest("web-1", missing, "nyc1", "s-1vcpu-1gb",
            "ubuntu-22-04-x64", null, null, null, null, null);

        assertThatThrownBy(() -> service.createMachine(request, 42L))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void updateOnlyCarriesProvidedFields() {
        UUID machineId = UUID.randomUUID();
        when(deploymentService.submit(eq(DeploymentType.UPDATE), eq(machineId), anyMap(), eq(42L)))
            .thenReturn(Deployment.builder()
                .id(UUID.randomUUID())
                .type(DeploymentType.UPDATE)
                .state(DeploymentState.QUEUED)
                .machineId(machineId)
                .build());

        service.update(machineId, new UpdateMachineRequest("s-2vcpu-4gb", null, null), 42L);

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(deploymentService).submit(eq(DeploymentType.UPDATE), eq(machineId), params.capture(), eq(42L));
        assertThat(params.getValue()).containsOnlyKeys("size");
    }

    private CreateMachineRequest request(String region, String size, List<FirewallRule> rules) {
        return new CreateMachineRequest("web-1", accountId, region, size, "ubuntu-22-04-x64",
            Map.of("env", "prod"), List.of("101"), "#!/bin/sh\necho {{MACHINE_ID}}", null, rules);
    }
}
