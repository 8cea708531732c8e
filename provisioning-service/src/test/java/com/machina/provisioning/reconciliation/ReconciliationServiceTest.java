package com.machina.provisioning.reconciliation;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.deployment.MachineLockRegistry;
import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.exception.ProviderException;
import com.machina.provisioning.metrics.DeploymentMetrics;
import com.machina.provisioning.provider.ObservedResource;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.credentials.DigitalOceanCredentials;
import com.machina.provisioning.repository.DeploymentRepository;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.vault.CredentialStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    private static final UUID ACCOUNT = UUID.randomUUID();
    private static final DigitalOceanCredentials CREDENTIALS = new DigitalOceanCredentials("dop_v1_test_token");

    @Mock
    private MachineRepository machineRepository;
    @Mock
    private DeploymentRepository deploymentRepository;
    @Mock
    private ProviderAdapter adapter;
    @Mock
    private CredentialStore credentialStore;
    @Mock
    private AuditService auditService;

    private final MachineLockRegistry locks = new MachineLockRegistry();
    private final List<Machine> machines = new ArrayList<>();
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        lenient().when(adapter.providerType()).thenReturn(ProviderType.DIGITALOCEAN);
        lenient().when(adapter.isSupported()).thenReturn(true);
        lenient().when(machineRepository.findByActualStatusNotOrderByCreatedAtAsc(MachineStatus.TERMINATED))
            .thenAnswer(inv -> machines.stream().filter(m -> m.getActualStatus() != MachineStatus.TERMINATED).toList());
        lenient().when(machineRepository.save(any(Machine.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(credentialStore.find(ACCOUNT, ProviderType.DIGITALOCEAN)).thenReturn(Optional.of(CREDENTIALS));

        service = new ReconciliationService(machineRepository, deploymentRepository,
            new ProviderAdapterRegistry(List.of(adapter)), credentialStore, locks, auditService,
            new DeploymentMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void updatesChangedMachinesAndSecondRunChangesNothing() {
        Machine web = machine("web", "100", MachineStatus.RUNNING);
        Machine db = machine("db", "200", MachineStatus.PROVISIONING);
        Machine gone = machine("gone", "300", MachineStatus.RUNNING);
        when(adapter.describeResources(CREDENTIALS)).thenReturn(Map.of(
            "100", observed("100", MachineStatus.RUNNING, "active", "203.0.113.10"),
            "200", observed("200", MachineStatus.RUNNING, "active", "203.0.113.20")));

        SyncSummary first = service.reconcileAll();

        assertThat(first.synced()).isEqualTo(2);
        assertThat(first.results())
            .extracting(MachineSyncResult::name, MachineSyncResult::action)
            .containsExactly(
                org.assertj.core.groups.Tuple.tuple("web", ReconciliationAction.NO_CHANGE),
                org.assertj.core.groups.Tuple.tuple("db", ReconciliationAction.UPDATED),
                org.assertj.core.groups.Tuple.tuple("gone", ReconciliationAction.MARKED_TERMINATED_NOT_FOUND));
        assertThat(db.getActualStatus()).isEqualTo(MachineStatus.RUNNING);
        assertThat(db.getPublicIp()).isEqualTo("203.0.113.20");
        assertThat(gone.getActualStatus()).isEqualTo(MachineStatus.TERMINATED);
        assertThat(gone.getTerraformStateStatus()).isEqualTo(TerraformStateStatus.DRIFTED);
        assertThat(web.getLastSyncedAt()).isNull();

        SyncSummary second = service.reconcileAll();

        assertThat(second.synced()).isZero();
        assertThat(second.results())
            .extracting(MachineSyncResult::action)
            .containsOnly(ReconciliationAction.NO_CHANGE);
        verify(machineRepository, times(2)).save(any(Machine.class));
        verify(adapter, times(2)).describeResources(CREDENTIALS);
    }

    @Test
    void machineStoppedOutsideTheSystemIsDrift() {
        Machine web = machine("web", "100", MachineStatus.RUNNING);
        when(adapter.describeResources(CREDENTIALS)).thenReturn(Map.of(
            "100", observed("100", MachineStatus.STOPPED, "off", "203.0.113.10")));

        SyncSummary summary = service.reconcileAll();

        assertThat(summary.synced()).isEqualTo(1);
        assertThat(web.getActualStatus()).isEqualTo(MachineStatus.STOPPED);
        assertThat(web.getTerraformStateStatus()).isEqualTo(TerraformStateStatus.DRIFTED);
        verify(auditService).success(eq(AuditAction.MACHINE_DRIFT_DETECTED), any(), any(), eq(web.getId()), any());
    }

    @Test
    void unknownStateIsResolvedFromWhatTheProviderReports() {
        Machine healthy = machine("healthy", "100", MachineStatus.RUNNING);
        healthy.setTerraformStateStatus(TerraformStateStatus.UNKNOWN);
        Machine stopped = machine("stopped", "200", MachineStatus.RUNNING);
        stopped.setTerraformStateStatus(TerraformStateStatus.UNKNOWN);
        when(adapter.describeResources(CREDENTIALS)).thenReturn(Map.of(
            "100", observed("100", MachineStatus.RUNNING, "active", "203.0.113.10"),
            "200", observed("200", MachineStatus.STOPPED, "off", "203.0.113.10")));

        SyncSummary first = service.reconcileAll();

        assertThat(first.results())
            .extracting(MachineSyncResult::action)
            .containsExactly(ReconciliationAction.UPDATED, ReconciliationAction.UPDATED);
        assertThat(healthy.getTerraformStateStatus()).isEqualTo(TerraformStateStatus.IN_SYNC);
        assertThat(healthy.getActualStatus()).isEqualTo(MachineStatus.RUNNING);
        assertThat(stopped.getTerraformStateStatus()).isEqualTo(TerraformStateStatus.DRIFTED);
        verify(auditService).success(eq(AuditAction.MACHINE_STATUS_RECONCILED), any(), any(), eq(healthy.getId()), any());

        SyncSummary second = service.reconcileAll();

        assertThat(second.results())
            .filteredOn(r -> r.name().equals("healthy"))
            .extracting(MachineSyncResult::action)
            .containsExactly(ReconciliationAction.NO_CHANGE);
    }

    @Test
    void provisioningMachineWithoutResourceIdIsMarkedError() {
        Machine orphan = machine("orphan", null, MachineStatus.PROVISIONING);
        when(adapter.describeResources(CREDENTIALS)).thenReturn(Map.of());

        SyncSummary summary = service.reconcileAll();

        assertThat(summary.results()).singleElement()
            .extracting(MachineSyncResult::action)
            .isEqualTo(ReconciliationAction.MARKED_ERROR_NO_RESOURCE_ID);
        assertThat(orphan.getActualStatus()).isEqualTo(MachineStatus.ERROR);
    }

    @Test
    void machinesWithActiveDeploymentsAreSkipped() {
        Machine locked = machine("locked", "100", MachineStatus.RUNNING);
        Machine busy = machine("busy", "200", MachineStatus.RUNNING);
        locks.tryAcquire(locked.getId(), UUID.randomUUID());
        when(deploymentRepository.findByMachineIdAndStateIn(eq(busy.getId()), any()))
            .thenReturn(List.of(new Deployment()));
        when(adapter.describeResources(CREDENTIALS)).thenReturn(Map.of());

        SyncSummary summary = service.reconcileAll();

        assertThat(summary.results())
            .extracting(MachineSyncResult::action)
            .containsOnly(ReconciliationAction.SKIPPED_ACTIVE_DEPLOYMENT);
        assertThat(locked.getActualStatus()).isEqualTo(MachineStatus.RUNNING);
        assertThat(busy.getActualStatus()).isEqualTo(MachineStatus.RUNNING);
        assertThat(locks.isLocked(busy.getId())).isFalse();
        verify(machineRepository, never()).save(any(Machine.class));
    }

    @Test
    void providerFailureLeavesAccountMachinesUntouched() {
        Machine web = machine("web", "100", MachineStatus.RUNNING);
        when(adapter.describeResources(CREDENTIALS)).thenThrow(new ProviderException("DigitalOcean API error", 500));

        SyncSummary summary = service.reconcileAll();

        assertThat(summary.synced()).isZero();
        assertThat(summary.results()).singleElement()
            .satisfies(r -> {
                assertThat(r.action()).isEqualTo(ReconciliationAction.ERROR);
                assertThat(r.message()).contains("DigitalOcean API error");
            });
        assertThat(web.getActualStatus()).isEqualTo(MachineStatus.RUNNING);
    }

    @Test
    void accountWithoutCredentialsIsSkipped() {
        Machine web = machine("web", "100", MachineStatus.RUNNING);
        web.setProviderAccountId(UUID.randomUUID());

        SyncSummary summary = service.reconcileAll();

        assertThat(summary.results()).singleElement()
            .extracting(MachineSyncResult::action)
            .isEqualTo(ReconciliationAction.SKIPPED_NO_CREDENTIALS);
        verify(adapter, never()).describeResources(any());
    }

    private Machine machine(String name, String resourceId, MachineStatus status) {
        Machine machine = Machine.builder()
            .id(UUID.randomUUID())
            .name(name)
            .providerType(ProviderType.DIGITALOCEAN)
            .providerAccountId(ACCOUNT)
            .providerResourceId(resourceId)
            .region("nyc1")
            .size("s-1vcpu-1gb")
            .image("ubuntu-22-04-x64")
            .desiredStatus(MachineStatus.RUNNING)
            .actualStatus(status)
            .terraformStateStatus(TerraformStateStatus.IN_SYNC)
            .publicIp(status == MachineStatus.RUNNING ? "203.0.113.10" : null)
            .build();
        machines.add(machine);
        return machine;
    }

    private static ObservedResource observed(String id, MachineStatus status, String providerStatus, String publicIp) {
        return new ObservedResource(id, status, providerStatus, publicIp, null, "nyc1", "s-1vcpu-1gb");
    }
}
