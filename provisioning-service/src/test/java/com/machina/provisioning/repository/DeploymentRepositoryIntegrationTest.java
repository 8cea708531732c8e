package com.machina.provisioning.repository;

import com.machina.provisioning.entity.Deployment;
import com.machina.provisioning.entity.DeploymentLogEntry;
import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.entity.TerraformStateStatus;
import com.machina.provisioning.terraform.PlanSummary;
import com.machina.provisioning.terraform.ResourceChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the Flyway schema against a real PostgreSQL, so the partial unique index and the
 * JSONB mappings are exercised as in production. Skipped when Docker is not available.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
class DeploymentRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("provisioning")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
    }

    @Autowired
    private ProviderAccountRepository accountRepository;
    @Autowired
    private MachineRepository machineRepository;
    @Autowired
    private DeploymentRepository deploymentRepository;
    @Autowired
    private DeploymentLogRepository logRepository;

    private Machine machine;

    @BeforeEach
    void setUp() {
        ProviderAccount account = accountRepository.saveAndFlush(ProviderAccount.builder()
            .providerType(ProviderType.DIGITALOCEAN)
            .label("Integration")
            .build());
        UUID machineId = UUID.randomUUID();
        machine = machineRepository.saveAndFlush(Machine.builder()
            .id(machineId)
            .name("web-1")
            .providerType(ProviderType.DIGITALOCEAN)
            .providerAccountId(account.getId())
            .region("nyc1")
            .size("s-1vcpu-1gb")
            .image("ubuntu-22-04-x64")
            .desiredStatus(MachineStatus.RUNNING)
            .actualStatus(MachineStatus.PROVISIONING)
            .terraformStateStatus(TerraformStateStatus.PENDING)
            .terraformWorkspace(Machine.workspaceNameFor(machineId))
            .tags(Map.of("env", "test"))
            .build());
    }

    @Test
    void secondActiveDeploymentForMachineViolatesIndex() {
        deploymentRepository.saveAndFlush(deployment(DeploymentType.CREATE, DeploymentState.APPLYING));

        assertThatThrownBy(() ->
            deploymentRepository.saveAndFlush(deployment(DeploymentType.REBOOT, DeploymentState.QUEUED)))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void finishedDeploymentsDoNotBlockNewOnes() {
        deploymentRepository.saveAndFlush(deployment(DeploymentType.CREATE, DeploymentState.SUCCEEDED));
        deploymentRepository.saveAndFlush(deployment(DeploymentType.REBOOT, DeploymentState.FAILED));

        Deployment active = deploymentRepository.saveAndFlush(deployment(DeploymentType.REFRESH, DeploymentState.QUEUED));

        assertThat(deploymentRepository.findByMachineIdAndStateIn(machine.getId(), DeploymentState.ACTIVE))
            .extracting(Deployment::getId)
            .containsExactly(active.getId());
    }

    @Test
    void planSummaryAndParametersRoundTripThroughJsonb() {
        Deployment deployment = deployment(DeploymentType.CREATE, DeploymentState.AWAITING_APPROVAL);
        deployment.setPlanSummary(PlanSummary.of(List.of(new ResourceChange(
            "digitalocean_droplet.machine", ResourceChange.Action.CREATE, "digitalocean_droplet", "machine"))));
        deployment.setParameters(Map.of("ssh_key_ids", List.of("1", "2"), "firewall_enabled", true));
        deploymentRepository.saveAndFlush(deployment);

        Deployment loaded = deploymentRepository.findById(deployment.getId()).orElseThrow();

        assertThat(loaded.getPlanSummary().resourcesToAdd()).isEqualTo(1);
        assertThat(loaded.getPlanSummary().resourceChanges()).singleElement()
            .extracting(ResourceChange::action)
            .isEqualTo(ResourceChange.Action.CREATE);
        assertThat(loaded.getParameters()).containsEntry("firewall_enabled", true);
    }

    @Test
    void searchFiltersByTypeStateAndWindow() {
        deploymentRepository.saveAndFlush(deployment(DeploymentType.CREATE, DeploymentState.SUCCEEDED));
        deploymentRepository.saveAndFlush(deployment(DeploymentType.REBOOT, DeploymentState.FAILED));

        Page<Deployment> failed = deploymentRepository.search(machine.getId(), null, DeploymentState.FAILED,
            Instant.EPOCH, Instant.parse("9999-12-31T23:59:59Z"), PageRequest.of(0, 10));
        Page<Deployment> future = deploymentRepository.search(null, null, null,
            Instant.now().plusSeconds(3600), Instant.parse("9999-12-31T23:59:59Z"), PageRequest.of(0, 10));

        assertThat(failed.getContent()).extracting(Deployment::getType).containsExactly(DeploymentType.REBOOT);
        assertThat(future.getTotalElements()).isZero();
    }

    @Test
    void logsComeBackInSequenceOrder() {
        Deployment deployment = deploymentRepository.saveAndFlush(
            deployment(DeploymentType.REFRESH, DeploymentState.PLANNING));
        for (long sequence : new long[] {2, 1, 3}) {
            logRepository.saveAndFlush(DeploymentLogEntry.builder()
                .deploymentId(deployment.getId())
                .sequence(sequence)
                .timestamp(Instant.now())
                .level(LogLevel.INFO)
                .source(LogSource.TERRAFORM)
                .message("line " + sequence)
                .build());
        }

        assertThat(logRepository.findByDeploymentIdOrderBySequenceAsc(deployment.getId()))
            .extracting(DeploymentLogEntry::getMessage)
            .containsExactly("line 1", "line 2", "line 3");
    }

    @Test
    void staleAwaitingApprovalIsFoundByCutoff() {
        deploymentRepository.saveAndFlush(deployment(DeploymentType.DESTROY, DeploymentState.AWAITING_APPROVAL));

        assertThat(deploymentRepository.findStaleInState(DeploymentState.AWAITING_APPROVAL,
            Instant.now().plusSeconds(60))).hasSize(1);
        assertThat(deploymentRepository.findStaleInState(DeploymentState.AWAITING_APPROVAL,
            Instant.now().minusSeconds(3600))).isEmpty();
        assertThat(deploymentRepository.findByStateInOrderByCreatedAtAsc(EnumSet.of(DeploymentState.QUEUED))).isEmpty();
    }

    private Deployment deployment(DeploymentType type, DeploymentState state) {
        return Deployment.builder()
            .id(UUID.randomUUID())
            .type(type)
            .state(state)
            .machineId(machine.getId())
            .terraformWorkspace(machine.getTerraformWorkspace())
            .build();
    }
}
