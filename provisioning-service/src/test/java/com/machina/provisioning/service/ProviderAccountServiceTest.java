package com.machina.provisioning.service;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.dto.request.CreateProviderAccountRequest;
import com.machina.provisioning.dto.request.UpdateProviderAccountRequest;
import com.machina.provisioning.dto.response.ProviderAccountResponse;
import com.machina.provisioning.dto.response.ProviderTypeResponse;
import com.machina.provisioning.entity.CredentialStatus;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ConflictException;
import com.machina.provisioning.exception.InvalidCredentialsException;
import com.machina.provisioning.exception.UnsupportedProviderException;
import com.machina.provisioning.provider.CredentialValidation;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.credentials.DigitalOceanCredentials;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.repository.ProviderAccountRepository;
import com.machina.provisioning.vault.CredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderAccountServiceTest {

    private static final Map<String, Object> RAW = Map.of("api_token", "dop_v1_abc");
    private static final DigitalOceanCredentials CREDENTIALS = new DigitalOceanCredentials("dop_v1_abc");

    @Mock
    private ProviderAccountRepository accountRepository;
    @Mock
    private MachineRepository machineRepository;
    @Mock
    private ProviderAdapter digitalOcean;
    @Mock
    private ProviderAdapter aws;
    @Mock
    private CredentialStore credentialStore;
    @Mock
    private AuditService auditService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ProviderAccountService service;

    @BeforeEach
    void setUp() {
        lenient().when(digitalOcean.providerType()).thenReturn(ProviderType.DIGITALOCEAN);
        lenient().when(digitalOcean.isSupported()).thenReturn(true);
        lenient().when(aws.providerType()).thenReturn(ProviderType.AWS);
        lenient().when(aws.isSupported()).thenReturn(false);
        lenient().when(accountRepository.save(any(ProviderAccount.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new ProviderAccountService(accountRepository, machineRepository,
            new ProviderAdapterRegistry(List.of(aws, digitalOcean)), credentialStore, auditService, transactionManager);
    }

    @Test
    void providerTypesListSupportFlag() {
        List<ProviderTypeResponse> types = service.listProviderTypes();

        assertThat(types).extracting(ProviderTypeResponse::supported).containsExactly(true, false);
    }

    @Test
    void createStoresVerifiedAccountWithCredentials() {
        UUID id = UUID.randomUUID();
        when(credentialStore.parse(ProviderType.DIGITALOCEAN, RAW)).thenReturn(CREDENTIALS);
        when(digitalOcean.validateCredentials(CREDENTIALS)).thenReturn(CredentialValidation.valid("ok"));
        when(accountRepository.saveAndFlush(any(ProviderAccount.class))).thenAnswer(inv -> {
            ProviderAccount account = inv.getArgument(0);
            account.setId(id);
            return account;
        });

        ProviderAccountResponse response = service.createAccount(
            new CreateProviderAccountRequest(ProviderType.DIGITALOCEAN, "Production", RAW), 5L);

        assertThat(response.providerAccountId()).isEqualTo(id);
        assertThat(response.credentialStatus()).isEqualTo(CredentialStatus.VALID);
        assertThat(response.lastVerifiedAt()).isNotNull();
        verify(credentialStore).store(id, CREDENTIALS);
        verify(auditService).success(eq(AuditAction.PROVIDER_ACCOUNT_CREATED), eq(5L), any(), eq(id), any());
    }

    @Test
    void rejectedCredentialsStoreNothing() {
        when(credentialStore.parse(ProviderType.DIGITALOCEAN, RAW)).thenReturn(CREDENTIALS);
        when(digitalOcean.validateCredentials(CREDENTIALS))
            .thenReturn(CredentialValidation.invalid("DigitalOcean API token is invalid or expired"));

        assertThatThrownBy(() -> service.createAccount(
            new CreateProviderAccountRequest(ProviderType.DIGITALOCEAN, "Production", RAW), 5L))
            .isInstanceOf(InvalidCredentialsException.class)
            .hasMessageContaining("invalid or expired");

        verify(accountRepository, never()).saveAndFlush(any());
        verify(credentialStore, never()).store(any(), any());
        verify(auditService).failure(eq(AuditAction.PROVIDER_ACCOUNT_CREATED), eq(5L), any(), any(), any());
    }

    @Test
    void catalogOnlyProviderCannotHoldAccounts() {
        when(credentialStore.parse(eq(ProviderType.AWS), any())).thenReturn(CREDENTIALS);

        assertThatThrownBy(() -> service.createAccount(
            new CreateProviderAccountRequest(ProviderType.AWS, "AWS", Map.of("access_key_id", "x")), 5L))
            .isInstanceOf(UnsupportedProviderException.class);
    }

    @Test
    void updateWithNewCredentialsRecordsCheckResult() {
        ProviderAccount account = account();
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(credentialStore.parse(ProviderType.DIGITALOCEAN, RAW)).thenReturn(CREDENTIALS);
        when(digitalOcean.validateCredentials(CREDENTIALS)).thenReturn(CredentialValidation.invalid("expired"));

        ProviderAccountResponse response = service.updateAccount(account.getId(),
            new UpdateProviderAccountRequest("Renamed", RAW), 5L);

        assertThat(response.label()).isEqualTo("Renamed");
        assertThat(response.credentialStatus()).isEqualTo(CredentialStatus.INVALID);
        verify(credentialStore).store(account.getId(), CREDENTIALS);
    }

    @Test
    void deleteInUseAccountConflicts() {
        ProviderAccount account = account();
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(machineRepository.existsByProviderAccountId(account.getId())).thenReturn(true);

        assertThatThrownBy(() -> service.deleteAccount(account.getId(), 5L))
            .isInstanceOf(ConflictException.class);
        assertThat(account.getDeletedAt()).isNull();
        verify(credentialStore, never()).delete(any());
    }

    @Test
    void deleteUnusedAccountRemovesCredentials() {
        ProviderAccount account = account();
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));

        service.deleteAccount(account.getId(), 5L);

        assertThat(account.getDeletedAt()).isNotNull();
        verify(credentialStore).delete(account.getId());
    }

    @Test
    void verifyPersistsInvalidBeforeThrowing() {
        ProviderAccount account = account();
        account.markVerified(true);
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(credentialStore.find(account.getId(), ProviderType.DIGITALOCEAN)).thenReturn(Optional.of(CREDENTIALS));
        when(digitalOcean.validateCredentials(CREDENTIALS)).thenReturn(CredentialValidation.invalid("revoked"));

        assertThatThrownBy(() -> service.verifyAccount(account.getId(), 5L))
            .isInstanceOf(InvalidCredentialsException.class);

        assertThat(account.getCredentialStatus()).isEqualTo(CredentialStatus.INVALID);
        verify(accountRepository).save(account);
    }

    @Test
    void verifyWithoutStoredCredentialsFails() {
        ProviderAccount account = account();
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));

        assertThatThrownBy(() -> service.verifyAccount(account.getId(), 5L))
            .isInstanceOf(InvalidCredentialsException.class)
            .hasMessageContaining("No credentials stored");
    }

    private static ProviderAccount account() {
        return ProviderAccount.builder()
            .id(UUID.randomUUID())
            .providerType(ProviderType.DIGITALOCEAN)
            .label("Production")
            .credentialStatus(CredentialStatus.UNCHECKED)
            .build();
    }
}
