package com.machina.provisioning.service;

import com.machina.provisioning.audit.AuditAction;
import com.machina.provisioning.audit.AuditService;
import com.machina.provisioning.dto.request.CreateProviderAccountRequest;
import com.machina.provisioning.dto.request.UpdateProviderAccountRequest;
import com.machina.provisioning.dto.response.ProviderAccountResponse;
import com.machina.provisioning.dto.response.ProviderTypeResponse;
import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ConflictException;
import com.machina.provisioning.exception.InvalidCredentialsException;
import com.machina.provisioning.exception.ResourceNotFoundException;
import com.machina.provisioning.provider.CredentialValidation;
import com.machina.provisioning.provider.ProviderAdapter;
import com.machina.provisioning.provider.ProviderAdapterRegistry;
import com.machina.provisioning.provider.ProviderOptions;
import com.machina.provisioning.provider.credentials.ProviderCredentials;
import com.machina.provisioning.repository.MachineRepository;
import com.machina.provisioning.repository.ProviderAccountRepository;
import com.machina.provisioning.vault.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Provider catalog and provider account lifecycle.
 *
 * Phase separation: credentials are parsed and checked against the provider first,
 * then the account row and its encrypted credentials are written in one short transaction.
 */
@Service
@Slf4j
public class ProviderAccountService {

    private final ProviderAccountRepository accountRepository;
    private final MachineRepository machineRepository;
    private final ProviderAdapterRegistry adapters;
    private final CredentialStore credentialStore;
    private final AuditService auditService;
    private final TransactionTemplate transactionTemplate;

    public ProviderAccountService(
        ProviderAccountRepository accountRepository,
        MachineRepository machineRepository,
        ProviderAdapterRegistry adapters,
        CredentialStore credentialStore,
        AuditService auditService,
        PlatformTransactionManager transactionManager
    ) {
        this.accountRepository = accountRepository;
        this.machineRepository = machineRepository;
        this.adapters = adapters;
        this.credentialStore = credentialStore;
        this.auditService = auditService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public List<ProviderTypeResponse> listProviderTypes() {
        return adapters.all().stream()
            .sorted(Comparator.comparing(ProviderAdapter::providerType))
            .map(a -> new ProviderTypeResponse(a.providerType(), a.providerType().getDisplayName(), a.isSupported()))
            .toList();
    }

    public ProviderOptions getOptions(ProviderType providerType) {
        return adapters.get(providerType).options();
    }

    public List<ProviderAccountResponse> listAccounts(ProviderType providerType) {
        List<ProviderAccount> accounts = providerType == null
            ? accountRepository.findAllByOrderByCreatedAtDesc()
            : accountRepository.findByProviderTypeOrderByCreatedAtDesc(providerType);
        return accounts.stream().map(ProviderAccountResponse::from).toList();
    }

    public ProviderAccountResponse getAccount(UUID accountId) {
        return ProviderAccountResponse.from(load(accountId));
    }

    /**
     * @throws InvalidCredentialsException if the provider rejects the credentials; nothing is stored then
     */
    public ProviderAccountResponse createAccount(CreateProviderAccountRequest request, Long userId) {
        ProviderCredentials credentials = credentialStore.parse(request.providerType(), request.credentials());
        ProviderAdapter adapter = adapters.getSupported(request.providerType());
        CredentialValidation validation = adapter.validateCredentials(credentials);
        if (!validation.valid()) {
            auditService.failure(AuditAction.PROVIDER_ACCOUNT_CREATED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
                null, Map.of("provider_type", request.providerType().getValue(), "reason", String.valueOf(validation.message())));
            throw new InvalidCredentialsException(validation.message());
        }

        ProviderAccount saved = transactionTemplate.execute(status -> {
            ProviderAccount account = ProviderAccount.builder()
                .providerType(request.providerType())
                .label(request.label())
                .createdBy(userId)
                .build();
            account.markVerified(true);
            ProviderAccount persisted = accountRepository.saveAndFlush(account);
            credentialStore.store(persisted.getId(), credentials);
            return persisted;
        });

        log.info("User {} created {} provider account {}", userId, request.providerType().getValue(), saved.getId());
        auditService.success(AuditAction.PROVIDER_ACCOUNT_CREATED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
            saved.getId(), Map.of("provider_type", saved.getProviderType().getValue(), "label", saved.getLabel()));
        return ProviderAccountResponse.from(saved);
    }

    /**
     * New credentials are stored and re-checked; the result of the check becomes the account's status.
     */
    public ProviderAccountResponse updateAccount(UUID accountId, UpdateProviderAccountRequest request, Long userId) {
        ProviderAccount account = load(accountId);
        ProviderCredentials credentials = null;
        CredentialValidation validation = null;
        if (request.credentials() != null) {
            credentials = credentialStore.parse(account.getProviderType(), request.credentials());
            validation = adapters.getSupported(account.getProviderType()).validateCredentials(credentials);
        }

        ProviderCredentials newCredentials = credentials;
        CredentialValidation result = validation;
        ProviderAccount saved = transactionTemplate.execute(status -> {
            ProviderAccount current = load(accountId);
            if (request.label() != null) {
                current.setLabel(request.label());
            }
            if (newCredentials != null) {
                credentialStore.store(accountId, newCredentials);
                current.markVerified(result.valid());
            }
            return accountRepository.save(current);
        });

        auditService.success(AuditAction.PROVIDER_ACCOUNT_UPDATED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
            accountId, Map.of(
                "label_changed", request.label() != null,
                "credentials_changed", newCredentials != null,
                "credential_status", saved.getCredentialStatus().getValue()));
        return ProviderAccountResponse.from(saved);
    }

    /**
     * @throws ConflictException while machines still reference the account
     */
    public void deleteAccount(UUID accountId, Long userId) {
        load(accountId);
        if (machineRepository.existsByProviderAccountId(accountId)) {
            throw new ConflictException("Provider account " + accountId + " is still used by machines");
        }
        transactionTemplate.executeWithoutResult(status -> {
            ProviderAccount account = load(accountId);
            account.softDelete();
            accountRepository.save(account);
            credentialStore.delete(accountId);
        });
        log.info("User {} deleted provider account {}", userId, accountId);
        auditService.success(AuditAction.PROVIDER_ACCOUNT_DELETED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
            accountId, Map.of());
    }

    /**
     * Re-check stored credentials and persist the outcome. A rejected check is stored as
     * invalid before {@link InvalidCredentialsException} is thrown.
     */
    public ProviderAccountResponse verifyAccount(UUID accountId, Long userId) {
        ProviderAccount account = load(accountId);
        ProviderCredentials credentials = credentialStore.find(accountId, account.getProviderType())
            .orElseThrow(() -> new InvalidCredentialsException("No credentials stored for this account"));
        CredentialValidation validation = adapters.getSupported(account.getProviderType())
            .validateCredentials(credentials);

        ProviderAccount saved = transactionTemplate.execute(status -> {
            ProviderAccount current = load(accountId);
            current.markVerified(validation.valid());
            return accountRepository.save(current);
        });

        Map<String, Object> details = Map.of("credential_status", saved.getCredentialStatus().getValue());
        if (!validation.valid()) {
            auditService.failure(AuditAction.CREDENTIALS_VERIFIED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
                accountId, details);
            throw new InvalidCredentialsException(validation.message());
        }
        auditService.success(AuditAction.CREDENTIALS_VERIFIED, userId, AuditService.TARGET_PROVIDER_ACCOUNT,
            accountId, details);
        return ProviderAccountResponse.from(saved);
    }

    private ProviderAccount load(UUID accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new ResourceNotFoundException("Provider account", accountId));
    }
}
