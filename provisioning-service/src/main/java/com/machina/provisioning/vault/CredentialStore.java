package com.machina.provisioning.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machina.provisioning.entity.EncryptedCredential;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.DecryptionFailedException;
import com.machina.provisioning.exception.EncryptionException;
import com.machina.provisioning.exception.ValidationException;
import com.machina.provisioning.provider.credentials.ProviderCredentials;
import com.machina.provisioning.repository.EncryptedCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists provider credentials through the vault, one encrypted row per account.
 *
 * Ciphertext is bound to the owning account id, so a row copied to another account
 * fails to decrypt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {

    private final CredentialVault vault;
    private final EncryptedCredentialRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Convert a raw request payload into the variant the provider type selects, then validate it.
     */
    public ProviderCredentials parse(ProviderType providerType, Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new ValidationException("credentials are required", "credentials");
        }
        Class<? extends ProviderCredentials> variant = ProviderCredentials.variantFor(providerType);
        ProviderCredentials credentials;
        try {
            credentials = objectMapper.convertValue(raw, variant);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                "credentials do not match the " + providerType.getDisplayName() + " field set", "credentials");
        }
        return credentials.validated();
    }

    @Transactional
    public void store(UUID accountId, ProviderCredentials credentials) {
        byte[] plaintext;
        try {
            plaintext = objectMapper.writeValueAsBytes(credentials);
        } catch (IOException e) {
            throw new EncryptionException("Failed to serialize credentials", e);
        }

        EncryptedSecret secret;
        try {
            secret = vault.encrypt(plaintext, aad(accountId));
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }

        Base64.Encoder encoder = Base64.getEncoder();
        EncryptedCredential row = repository.findById(accountId)
            .orElseGet(() -> EncryptedCredential.builder().accountId(accountId).build());
        row.setAlgorithm(secret.algorithm());
        row.setKeyVersion(secret.keyVersion());
        row.setIv(encoder.encodeToString(secret.iv()));
        row.setCiphertext(encoder.encodeToString(secret.ciphertext()));
        row.setAuthTag(encoder.encodeToString(secret.authTag()));
        repository.save(row);
        log.info("Stored credentials for provider account {}", accountId);
    }

    /**
     * Decrypt the credentials of an account.
     *
     * @return empty when nothing is stored for the account
     * @throws DecryptionFailedException when stored ciphertext cannot be authenticated
     */
    @Transactional(readOnly = true)
    public Optional<ProviderCredentials> find(UUID accountId, ProviderType providerType) {
        return repository.findById(accountId).map(row -> decryptRow(row, providerType));
    }

    @Transactional
    public void delete(UUID accountId) {
        if (repository.existsById(accountId)) {
            repository.deleteById(accountId);
            log.info("Deleted credentials for provider account {}", accountId);
        }
    }

    private ProviderCredentials decryptRow(EncryptedCredential row, ProviderType providerType) {
        Base64.Decoder decoder = Base64.getDecoder();
        EncryptedSecret secret;
        try {
            secret = new EncryptedSecret(
                row.getAlgorithm(),
                row.getKeyVersion(),
                decoder.decode(row.getIv()),
                decoder.decode(row.getCiphertext()),
                decoder.decode(row.getAuthTag())
            );
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailedException("Stored secret is not valid Base64", e);
        }

        byte[] plaintext = vault.decrypt(secret, aad(row.getAccountId()));
        try {
            return objectMapper.readValue(plaintext, ProviderCredentials.variantFor(providerType));
        } catch (IOException e) {
            throw new DecryptionFailedException("Decrypted credentials are unreadable", e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private static byte[] aad(UUID accountId) {
        return ("provider-account:" + accountId).getBytes(StandardCharsets.UTF_8);
    }
}
