package com.machina.provisioning.vault;

import com.machina.provisioning.exception.DecryptionFailedException;
import com.machina.provisioning.exception.EncryptionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * AES-256-GCM vault for provider credentials.
 *
 * The master key is loaded once at startup, from {@code vault.master-key} (64 hex chars)
 * or from {@code vault.key-file}, which is created with a fresh random key if missing.
 * Every secret is bound to caller-supplied associated data so ciphertext cannot be moved
 * between owners.
 */
@Component
@Slf4j
public class CredentialVault {

    public static final String ALGORITHM_ID = "AES-256-GCM";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 128; // 128 bits
    private static final int GCM_TAG_BYTES = GCM_TAG_LENGTH / 8;
    private static final int KEY_BYTES = 32;

    private final String masterKeyHex;
    private final String keyFile;
    private final int keyVersion;
    private final SecureRandom secureRandom = new SecureRandom();

    private SecretKey masterKey;

    public CredentialVault(
        @Value("${vault.master-key:}") String masterKeyHex,
        @Value("${vault.key-file:.data/encryption.key}") String keyFile,
        @Value("${vault.key-version:1}") int keyVersion
    ) {
        this.masterKeyHex = masterKeyHex;
        this.keyFile = keyFile;
        this.keyVersion = keyVersion;
    }

    @PostConstruct
    public void init() {
        byte[] keyBytes = masterKeyHex != null && !masterKeyHex.isBlank()
            ? parseHexKey(masterKeyHex)
            : loadOrCreateKeyFile(Paths.get(keyFile));
        this.masterKey = new SecretKeySpec(keyBytes, "AES");
        Arrays.fill(keyBytes, (byte) 0);
        log.info("Credential vault initialized with {} (key version {})", ALGORITHM_ID, keyVersion);
    }

    /**
     * Encrypt a payload bound to the given associated data.
     *
     * @param plaintext raw secret bytes
     * @param associatedData binding (e.g. owning account id); must be supplied again on decrypt
     */
    public EncryptedSecret encrypt(byte[] plaintext, byte[] associatedData) {
        requireInitialized();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            if (associatedData != null) {
                cipher.updateAAD(associatedData);
            }

            // GCM appends the tag to the ciphertext; store it separately
            byte[] sealed = cipher.doFinal(plaintext);
            int split = sealed.length - GCM_TAG_BYTES;
            return new EncryptedSecret(
                ALGORITHM_ID,
                keyVersion,
                iv,
                Arrays.copyOfRange(sealed, 0, split),
                Arrays.copyOfRange(sealed, split, sealed.length)
            );
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt secret", e);
        }
    }

    public EncryptedSecret encrypt(String plaintext, String associatedData) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), utf8(associatedData));
    }

    /**
     * Decrypt and authenticate a secret. Never returns unauthenticated bytes.
     *
     * @throws DecryptionFailedException on tampering, wrong key version or wrong associated data
     */
    public byte[] decrypt(EncryptedSecret secret, byte[] associatedData) {
        requireInitialized();
        if (secret == null) {
            throw new DecryptionFailedException("No secret to decrypt");
        }
        if (!ALGORITHM_ID.equals(secret.algorithm())) {
            throw new DecryptionFailedException("Unsupported algorithm: " + secret.algorithm());
        }
        if (secret.keyVersion() != keyVersion) {
            throw new DecryptionFailedException(
                "Secret was encrypted with key version " + secret.keyVersion() + ", current is " + keyVersion);
        }
        if (secret.iv() == null || secret.iv().length != GCM_IV_LENGTH
            || secret.authTag() == null || secret.authTag().length != GCM_TAG_BYTES
            || secret.ciphertext() == null) {
            throw new DecryptionFailedException("Malformed secret");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, secret.iv()));
            if (associatedData != null) {
                cipher.updateAAD(associatedData);
            }
            byte[] sealed = new byte[secret.ciphertext().length + GCM_TAG_BYTES];
            System.arraycopy(secret.ciphertext(), 0, sealed, 0, secret.ciphertext().length);
            System.arraycopy(secret.authTag(), 0, sealed, secret.ciphertext().length, GCM_TAG_BYTES);
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new DecryptionFailedException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionFailedException("Failed to decrypt secret", e);
        }
    }

    public String decrypt(EncryptedSecret secret, String associatedData) {
        return new String(decrypt(secret, utf8(associatedData)), StandardCharsets.UTF_8);
    }

    public int getKeyVersion() {
        return keyVersion;
    }

    /**
     * Generate a random master key (for setup).
     *
     * @return 64-char hex string
     */
    public static String generateKey() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(KEY_BYTES * 8);
            return HexFormat.of().formatHex(keyGen.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to generate key", e);
        }
    }

    private void requireInitialized() {
        if (masterKey == null) {
            throw new IllegalStateException("Credential vault not initialized");
        }
    }

    private byte[] loadOrCreateKeyFile(Path path) {
        try {
            if (Files.exists(path)) {
                log.info("Loading vault master key from {}", path.toAbsolutePath());
                return parseHexKey(Files.readString(path, StandardCharsets.UTF_8));
            }

            if (path.toAbsolutePath().getParent() != null) {
                Files.createDirectories(path.toAbsolutePath().getParent());
            }
            String generated = generateKey();
            Files.writeString(path, generated, StandardCharsets.UTF_8);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
            }
            log.warn("No vault master key configured; generated a new one at {}", path.toAbsolutePath());
            return parseHexKey(generated);
        } catch (IOException e) {
            throw new EncryptionException("Failed to load vault key file " + path, e);
        }
    }

    private static byte[] parseHexKey(String hex) {
        String cleaned = hex.replaceAll("[\\s-]", "");
        byte[] keyBytes;
        try {
            keyBytes = HexFormat.of().parseHex(cleaned);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Vault master key is not valid hex", e);
        }
        if (keyBytes.length != KEY_BYTES) {
            throw new EncryptionException(
                "Vault master key must be 32 bytes (256 bits), got " + keyBytes.length);
        }
        return keyBytes;
    }

    private static byte[] utf8(String value) {
        return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
    }
}
