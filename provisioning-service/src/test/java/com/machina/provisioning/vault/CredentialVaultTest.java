package com.machina.provisioning.vault;

import com.machina.provisioning.exception.DecryptionFailedException;
import com.machina.provisioning.exception.EncryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVaultTest {

    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(KEY, "unused", 1);
        vault.init();
    }

    @Test
    void decryptReturnsOriginalPayload() {
        SecureRandom random = new SecureRandom();
        for (int size : new int[] {0, 1, 31, 1024}) {
            byte[] payload = new byte[size];
            random.nextBytes(payload);

            EncryptedSecret secret = vault.encrypt(payload, "acct-1".getBytes(StandardCharsets.UTF_8));

            assertThat(vault.decrypt(secret, "acct-1".getBytes(StandardCharsets.UTF_8))).isEqualTo(payload);
        }
    }

    @Test
    void sameInputEncryptsDifferentlyEachTime() {
        EncryptedSecret first = vault.encrypt("dop_v1_token", "acct-1");
        EncryptedSecret second = vault.encrypt("dop_v1_token", "acct-1");

        assertThat(first.iv()).isNotEqualTo(second.iv());
        assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    }

    @Test
    void tamperedCiphertextFailsToDecrypt() {
        EncryptedSecret secret = vault.encrypt("dop_v1_token", "acct-1");
        byte[] tampered = secret.ciphertext().clone();
        tampered[0] ^= 0x01;

        EncryptedSecret modified = new EncryptedSecret(
            secret.algorithm(), secret.keyVersion(), secret.iv(), tampered, secret.authTag());

        assertThatThrownBy(() -> vault.decrypt(modified, "acct-1"))
            .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void tamperedTagFailsToDecrypt() {
        EncryptedSecret secret = vault.encrypt("dop_v1_token", "acct-1");
        byte[] tag = secret.authTag().clone();
        tag[tag.length - 1] ^= 0x10;

        EncryptedSecret modified = new EncryptedSecret(
            secret.algorithm(), secret.keyVersion(), secret.iv(), secret.ciphertext(), tag);

        assertThatThrownBy(() -> vault.decrypt(modified, "acct-1"))
            .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void ciphertextIsBoundToAssociatedData() {
        EncryptedSecret secret = vault.encrypt("dop_v1_token", "acct-1");

        assertThatThrownBy(() -> vault.decrypt(secret, "acct-2"))
            .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void otherKeyVersionIsRejected() {
        EncryptedSecret secret = vault.encrypt("dop_v1_token", "acct-1");
        EncryptedSecret older = new EncryptedSecret(
            secret.algorithm(), 0, secret.iv(), secret.ciphertext(), secret.authTag());

        assertThatThrownBy(() -> vault.decrypt(older, "acct-1"))
            .isInstanceOf(DecryptionFailedException.class)
            .hasMessageContaining("key version");
    }

    @Test
    void toStringDoesNotLeakBytes() {
        EncryptedSecret secret = vault.encrypt("dop_v1_token", "acct-1");

        assertThat(secret.toString()).doesNotContain("dop_v1").contains("AES-256-GCM");
    }

    @Test
    void generatesKeyFileWhenMissingAndReusesIt(@TempDir Path dir) throws Exception {
        Path keyFile = dir.resolve("keys/encryption.key");

        CredentialVault first = new CredentialVault("", keyFile.toString(), 1);
        first.init();
        EncryptedSecret secret = first.encrypt("payload", "acct");

        assertThat(Files.readString(keyFile)).hasSize(64);

        CredentialVault second = new CredentialVault("", keyFile.toString(), 1);
        second.init();
        assertThat(second.decrypt(secret, "acct")).isEqualTo("payload");
    }

    @Test
    void rejectsShortMasterKey() {
        CredentialVault invalid = new CredentialVault("abcd", "unused", 1);

        assertThatThrownBy(invalid::init).isInstanceOf(EncryptionException.class);
    }
}
