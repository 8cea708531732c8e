package com.machina.provisioning.vault;

/**
 * Opaque ciphertext plus what is needed to decrypt it.
 *
 * Produced only by {@link CredentialVault}. toString never exposes the byte contents.
 */
public record EncryptedSecret(
    String algorithm,
    int keyVersion,
    byte[] iv,
    byte[] ciphertext,
    byte[] authTag
) {

    @Override
    public String toString() {
        return "EncryptedSecret[algorithm=" + algorithm + ", keyVersion=" + keyVersion + "]";
    }
}
