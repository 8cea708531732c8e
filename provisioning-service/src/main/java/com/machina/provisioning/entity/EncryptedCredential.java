package com.machina.provisioning.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Vault ciphertext for one provider account. All byte fields are Base64.
 */
@Entity
@Table(name = "encrypted_credentials")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedCredential {

    @Id
    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "algorithm", nullable = false, length = 32)
    private String algorithm;

    @Column(name = "key_version", nullable = false)
    private int keyVersion;

    @Column(name = "iv", nullable = false, length = 32)
    private String iv;

    @Column(name = "ciphertext", nullable = false, columnDefinition = "TEXT")
    private String ciphertext;

    @Column(name = "auth_tag", nullable = false, length = 32)
    private String authTag;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
