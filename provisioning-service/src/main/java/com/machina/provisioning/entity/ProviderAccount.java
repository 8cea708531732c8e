package com.machina.provisioning.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.util.UUID;

/**
 * A configured set of credentials for one provider.
 *
 * The credential payload itself lives only in {@code encrypted_credentials}, keyed by this id.
 */
@Entity
@Table(name = "provider_accounts")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider_type", nullable = false, length = 20)
    private ProviderType providerType;

    @Column(name = "label", nullable = false, length = 100)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(name = "credential_status", nullable = false, length = 20)
    private CredentialStatus credentialStatus;

    @Column(name = "last_verified_at")
    private Instant lastVerifiedAt;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.credentialStatus == null) {
            this.credentialStatus = CredentialStatus.UNCHECKED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public void markVerified(boolean valid) {
        this.credentialStatus = valid ? CredentialStatus.VALID : CredentialStatus.INVALID;
        this.lastVerifiedAt = Instant.now();
    }

    public void softDelete() {
        this.deletedAt = Instant.now();
    }
}
