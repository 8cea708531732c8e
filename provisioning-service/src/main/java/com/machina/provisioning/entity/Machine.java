package com.machina.provisioning.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.SQLRestriction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A provisioned (or provisioning) compute instance.
 *
 * desiredStatus is user intent; actualStatus is what was last observed and is only
 * written by deployment completion or by reconciliation.
 */
@Entity
@Table(name = "machines")
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Machine {

    /**
     * Assigned by the service before persist so the workspace name can be derived from it.
     */
    @Id
    private UUID id;

    @Column(name = "name", nullable = false, length = 63)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider_type", nullable = false, length = 20)
    private ProviderType providerType;

    @Column(name = "provider_account_id", nullable = false)
    private UUID providerAccountId;

    /**
     * Provider-assigned id (droplet id for DigitalOcean). NULL until the first apply succeeds.
     */
    @Column(name = "provider_resource_id", length = 128)
    private String providerResourceId;

    @Column(name = "region", nullable = false, length = 64)
    private String region;

    @Column(name = "size", nullable = false, length = 64)
    private String size;

    @Column(name = "image", nullable = false, length = 128)
    private String image;

    @Enumerated(EnumType.STRING)
    @Column(name = "desired_status", nullable = false, length = 20)
    private MachineStatus desiredStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "actual_status", nullable = false, length = 20)
    private MachineStatus actualStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "terraform_state_status", nullable = false, length = 20)
    private TerraformStateStatus terraformStateStatus;

    @Column(name = "terraform_workspace", nullable = false, length = 128)
    private String terraformWorkspace;

    @Column(name = "public_ip", length = 45)
    private String publicIp;

    @Column(name = "private_ip", length = 45)
    private String privateIp;

    @Column(name = "firewall_id", length = 128)
    private String firewallId;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
    private Map<String, String> tags = new HashMap<>();

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

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
        if (this.terraformStateStatus == null) {
            this.terraformStateStatus = TerraformStateStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static String workspaceNameFor(UUID machineId) {
        return "machine-" + machineId;
    }

    /**
     * Soft delete after a successful destroy deployment.
     */
    public void markDestroyed() {
        this.actualStatus = MachineStatus.TERMINATED;
        this.desiredStatus = MachineStatus.TERMINATED;
        this.terraformStateStatus = TerraformStateStatus.IN_SYNC;
        this.publicIp = null;
        this.privateIp = null;
        this.deletedAt = Instant.now();
    }
}
