package com.machina.provisioning.entity;

import com.machina.provisioning.terraform.PlanSummary;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One attempted infrastructure change against a machine.
 *
 * Rows are mutated only through {@code DeploymentStateStore}; once the state is
 * terminal the row is never written again.
 */
@Entity
@Table(name = "deployments")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private DeploymentType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private DeploymentState state;

    @Column(name = "machine_id")
    private UUID machineId;

    @Column(name = "terraform_workspace", length = 128)
    private String terraformWorkspace;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "plan_summary", columnDefinition = "jsonb")
    private PlanSummary planSummary;

    @Column(name = "raw_plan", columnDefinition = "TEXT")
    private String rawPlan;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "parameters", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> parameters = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "outputs", columnDefinition = "jsonb")
    private Map<String, Object> outputs;

    @Column(name = "initiated_by")
    private Long initiatedBy;

    @Column(name = "approved_by")
    private Long approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Recorded when cancel arrives while an external process is running.
     * The job observes it and finalizes the deployment as cancelled once the process exits.
     */
    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

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
        if (this.state == null) {
            this.state = DeploymentState.QUEUED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return !state.isTerminal();
    }

    public String getStringParameter(String key) {
        Object value = parameters == null ? null : parameters.get(key);
        return value == null ? null : value.toString();
    }
}
