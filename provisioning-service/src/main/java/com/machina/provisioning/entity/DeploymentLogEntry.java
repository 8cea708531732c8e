package com.machina.provisioning.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One line of a deployment's ordered log. Sequence numbers start at 1 per deployment.
 */
@Entity
@Table(name = "deployment_logs")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "deployment_id", nullable = false)
    private UUID deploymentId;

    @Column(name = "sequence", nullable = false)
    private long sequence;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 10)
    private LogLevel level;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private LogSource source;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;
}
