package com.machina.provisioning.deployment;

import com.machina.provisioning.entity.DeploymentLogEntry;
import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;

import java.time.Instant;

public record DeploymentLogLine(
    long sequence,
    Instant timestamp,
    LogLevel level,
    LogSource source,
    String message
) {

    public static DeploymentLogLine from(DeploymentLogEntry entry) {
        return new DeploymentLogLine(
            entry.getSequence(), entry.getTimestamp(), entry.getLevel(), entry.getSource(), entry.getMessage());
    }
}
