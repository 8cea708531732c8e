package com.machina.provisioning.deployment;

import com.machina.provisioning.terraform.ExecutionContext;
import com.machina.provisioning.terraform.LogSink;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution contexts of deployments whose job is currently running on this instance.
 */
@Component
public class ExecutionRegistry {

    private final Map<UUID, ExecutionContext> running = new ConcurrentHashMap<>();

    public ExecutionContext register(UUID deploymentId, LogSink sink) {
        ExecutionContext context = new ExecutionContext(deploymentId, sink);
        ExecutionContext previous = running.putIfAbsent(deploymentId, context);
        if (previous != null) {
            throw new IllegalStateException("Deployment " + deploymentId + " is already running");
        }
        return context;
    }

    public Optional<ExecutionContext> find(UUID deploymentId) {
        return Optional.ofNullable(running.get(deploymentId));
    }

    public void unregister(UUID deploymentId) {
        running.remove(deploymentId);
    }
}
