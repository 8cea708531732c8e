package com.machina.provisioning.deployment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs deployment jobs on the bounded deployment pool.
 *
 * The pool uses AbortPolicy, so {@link #dispatch(UUID)} throws
 * {@link java.util.concurrent.RejectedExecutionException} synchronously when it is full.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeploymentDispatcher {

    private final DeploymentJob job;

    @Async("deploymentTaskExecutor")
    public CompletableFuture<Void> dispatch(UUID deploymentId) {
        log.debug("Executing deployment {}", deploymentId);
        job.execute(deploymentId);
        return CompletableFuture.completedFuture(null);
    }
}
