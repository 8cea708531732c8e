package com.machina.provisioning.terraform;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-deployment handle on the external process currently running, so a cancel request
 * from another thread can signal it.
 */
@Slf4j
public class ExecutionContext {

    @Getter
    private final UUID deploymentId;
    @Getter
    private final LogSink logSink;
    private final AtomicReference<Process> current = new AtomicReference<>();
    private volatile Instant cancelledAt;

    public ExecutionContext(UUID deploymentId, LogSink logSink) {
        this.deploymentId = deploymentId;
        this.logSink = logSink;
    }

    public boolean isCancelled() {
        return cancelledAt != null;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    /**
     * Record cancellation and send a termination signal to the running process, if any.
     * The caller does not wait; the runner observes the exit.
     */
    public void cancel() {
        if (cancelledAt != null) {
            return;
        }
        cancelledAt = Instant.now();
        Process process = current.get();
        if (process != null && process.isAlive()) {
            log.info("Sending termination signal to pid {} for deployment {}", process.pid(), deploymentId);
            process.destroy();
        }
    }

    void attach(Process process) {
        current.set(process);
        if (isCancelled()) {
            process.destroy();
        }
    }

    void detach() {
        current.set(null);
    }
}
