package com.machina.provisioning.metrics;

import com.machina.provisioning.entity.DeploymentState;
import com.machina.provisioning.entity.DeploymentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Prometheus metrics for deployments and reconciliation.
 *
 * Exposes:
 * - deployments_total{type,state}: finished deployments by outcome
 * - deployment_duration_seconds{type}: start to finish
 * - deployments_rejected_total: dispatches refused because the worker queue was full
 * - reconciliation_runs_total{outcome} and reconciliation_drift_total
 */
@Component
@Slf4j
public class DeploymentMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter rejectedCounter;
    private final Counter driftCounter;

    public DeploymentMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.rejectedCounter = Counter.builder("deployments_rejected_total")
            .description("Deployments refused because the worker queue was full")
            .register(meterRegistry);
        this.driftCounter = Counter.builder("reconciliation_drift_total")
            .description("Machines found diverging from their last known state")
            .register(meterRegistry);
    }

    public void recordFinished(DeploymentType type, DeploymentState state, Duration duration) {
        Counter.builder("deployments_total")
            .description("Finished deployments")
            .tag("type", type.getValue())
            .tag("state", state.getValue())
            .register(meterRegistry)
            .increment();
        if (duration != null) {
            Timer.builder("deployment_duration_seconds")
                .description("Duration of deployments from start to terminal state")
                .tag("type", type.getValue())
                .register(meterRegistry)
                .record(duration);
        }
    }

    public void recordRejected() {
        rejectedCounter.increment();
        log.error("Deployment dispatch rejected: worker queue is full");
    }

    public void recordReconciliation(String outcome) {
        Counter.builder("reconciliation_runs_total")
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }

    public void recordDrift() {
        driftCounter.increment();
    }

    public void registerThreadPoolMetrics(String executorName, ThreadPoolExecutor executor) {
        Gauge.builder("thread_pool_active", executor, ThreadPoolExecutor::getActiveCount)
            .tag("executor", executorName)
            .description("Active thread count")
            .register(meterRegistry);
        Gauge.builder("thread_pool_queue_size", executor, e -> e.getQueue().size())
            .tag("executor", executorName)
            .description("Queue size")
            .register(meterRegistry);
    }
}
