package com.machina.provisioning.scheduler;

import com.machina.provisioning.reconciliation.ReconciliationService;
import com.machina.provisioning.reconciliation.SyncSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Periodic reconciliation. Can be disabled with {@code reconciliation.scheduler.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval:PT5M}",
        initialDelayString = "${reconciliation.scheduler.initial-delay:PT1M}")
    @SchedulerLock(name = "machineReconciliation", lockAtMostFor = "10m", lockAtLeastFor = "30s")
    public void reconcile() {
        String correlationId = "SCHEDULER-RECONCILE-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        try {
            SyncSummary summary = reconciliationService.reconcileAll();
            log.info("Scheduled reconciliation updated {} of {} machines", summary.synced(), summary.results().size());
        } catch (Exception e) {
            log.error("Error in scheduled reconciliation: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
