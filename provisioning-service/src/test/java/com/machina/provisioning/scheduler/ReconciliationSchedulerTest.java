package com.machina.provisioning.scheduler;

import com.machina.provisioning.reconciliation.ReconciliationService;
import com.machina.provisioning.reconciliation.SyncSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private ReconciliationService reconciliationService;

    @Test
    void runsReconciliationAndClearsCorrelationId() {
        when(reconciliationService.reconcileAll()).thenReturn(new SyncSummary(0, List.of()));

        new ReconciliationScheduler(reconciliationService).reconcile();

        verify(reconciliationService).reconcileAll();
        assertThat(MDC.get("correlationId")).isNull();
    }

    @Test
    void failedRunDoesNotPropagate() {
        when(reconciliationService.reconcileAll()).thenThrow(new IllegalStateException("database down"));

        assertThatCode(() -> new ReconciliationScheduler(reconciliationService).reconcile())
            .doesNotThrowAnyException();
        assertThat(MDC.get("correlationId")).isNull();
    }
}
