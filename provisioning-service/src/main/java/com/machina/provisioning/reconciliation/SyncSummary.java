package com.machina.provisioning.reconciliation;

import java.util.List;

/**
 * @param synced number of machines whose record was written
 */
public record SyncSummary(int synced, List<MachineSyncResult> results) {

    public static SyncSummary of(List<MachineSyncResult> results) {
        int synced = (int) results.stream().filter(r -> r.action().isChange()).count();
        return new SyncSummary(synced, List.copyOf(results));
    }
}
