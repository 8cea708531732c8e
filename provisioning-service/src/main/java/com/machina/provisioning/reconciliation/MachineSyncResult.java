package com.machina.provisioning.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;

import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineSyncResult(
    UUID machineId,
    String name,
    MachineStatus previousStatus,
    MachineStatus newStatus,
    ReconciliationAction action,
    String message
) {

    static MachineSyncResult unchanged(Machine machine, ReconciliationAction action, String message) {
        return new MachineSyncResult(machine.getId(), machine.getName(),
            machine.getActualStatus(), machine.getActualStatus(), action, message);
    }
}
