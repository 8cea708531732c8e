package com.machina.provisioning.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.Machine;
import com.machina.provisioning.entity.MachineStatus;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.entity.TerraformStateStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MachineResponse(
    UUID machineId,
    String name,
    ProviderType providerType,
    UUID providerAccountId,
    String providerResourceId,
    String region,
    String size,
    String image,
    MachineStatus desiredStatus,
    MachineStatus actualStatus,
    TerraformStateStatus terraformStateStatus,
    String terraformWorkspace,
    String publicIp,
    String privateIp,
    String firewallId,
    Map<String, String> tags,
    Instant lastSyncedAt,
    Long createdBy,
    Instant createdAt,
    Instant updatedAt
) {

    public static MachineResponse from(Machine machine) {
        return MachineResponse.builder()
            .machineId(machine.getId())
            .name(machine.getName())
            .providerType(machine.getProviderType())
            .providerAccountId(machine.getProviderAccountId())
            .providerResourceId(machine.getProviderResourceId())
            .region(machine.getRegion())
            .size(machine.getSize())
            .image(machine.getImage())
            .desiredStatus(machine.getDesiredStatus())
            .actualStatus(machine.getActualStatus())
            .terraformStateStatus(machine.getTerraformStateStatus())
            .terraformWorkspace(machine.getTerraformWorkspace())
            .publicIp(machine.getPublicIp())
            .privateIp(machine.getPrivateIp())
            .firewallId(machine.getFirewallId())
            .tags(machine.getTags())
            .lastSyncedAt(machine.getLastSyncedAt())
            .createdBy(machine.getCreatedBy())
            .createdAt(machine.getCreatedAt())
            .updatedAt(machine.getUpdatedAt())
            .build();
    }
}
