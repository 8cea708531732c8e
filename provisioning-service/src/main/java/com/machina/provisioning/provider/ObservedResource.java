package com.machina.provisioning.provider;

import com.machina.provisioning.entity.MachineStatus;

/**
 * What a provider reports about one resource, with its status already normalized.
 *
 * @param providerStatus the raw provider vocabulary, kept for logs and audit
 */
public record ObservedResource(
    String resourceId,
    MachineStatus status,
    String providerStatus,
    String publicIp,
    String privateIp,
    String region,
    String size
) {
}
