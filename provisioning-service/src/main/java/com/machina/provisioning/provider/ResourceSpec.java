package com.machina.provisioning.provider;

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Provider-neutral description of the compute resource a machine should be.
 */
@Builder(toBuilder = true)
public record ResourceSpec(
    UUID machineId,
    String name,
    String region,
    String size,
    String image,
    List<String> sshKeyIds,
    Map<String, String> tags,
    String userData,
    boolean firewallEnabled,
    List<FirewallRule> firewallRules
) {

    public ResourceSpec {
        sshKeyIds = sshKeyIds == null ? List.of() : List.copyOf(sshKeyIds);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        firewallRules = firewallRules == null ? List.of() : List.copyOf(firewallRules);
    }

    /**
     * Rules actually applied: the supplied ones, or SSH-only when none were given.
     */
    public List<FirewallRule> effectiveFirewallRules() {
        return firewallRules.isEmpty() ? List.of(FirewallRule.SSH_FROM_ANYWHERE) : firewallRules;
    }
}
