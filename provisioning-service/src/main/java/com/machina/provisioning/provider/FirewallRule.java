package com.machina.provisioning.provider;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Inbound firewall rule. portRange is a single port, a range ("8000-8100") or "all".
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FirewallRule(String protocol, String portRange, List<String> sourceAddresses) {

    public static final FirewallRule SSH_FROM_ANYWHERE =
        new FirewallRule("tcp", "22", List.of("0.0.0.0/0", "::/0"));
}
