package com.machina.provisioning.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.provider.FirewallRule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for provisioning a new machine.
 * Firewall rules default to SSH only; user data may use {{MACHINE_ID}} and {{SERVER_URL}}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateMachineRequest(

    @NotBlank(message = "Machine name is required")
    @Size(max = 63, message = "Machine name must not exceed 63 characters")
    @Pattern(regexp = "^[a-zA-Z0-9][a-zA-Z0-9.-]*$",
        message = "Machine name may only contain letters, digits, dots and hyphens")
    String name,

    @NotNull(message = "Provider account ID is required")
    UUID providerAccountId,

    @NotBlank(message = "Region is required")
    String region,

    @NotBlank(message = "Size is required")
    String size,

    @NotBlank(message = "Image is required")
    String image,

    Map<String, String> tags,

    List<String> sshKeyIds,

    @Size(max = 65536, message = "User data must not exceed 64 KiB")
    String userData,

    Boolean firewallEnabled,

    List<FirewallRule> firewallRules
) {}
