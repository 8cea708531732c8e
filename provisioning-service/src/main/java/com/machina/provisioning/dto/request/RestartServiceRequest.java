package com.machina.provisioning.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RestartServiceRequest(

    @NotBlank(message = "Service name is required")
    @Pattern(regexp = "^[A-Za-z0-9@._-]{1,128}$", message = "Invalid service name")
    String serviceName
) {}
