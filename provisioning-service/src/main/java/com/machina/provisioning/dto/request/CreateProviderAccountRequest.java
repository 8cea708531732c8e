package com.machina.provisioning.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Credentials must match the provider's field set, e.g. {@code {"api_token": "..."}} for DigitalOcean.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateProviderAccountRequest(

    @NotNull(message = "Provider type is required")
    ProviderType providerType,

    @NotBlank(message = "Label is required")
    @Size(max = 100, message = "Label must not exceed 100 characters")
    String label,

    @NotEmpty(message = "Credentials are required")
    Map<String, Object> credentials
) {

    @Override
    public String toString() {
        return "CreateProviderAccountRequest[providerType=" + providerType + ", label=" + label + "]";
    }
}
