package com.machina.provisioning.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateProviderAccountRequest(

    @Size(min = 1, max = 100, message = "Label must be between 1 and 100 characters")
    String label,

    Map<String, Object> credentials
) {

    @Override
    public String toString() {
        return "UpdateProviderAccountRequest[label=" + label + ", credentials=" + (credentials == null ? "unchanged" : "***") + "]";
    }
}
