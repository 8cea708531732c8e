package com.machina.provisioning.provider.credentials;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.ValidationException;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GcpCredentials(String projectId, String serviceAccountJson) implements ProviderCredentials {

    @Override
    public ProviderType providerType() {
        return ProviderType.GCP;
    }

    @Override
    public GcpCredentials validated() {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("project_id is required for GCP", "credentials.project_id");
        }
        if (serviceAccountJson == null || serviceAccountJson.isBlank()) {
            throw new ValidationException(
                "service_account_json is required for GCP", "credentials.service_account_json");
        }
        return new GcpCredentials(projectId.trim(), serviceAccountJson);
    }

    @Override
    public String toString() {
        return "GcpCredentials[projectId=" + projectId + "]";
    }
}
