package com.machina.provisioning.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderTypeResponse(ProviderType type, String displayName, boolean supported) {}
