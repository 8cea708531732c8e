package com.machina.provisioning.provider;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machina.provisioning.entity.ProviderType;

import java.util.List;

/**
 * Regions, sizes and images offered by one provider.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderOptions(
    ProviderType providerType,
    List<RegionOption> regions,
    List<SizeOption> sizes,
    List<ImageOption> images
) {
}
